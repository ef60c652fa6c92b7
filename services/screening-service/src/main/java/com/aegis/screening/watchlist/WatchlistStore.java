package com.aegis.screening.watchlist;

import com.aegis.screening.domain.WatchlistRecord;

import java.util.List;

/**
 * Source of watchlist records. Callers get an immutable snapshot that does
 * not change while a screening call is in progress.
 */
public interface WatchlistStore {

    /**
     * Snapshot of every record whose {@code active} flag is set
     */
    List<WatchlistRecord> activeRecords();

    int size();
}
