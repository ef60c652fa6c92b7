package com.aegis.screening.watchlist;

import com.aegis.screening.domain.WatchlistRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Holds the watchlist as one immutable list swapped atomically on reload
 */
@Slf4j
public class InMemoryWatchlistStore implements WatchlistStore {

    private volatile List<WatchlistRecord> records = List.of();
    private volatile List<WatchlistRecord> active = List.of();

    @Override
    public List<WatchlistRecord> activeRecords() {
        return active;
    }

    @Override
    public int size() {
        return records.size();
    }

    /**
     * Replaces the whole snapshot. Screening calls already running keep the previous one.
     */
    public synchronized void replaceAll(List<WatchlistRecord> newRecords) {
        List<WatchlistRecord> snapshot = newRecords.stream()
            .filter(Objects::nonNull)
            .toList();
        List<WatchlistRecord> activeSnapshot = snapshot.stream()
            .filter(WatchlistRecord::isActive)
            .toList();
        this.records = snapshot;
        this.active = activeSnapshot;
        log.info("Watchlist snapshot replaced: {} records, {} active", snapshot.size(), activeSnapshot.size());
    }
}
