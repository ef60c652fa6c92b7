package com.aegis.screening.watchlist;

import com.aegis.common.exception.ErrorCode;
import com.aegis.screening.domain.WatchlistRecord;
import com.aegis.screening.exception.ScreeningException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads a JSON array of watchlist records and installs it into the store
 */
@Slf4j
@RequiredArgsConstructor
public class WatchlistSeedLoader {

    private static final TypeReference<List<WatchlistRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public List<WatchlistRecord> read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ScreeningException(ErrorCode.INT_WATCHLIST_LOAD_FAILED,
                "Watchlist seed not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            List<WatchlistRecord> records = objectMapper.readValue(in, RECORD_LIST);
            return records != null ? records : List.of();
        } catch (IOException e) {
            throw new ScreeningException(ErrorCode.INT_WATCHLIST_LOAD_FAILED,
                "Watchlist seed at " + location + " could not be parsed", e);
        }
    }

    public int load(String location, InMemoryWatchlistStore store) {
        List<WatchlistRecord> records = read(location);
        store.replaceAll(records);
        log.info("Loaded {} watchlist records from {}", records.size(), location);
        return records.size();
    }
}
