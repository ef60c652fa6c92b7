package com.aegis.screening.watchlist;

import com.aegis.screening.config.ScreeningProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Builds the in-memory watchlist and seeds it before any consumer starts
 */
@Slf4j
@Configuration
public class WatchlistConfiguration {

    @Bean
    public WatchlistSeedLoader watchlistSeedLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new WatchlistSeedLoader(objectMapper, resourceLoader);
    }

    @Bean
    public InMemoryWatchlistStore watchlistStore(WatchlistSeedLoader seedLoader, ScreeningProperties properties) {
        InMemoryWatchlistStore store = new InMemoryWatchlistStore();
        ScreeningProperties.WatchlistConfig config = properties.getWatchlist();
        if (config.isLoadOnStartup()) {
            seedLoader.load(config.getSeedLocation(), store);
        } else {
            log.warn("Watchlist seed loading disabled, screening starts with an empty watchlist");
        }
        return store;
    }
}
