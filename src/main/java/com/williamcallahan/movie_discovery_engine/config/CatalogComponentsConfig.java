/**
 * Configuration for the catalog access components that are not plain services
 * It handles:
 * - Providing the shared Clock so expiry and retention can be tested
 * - Creating one request coalescer for pages and one for item details
 * - Creating the offline cache with its snapshot file
 * - Creating the preference engine with its signal journal
 *
 * @author William Callahan
 */
package com.williamcallahan.movie_discovery_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.movie_discovery_engine.model.CatalogItem;
import com.williamcallahan.movie_discovery_engine.model.CatalogPage;
import com.williamcallahan.movie_discovery_engine.monitoring.MetricsService;
import com.williamcallahan.movie_discovery_engine.service.cache.CacheSnapshot;
import com.williamcallahan.movie_discovery_engine.service.cache.OfflineCatalogCache;
import com.williamcallahan.movie_discovery_engine.service.cache.RequestCoalescer;
import com.williamcallahan.movie_discovery_engine.service.preference.PreferenceScoringEngine;
import com.williamcallahan.movie_discovery_engine.service.preference.SignalJournal;
import com.williamcallahan.movie_discovery_engine.util.JsonFileStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class CatalogComponentsConfig {

    private static final long MAX_MEMOIZED_PAGES = 500;
    private static final long MAX_MEMOIZED_ITEMS = 2_000;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RequestCoalescer<String, CatalogPage> pageRequestCoalescer(Clock clock, MetricsService metricsService) {
        return new RequestCoalescer<>("pages", RequestCoalescer.DEFAULT_TTL, MAX_MEMOIZED_PAGES, clock, metricsService);
    }

    @Bean
    public RequestCoalescer<Integer, CatalogItem> itemRequestCoalescer(Clock clock, MetricsService metricsService) {
        return new RequestCoalescer<>("items", RequestCoalescer.DEFAULT_TTL, MAX_MEMOIZED_ITEMS, clock, metricsService);
    }

    @Bean
    public OfflineCatalogCache offlineCatalogCache(OfflineCacheProperties properties,
                                                   ObjectMapper objectMapper,
                                                   Clock clock,
                                                   MetricsService metricsService) {
        JsonFileStore<CacheSnapshot> store = new JsonFileStore<>(Path.of(properties.getFile()), objectMapper, CacheSnapshot.class);
        return new OfflineCatalogCache(store, clock, properties.getMaxEntries(), properties.getMaxDiskAge(), metricsService);
    }

    @Bean
    public PreferenceScoringEngine preferenceScoringEngine(PreferenceProperties properties,
                                                           ObjectMapper objectMapper,
                                                           Clock clock) {
        SignalJournal journal = null;
        if (properties.isJournalEnabled()) {
            journal = new SignalJournal(new JsonFileStore<>(Path.of(properties.getJournalFile()), objectMapper, SignalJournal.Document.class));
        }
        return new PreferenceScoringEngine(properties, clock, journal);
    }
}
