/**
 * Entry point for catalog browsing that keeps working offline
 *
 * @author William Callahan
 *
 * Features:
 * - Coalesced network fetch first, offline cache on any transport failure
 * - Writes first pages of categories and searches through to the offline cache
 * - Caches item details individually
 * - Applies preference filtering and ranking for discovery feeds
 * - Prefetches categories for offline use, tolerating individual failures
 */
package com.williamcallahan.movie_discovery_engine.service;

import com.williamcallahan.movie_discovery_engine.config.OfflineCacheProperties;
import com.williamcallahan.movie_discovery_engine.model.CatalogItem;
import com.williamcallahan.movie_discovery_engine.model.CatalogQuery;
import com.williamcallahan.movie_discovery_engine.model.CatalogResult;
import com.williamcallahan.movie_discovery_engine.model.SwipeSignal;
import com.williamcallahan.movie_discovery_engine.monitoring.MetricsService;
import com.williamcallahan.movie_discovery_engine.service.cache.OfflineCatalogCache;
import com.williamcallahan.movie_discovery_engine.service.preference.PreferenceScoringEngine;
import com.williamcallahan.movie_discovery_engine.service.transport.TransportException;
import com.williamcallahan.movie_discovery_engine.types.CatalogCategory;
import com.williamcallahan.movie_discovery_engine.types.Judgment;
import com.williamcallahan.movie_discovery_engine.util.ExternalApiLogger;
import com.williamcallahan.movie_discovery_engine.util.LoggingUtils;
import com.williamcallahan.movie_discovery_engine.util.SearchQueryUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class CatalogDiscoveryService {

    private static final String API_NAME = "CatalogAPI";

    private final CoalescingCatalogService coalescingCatalogService;
    private final OfflineCatalogCache offlineCache;
    private final PreferenceScoringEngine scoringEngine;
    private final OfflineCacheProperties cacheProperties;
    private final MetricsService metricsService;
    private final Clock clock;

    public CatalogDiscoveryService(CoalescingCatalogService coalescingCatalogService,
                                   OfflineCatalogCache offlineCache,
                                   PreferenceScoringEngine scoringEngine,
                                   OfflineCacheProperties cacheProperties,
                                   MetricsService metricsService,
                                   Clock clock) {
        this.coalescingCatalogService = coalescingCatalogService;
        this.offlineCache = offlineCache;
        this.scoringEngine = scoringEngine;
        this.cacheProperties = cacheProperties;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Fetch a category page, falling back to the offline copy when the network fails
     *
     * @param category category to browse
     * @param page page number, starting at 1
     * @return live or cached items; errors with the original TransportException when no cached copy exists
     */
    public Mono<CatalogResult> browse(CatalogCategory category, int page) {
        CatalogQuery query = CatalogQuery.category(category, page);
        return coalescingCatalogService.fetch(query)
            .publishOn(Schedulers.boundedElastic())
            .map(result -> {
                if (page == 1) {
                    offlineCache.putCategory(category, result.getItems());
                }
                return CatalogResult.live(result.getItems());
            })
            .onErrorResume(TransportException.class,
                e -> fallback(category.cacheName(), query.cacheKey(), e));
    }

    /**
     * Free-text search. First pages are kept offline under a per-query index.
     *
     * @param text search text; blank text yields an empty live result
     * @param page page number, starting at 1
     * @return live or cached items
     */
    public Mono<CatalogResult> search(String text, int page) {
        CatalogQuery query = CatalogQuery.search(text, page);
        if (SearchQueryUtils.isBlank(text)) {
            return coalescingCatalogService.fetch(query).map(result -> CatalogResult.live(result.getItems()));
        }
        String indexName = SearchQueryUtils.searchIndexName(text);
        return coalescingCatalogService.fetch(query)
            .publishOn(Schedulers.boundedElastic())
            .map(result -> {
                if (page == 1 && !result.getItems().isEmpty()) {
                    offlineCache.putCategory(indexName, result.getItems(), cacheProperties.getSearchTtl());
                }
                return CatalogResult.live(result.getItems());
            })
            .onErrorResume(TransportException.class, e -> fallback(indexName, query.cacheKey(), e));
    }

    /**
     * Item details, served from the offline cache when the network fails
     *
     * @param itemId catalog id
     * @return the item; errors with the original TransportException when it was never cached
     */
    public Mono<CatalogItem> details(int itemId) {
        return coalescingCatalogService.fetchItem(itemId)
            .publishOn(Schedulers.boundedElastic())
            .doOnNext(item -> offlineCache.put(item, cacheProperties.getDetailsTtl()))
            .onErrorResume(TransportException.class, e -> offlineCache.get(itemId)
                .map(item -> {
                    metricsService.incrementOfflineFallback();
                    ExternalApiLogger.logOfflineFallback(log, API_NAME, "details", String.valueOf(itemId), 1);
                    return Mono.just(item);
                })
                .orElseGet(() -> Mono.error(e)));
    }

    /**
     * Discovery feed: first page of a category with judged items removed, ranked by preference
     */
    public Mono<CatalogResult> discover(CatalogCategory category) {
        return browse(category, 1)
            .map(result -> {
                List<CatalogItem> unseen = scoringEngine.filterJudged(result.getItems());
                return new CatalogResult(scoringEngine.rank(unseen), result.isFromCache());
            });
    }

    /**
     * Record a swipe on an item at the current time
     */
    public void recordSwipe(CatalogItem item, Judgment judgment) {
        scoringEngine.record(SwipeSignal.of(item, judgment, clock.instant()));
    }

    /**
     * Download the first page of each category into the offline cache
     * - Categories are fetched one after another
     * - A failing category is logged and skipped
     *
     * @param categories categories to download
     * @return number of items stored per category that succeeded
     */
    public Mono<Map<CatalogCategory, Integer>> prefetchForOffline(Collection<CatalogCategory> categories) {
        return Flux.fromIterable(categories)
            .concatMap(category -> coalescingCatalogService.fetch(CatalogQuery.category(category, 1))
                .publishOn(Schedulers.boundedElastic())
                .map(result -> {
                    offlineCache.putCategory(category, result.getItems());
                    return Map.entry(category, result.getItems().size());
                })
                .onErrorResume(TransportException.class, e -> {
                    LoggingUtils.warn(log, e, "Offline prefetch skipped category {}", category);
                    return Mono.empty();
                }))
            .collect(LinkedHashMap<CatalogCategory, Integer>::new, (map, entry) -> map.put(entry.getKey(), entry.getValue()))
            .map(map -> (Map<CatalogCategory, Integer>) map)
            .doOnNext(map -> log.info("Offline prefetch stored {} of {} categories", map.size(), categories.size()));
    }

    private Mono<CatalogResult> fallback(String indexName, String description, TransportException failure) {
        List<CatalogItem> cached = offlineCache.getCategory(indexName);
        if (cached.isEmpty()) {
            log.warn("No offline copy of '{}' after {}", indexName, failure.getKind());
            return Mono.error(failure);
        }
        metricsService.incrementOfflineFallback();
        ExternalApiLogger.logOfflineFallback(log, API_NAME, failure.getKind().name(), description, cached.size());
        return Mono.just(CatalogResult.cached(cached));
    }
}
