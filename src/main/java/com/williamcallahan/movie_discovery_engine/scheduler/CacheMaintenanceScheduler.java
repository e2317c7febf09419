/**
 * Scheduler for offline cache and memo housekeeping
 *
 * @author William Callahan
 *
 * Features:
 * - Evicts expired offline cache entries and their dangling index ids
 * - Clears expired memoized results from the request coalescers
 * - Can be disabled through configuration
 */
package com.williamcallahan.movie_discovery_engine.scheduler;

import com.williamcallahan.movie_discovery_engine.config.OfflineCacheProperties;
import com.williamcallahan.movie_discovery_engine.service.CoalescingCatalogService;
import com.williamcallahan.movie_discovery_engine.service.cache.OfflineCatalogCache;
import com.williamcallahan.movie_discovery_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class CacheMaintenanceScheduler {

    private final OfflineCatalogCache offlineCache;
    private final CoalescingCatalogService coalescingCatalogService;
    private final OfflineCacheProperties properties;

    public CacheMaintenanceScheduler(OfflineCatalogCache offlineCache,
                                     CoalescingCatalogService coalescingCatalogService,
                                     OfflineCacheProperties properties) {
        this.offlineCache = offlineCache;
        this.coalescingCatalogService = coalescingCatalogService;
        this.properties = properties;
    }

    /**
     * Runs at the configured fixed delay, starting one interval after startup
     */
    @Scheduled(fixedDelayString = "${app.offline-cache.maintenance-interval:PT15M}",
               initialDelayString = "${app.offline-cache.maintenance-interval:PT15M}")
    public void runMaintenance() {
        if (!properties.isMaintenanceEnabled()) {
            log.debug("Cache maintenance disabled, skipping run");
            return;
        }
        try {
            int evicted = offlineCache.evictExpired();
            int memoCleared = coalescingCatalogService.clearExpired();
            log.info("Cache maintenance complete: {} offline entr{} evicted, {} memoized result(s) cleared",
                evicted, evicted == 1 ? "y" : "ies", memoCleared);
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Cache maintenance run failed");
        }
    }
}
