package com.williamcallahan.movie_discovery_engine.scheduler;

import com.williamcallahan.movie_discovery_engine.config.OfflineCacheProperties;
import com.williamcallahan.movie_discovery_engine.service.CoalescingCatalogService;
import com.williamcallahan.movie_discovery_engine.service.cache.OfflineCatalogCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheMaintenanceSchedulerTest {

    @Mock
    private OfflineCatalogCache offlineCache;

    @Mock
    private CoalescingCatalogService coalescingCatalogService;

    private OfflineCacheProperties properties;
    private CacheMaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new OfflineCacheProperties();
        properties.setMaintenanceEnabled(true);
        scheduler = new CacheMaintenanceScheduler(offlineCache, coalescingCatalogService, properties);
    }

    @Test
    @DisplayName("Maintenance evicts expired offline entries and clears expired memo entries")
    void runMaintenance_evictsAndClears() {
        when(offlineCache.evictExpired()).thenReturn(3);
        when(coalescingCatalogService.clearExpired()).thenReturn(2);

        scheduler.runMaintenance();

        verify(offlineCache).evictExpired();
        verify(coalescingCatalogService).clearExpired();
    }

    @Test
    @DisplayName("Disabled maintenance touches nothing")
    void runMaintenance_disabled() {
        properties.setMaintenanceEnabled(false);

        scheduler.runMaintenance();

        verifyNoInteractions(offlineCache, coalescingCatalogService);
    }

    @Test
    @DisplayName("A failing run is logged and does not escape the scheduler thread")
    void runMaintenance_failureIsContained() {
        when(offlineCache.evictExpired()).thenThrow(new IllegalStateException("disk gone"));

        assertThatCode(() -> scheduler.runMaintenance()).doesNotThrowAnyException();

        verifyNoInteractions(coalescingCatalogService);
    }
}
