package com.williamcallahan.movie_discovery_engine.service;

import com.williamcallahan.movie_discovery_engine.config.OfflineCacheProperties;
import com.williamcallahan.movie_discovery_engine.config.PreferenceProperties;
import com.williamcallahan.movie_discovery_engine.model.CatalogItem;
import com.williamcallahan.movie_discovery_engine.model.CatalogPage;
import com.williamcallahan.movie_discovery_engine.model.CatalogQuery;
import com.williamcallahan.movie_discovery_engine.monitoring.MetricsService;
import com.williamcallahan.movie_discovery_engine.service.cache.OfflineCatalogCache;
import com.williamcallahan.movie_discovery_engine.service.cache.RequestCoalescer;
import com.williamcallahan.movie_discovery_engine.service.preference.PreferenceScoringEngine;
import com.williamcallahan.movie_discovery_engine.service.transport.TransportException;
import com.williamcallahan.movie_discovery_engine.testutil.MutableClock;
import com.williamcallahan.movie_discovery_engine.types.CatalogCategory;
import com.williamcallahan.movie_discovery_engine.types.Judgment;
import com.williamcallahan.movie_discovery_engine.types.TransportFailure;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;

import static com.williamcallahan.movie_discovery_engine.testutil.CatalogFixtures.item;
import static com.williamcallahan.movie_discovery_engine.testutil.CatalogFixtures.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.InstanceOfAssertFactories.type;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CatalogDiscoveryServiceTest {

    private static final int ACTION = 28;
    private static final int COMEDY = 35;

    @Mock
    private CatalogApiClient catalogApiClient;

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private OfflineCatalogCache offlineCache;
    private PreferenceScoringEngine scoringEngine;
    private CoalescingCatalogService coalescingCatalogService;
    private CatalogDiscoveryService discoveryService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-06-01T12:00:00Z");
        registry = new SimpleMeterRegistry();
        MetricsService metrics = new MetricsService(registry);
        offlineCache = new OfflineCatalogCache(null, clock, 500, Duration.ofDays(7), metrics);
        scoringEngine = new PreferenceScoringEngine(new PreferenceProperties(), clock, null);
        coalescingCatalogService = new CoalescingCatalogService(
            catalogApiClient,
            new RequestCoalescer<>("pages", clock, metrics),
            new RequestCoalescer<>("items", clock, metrics));
        discoveryService = new CatalogDiscoveryService(
            coalescingCatalogService, offlineCache, scoringEngine, new OfflineCacheProperties(), metrics, clock);
    }

    private static TransportException offline() {
        return TransportException.noConnectivity(new ConnectException("Network is unreachable"));
    }

    @Test
    void liveBrowseWritesFirstPageThrough() {
        when(catalogApiClient.fetch(CatalogQuery.category(CatalogCategory.POPULAR, 1)))
            .thenReturn(Mono.just(page(1, item(3), item(1), item(2))));

        StepVerifier.create(discoveryService.browse(CatalogCategory.POPULAR, 1))
            .assertNext(result -> {
                assertThat(result.isFromCache()).isFalse();
                assertThat(result.getItems()).extracting(CatalogItem::getId).containsExactly(3, 1, 2);
            })
            .verifyComplete();

        assertThat(offlineCache.getCategory(CatalogCategory.POPULAR)).extracting(CatalogItem::getId).containsExactly(3, 1, 2);
    }

    @Test
    void laterPagesAreNotWrittenThrough() {
        when(catalogApiClient.fetch(CatalogQuery.category(CatalogCategory.POPULAR, 2)))
            .thenReturn(Mono.just(page(2, item(21), item(22))));

        StepVerifier.create(discoveryService.browse(CatalogCategory.POPULAR, 2))
            .expectNextCount(1)
            .verifyComplete();

        assertThat(offlineCache.categoryNames()).isEmpty();
    }

    @Test
    @DisplayName("a network failure after a successful browse serves the cached category")
    void browseFallsBackToOfflineCopy() {
        when(catalogApiClient.fetch(CatalogQuery.category(CatalogCategory.POPULAR, 1)))
            .thenReturn(Mono.just(page(1, item(5), item(6))))
            .thenReturn(Mono.error(offline()));

        discoveryService.browse(CatalogCategory.POPULAR, 1).block();
        clock.advance(Duration.ofMinutes(11));

        StepVerifier.create(discoveryService.browse(CatalogCategory.POPULAR, 1))
            .assertNext(result -> {
                assertThat(result.isFromCache()).isTrue();
                assertThat(result.getItems()).extracting(CatalogItem::getId).containsExactly(5, 6);
            })
            .verifyComplete();

        verify(catalogApiClient, times(2)).fetch(any());
        assertThat(registry.counter("catalog.offline.fallbacks").count()).isEqualTo(1.0);
    }

    @Test
    void memoizedPageIsServedWithoutTheNetwork() {
        when(catalogApiClient.fetch(CatalogQuery.category(CatalogCategory.TOP_RATED, 1)))
            .thenReturn(Mono.just(page(1, item(1))));

        discoveryService.browse(CatalogCategory.TOP_RATED, 1).block();
        clock.advance(Duration.ofMinutes(30));
        discoveryService.browse(CatalogCategory.TOP_RATED, 1).block();

        verify(catalogApiClient, times(1)).fetch(any());
    }

    @Test
    void failureWithoutOfflineCopyPropagatesTheTransportError() {
        when(catalogApiClient.fetch(any())).thenReturn(Mono.error(offline()));

        StepVerifier.create(discoveryService.browse(CatalogCategory.TRENDING, 1))
            .expectErrorSatisfies(error -> assertThat(error)
                .asInstanceOf(type(TransportException.class))
                .extracting(TransportException::getKind)
                .isEqualTo(TransportFailure.NO_CONNECTIVITY))
            .verify();
    }

    @Test
    void searchResultsAreAvailableOfflineForEquivalentText() {
        when(catalogApiClient.fetch(any()))
            .thenReturn(Mono.just(page(1, item(11), item(12))))
            .thenReturn(Mono.error(offline()));

        discoveryService.search("Star Wars", 1).block();
        clock.advance(Duration.ofMinutes(2));

        StepVerifier.create(discoveryService.search("  star   WARS ", 1))
            .assertNext(result -> {
                assertThat(result.isFromCache()).isTrue();
                assertThat(result.getItems()).extracting(CatalogItem::getId).containsExactly(11, 12);
            })
            .verifyComplete();
        assertThat(offlineCache.categoryNames()).containsExactly("search_star_wars");
    }

    @Test
    @DisplayName("distinct non-Latin searches keep separate results and separate offline indices")
    void nonLatinSearchesDoNotShareResults() {
        when(catalogApiClient.fetch(CatalogQuery.search("東京", 1))).thenReturn(Mono.just(page(1, item(1))));
        when(catalogApiClient.fetch(CatalogQuery.search("大阪", 1)))
            .thenReturn(Mono.just(page(1, item(2))))
            .thenReturn(Mono.error(offline()));

        StepVerifier.create(discoveryService.search("東京", 1))
            .assertNext(result -> assertThat(result.getItems()).extracting(CatalogItem::getId).containsExactly(1))
            .verifyComplete();
        StepVerifier.create(discoveryService.search("大阪", 1))
            .assertNext(result -> assertThat(result.getItems()).extracting(CatalogItem::getId).containsExactly(2))
            .verifyComplete();
        assertThat(offlineCache.categoryNames()).containsExactly("search_東京", "search_大阪");

        clock.advance(Duration.ofMinutes(2));
        StepVerifier.create(discoveryService.search("大阪", 1))
            .assertNext(result -> {
                assertThat(result.isFromCache()).isTrue();
                assertThat(result.getItems()).extracting(CatalogItem::getId).containsExactly(2);
            })
            .verifyComplete();
    }

    @Test
    void emptySearchResultsAreNotCached() {
        when(catalogApiClient.fetch(any())).thenReturn(Mono.just(CatalogPage.empty(1)));

        StepVerifier.create(discoveryService.search("nothing matches", 1))
            .assertNext(result -> assertThat(result.getItems()).isEmpty())
            .verifyComplete();
        assertThat(offlineCache.categoryNames()).isEmpty();
    }

    @Test
    void detailsFallBackToTheCachedItem() {
        when(catalogApiClient.fetchItem(550))
            .thenReturn(Mono.just(item(550, "Fight Club", 8.4, List.of(18))))
            .thenReturn(Mono.error(offline()));

        discoveryService.details(550).block();
        coalescingCatalogService.clearMemoized();

        StepVerifier.create(discoveryService.details(550))
            .assertNext(movie -> assertThat(movie.getTitle()).isEqualTo("Fight Club"))
            .verifyComplete();
        verify(catalogApiClient, times(2)).fetchItem(550);
    }

    @Test
    void detailsWithoutCachedItemPropagateTheError() {
        when(catalogApiClient.fetchItem(1)).thenReturn(Mono.error(offline()));

        StepVerifier.create(discoveryService.details(1))
            .expectError(TransportException.class)
            .verify();
    }

    @Test
    @DisplayName("the discovery feed hides judged items and ranks the rest by preference")
    void discoverFiltersAndRanks() {
        discoveryService.recordSwipe(item(1, "Judged", 7.0, List.of(ACTION)), Judgment.LIKED);
        when(catalogApiClient.fetch(CatalogQuery.category(CatalogCategory.NOW_PLAYING, 1)))
            .thenReturn(Mono.just(page(1,
                item(1, "Judged", 7.0, List.of(ACTION)),
                item(2, "Comedy", 7.0, List.of(COMEDY)),
                item(3, "Action", 7.0, List.of(ACTION)))));

        StepVerifier.create(discoveryService.discover(CatalogCategory.NOW_PLAYING))
            .assertNext(result -> {
                assertThat(result.isFromCache()).isFalse();
                assertThat(result.getItems()).extracting(CatalogItem::getId).containsExactly(3, 2);
            })
            .verifyComplete();
    }

    @Test
    void prefetchSkipsFailingCategories() {
        when(catalogApiClient.fetch(CatalogQuery.category(CatalogCategory.TRENDING, 1)))
            .thenReturn(Mono.just(page(1, item(1), item(2))));
        when(catalogApiClient.fetch(CatalogQuery.category(CatalogCategory.POPULAR, 1)))
            .thenReturn(Mono.error(TransportException.serverError(503)));
        when(catalogApiClient.fetch(CatalogQuery.category(CatalogCategory.UPCOMING, 1)))
            .thenReturn(Mono.just(page(1, item(3))));

        StepVerifier.create(discoveryService.prefetchForOffline(
                List.of(CatalogCategory.TRENDING, CatalogCategory.POPULAR, CatalogCategory.UPCOMING)))
            .assertNext(stored -> assertThat(stored)
                .containsExactly(
                    entry(CatalogCategory.TRENDING, 2),
                    entry(CatalogCategory.UPCOMING, 1)))
            .verifyComplete();

        assertThat(offlineCache.hasValid(CatalogCategory.TRENDING)).isTrue();
        assertThat(offlineCache.hasValid(CatalogCategory.POPULAR)).isFalse();
    }

    @Test
    @DisplayName("concurrent browses of the same page share one network request")
    void concurrentBrowsesAreCoalesced() {
        Sinks.One<CatalogPage> gate = Sinks.one();
        when(catalogApiClient.fetch(CatalogQuery.category(CatalogCategory.TRENDING, 1))).thenReturn(gate.asMono());

        StepVerifier.create(Mono.zip(
                discoveryService.browse(CatalogCategory.TRENDING, 1),
                discoveryService.browse(CatalogCategory.TRENDING, 1)))
            .then(() -> gate.tryEmitValue(page(1, item(1), item(2))))
            .assertNext(both -> assertThat(both.getT1().getItems()).isEqualTo(both.getT2().getItems()))
            .verifyComplete();

        verify(catalogApiClient, times(1)).fetch(any());
    }

    @Test
    void cancellingAPendingQueryFailsWaitersAsCancelled() {
        when(catalogApiClient.fetch(any())).thenReturn(Mono.never());
        CatalogQuery query = CatalogQuery.category(CatalogCategory.RECENT, 1);

        StepVerifier.create(discoveryService.browse(CatalogCategory.RECENT, 1))
            .then(() -> assertThat(coalescingCatalogService.cancel(query)).isTrue())
            .expectErrorSatisfies(error -> assertThat(((TransportException) error).getKind())
                .isEqualTo(TransportFailure.CANCELLED))
            .verify(Duration.ofSeconds(5));

        assertThat(coalescingCatalogService.pendingCount()).isZero();
    }
}
