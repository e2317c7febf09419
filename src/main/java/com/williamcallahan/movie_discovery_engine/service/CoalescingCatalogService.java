package com.williamcallahan.movie_discovery_engine.service;

import com.williamcallahan.movie_discovery_engine.model.CatalogItem;
import com.williamcallahan.movie_discovery_engine.model.CatalogPage;
import com.williamcallahan.movie_discovery_engine.model.CatalogQuery;
import com.williamcallahan.movie_discovery_engine.service.cache.RequestCoalescer;
import com.williamcallahan.movie_discovery_engine.service.transport.TransportException;
import com.williamcallahan.movie_discovery_engine.types.CatalogCategory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Routes catalog fetches through request coalescers so identical concurrent requests hit the network once.
 * Category pages use the category's memo window, searches the coalescer default, details a full day.
 */
@Service
public class CoalescingCatalogService {

    static final Duration DETAILS_MEMO_TTL = Duration.ofHours(24);

    private final CatalogApiClient catalogApiClient;
    private final RequestCoalescer<String, CatalogPage> pageCoalescer;
    private final RequestCoalescer<Integer, CatalogItem> itemCoalescer;

    public CoalescingCatalogService(CatalogApiClient catalogApiClient,
                                    @Qualifier("pageRequestCoalescer") RequestCoalescer<String, CatalogPage> pageCoalescer,
                                    @Qualifier("itemRequestCoalescer") RequestCoalescer<Integer, CatalogItem> itemCoalescer) {
        this.catalogApiClient = catalogApiClient;
        this.pageCoalescer = pageCoalescer;
        this.itemCoalescer = itemCoalescer;
    }

    public Mono<CatalogPage> fetch(CatalogQuery query) {
        Duration ttl = query.categoryOptional()
            .map(CatalogCategory::getMemoTtl)
            .orElse(RequestCoalescer.DEFAULT_TTL);
        return pageCoalescer.coalesce(query.cacheKey(), ttl, () -> catalogApiClient.fetch(query))
            .onErrorMap(CancellationException.class, e -> TransportException.cancelled());
    }

    public Mono<CatalogItem> fetchItem(int itemId) {
        return itemCoalescer.coalesce(itemId, DETAILS_MEMO_TTL, () -> catalogApiClient.fetchItem(itemId))
            .onErrorMap(CancellationException.class, e -> TransportException.cancelled());
    }

    /**
     * Cancel the shared in-flight request for a query; every waiter receives CANCELLED
     */
    public boolean cancel(CatalogQuery query) {
        return pageCoalescer.cancel(query.cacheKey());
    }

    public int cancelAll() {
        return pageCoalescer.cancelAll() + itemCoalescer.cancelAll();
    }

    public int pendingCount() {
        return pageCoalescer.pendingCount() + itemCoalescer.pendingCount();
    }

    /**
     * @return number of memoized results removed across both coalescers
     */
    public int clearExpired() {
        return pageCoalescer.clearExpired() + itemCoalescer.clearExpired();
    }

    public void clearMemoized() {
        pageCoalescer.clear();
        itemCoalescer.clear();
    }
}
