/**
 * Client for the remote movie metadata service
 *
 * @author William Callahan
 *
 * Features:
 * - Fetches category listings, free-text searches and single-item details
 * - Enforces a timeout on every individual attempt
 * - Retries timeouts, rate limits and 5xx with exponential backoff and jitter
 * - Honors Retry-After on rate-limit responses
 * - Surfaces client, decoding and trust failures immediately
 * - Never touches the offline cache; callers decide what to persist
 */
package com.williamcallahan.movie_discovery_engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.movie_discovery_engine.config.CatalogApiProperties;
import com.williamcallahan.movie_discovery_engine.model.CatalogItem;
import com.williamcallahan.movie_discovery_engine.model.CatalogPage;
import com.williamcallahan.movie_discovery_engine.model.CatalogQuery;
import com.williamcallahan.movie_discovery_engine.monitoring.MetricsService;
import com.williamcallahan.movie_discovery_engine.service.transport.CatalogTransport;
import com.williamcallahan.movie_discovery_engine.service.transport.TransportException;
import com.williamcallahan.movie_discovery_engine.service.transport.TransportRequest;
import com.williamcallahan.movie_discovery_engine.service.transport.TransportResponse;
import com.williamcallahan.movie_discovery_engine.types.CatalogCategory;
import com.williamcallahan.movie_discovery_engine.types.TransportFailure;
import com.williamcallahan.movie_discovery_engine.util.ExternalApiLogger;
import com.williamcallahan.movie_discovery_engine.util.RetryBackoff;
import com.williamcallahan.movie_discovery_engine.util.SearchQueryUtils;
import com.williamcallahan.movie_discovery_engine.util.TransportErrorClassifier;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

@Service
@Slf4j
public class CatalogApiClient {

    private static final String API_NAME = "CatalogAPI";

    private final CatalogTransport transport;
    private final ObjectMapper objectMapper;
    private final CatalogApiProperties properties;
    private final MetricsService metricsService;
    private final RetryBackoff backoff;
    private final Clock clock;

    /**
     * Constructs CatalogApiClient with backoff settings taken from configuration
     *
     * @param transport outbound HTTP primitive
     * @param objectMapper JSON decoder
     * @param properties API, timeout and retry settings
     * @param metricsService metrics sink
     * @param clock clock used for date-relative queries
     */
    @Autowired
    public CatalogApiClient(CatalogTransport transport,
                            ObjectMapper objectMapper,
                            CatalogApiProperties properties,
                            MetricsService metricsService,
                            Clock clock) {
        this(transport, objectMapper, properties, metricsService, clock,
            new RetryBackoff(
                properties.getRetry().getBaseDelay(),
                properties.getRetry().getMaxDelay(),
                properties.getRetry().getJitterFactor()));
    }

    CatalogApiClient(CatalogTransport transport,
                     ObjectMapper objectMapper,
                     CatalogApiProperties properties,
                     MetricsService metricsService,
                     Clock clock,
                     RetryBackoff backoff) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.metricsService = metricsService;
        this.clock = clock;
        this.backoff = backoff;
    }

    /**
     * Fetches one page for a category or search query
     *
     * @param query category or search request
     * @return the decoded page, or a TransportException error
     */
    public Mono<CatalogPage> fetch(CatalogQuery query) {
        if (query.isSearch() && SearchQueryUtils.isBlank(query.getSearchText())) {
            ExternalApiLogger.logApiCallSkipped(log, API_NAME, "search", "blank query");
            return Mono.just(CatalogPage.empty(query.getPage()));
        }
        TransportRequest request = buildRequest(query);
        Duration timeout = query.isSearch() ? properties.getSearchTimeout() : properties.getRequestTimeout();
        String description = query.cacheKey();
        return execute(request, timeout, description, body -> decode(body, CatalogPage.class))
            .doOnNext(page -> ExternalApiLogger.logApiCallSuccess(log, API_NAME, request.getOperation(), description, page.getItems().size()));
    }

    /**
     * Fetches full details for a single item
     *
     * @param itemId catalog id
     * @return the decoded item, or a TransportException error
     */
    public Mono<CatalogItem> fetchItem(int itemId) {
        TransportRequest request = withCommonParams(TransportRequest.builder())
            .path("/movie/" + itemId)
            .operation("details")
            .build();
        String description = "details_" + itemId;
        return execute(request, properties.getRequestTimeout(), description, body -> decode(body, CatalogItem.class))
            .doOnNext(item -> ExternalApiLogger.logApiCallSuccess(log, API_NAME, "details", description, 1));
    }

    /**
     * Fetches a range of category pages with bounded concurrency
     * - Items are concatenated in page order regardless of completion order
     * - The first failure fails the whole range
     *
     * @param category category to page through
     * @param firstPage first page, inclusive
     * @param lastPage last page, inclusive
     * @param maxConcurrent maximum pages in flight at once
     * @return all items from the range
     */
    public Mono<List<CatalogItem>> fetchPages(CatalogCategory category, int firstPage, int lastPage, int maxConcurrent) {
        if (lastPage < firstPage) {
            return Mono.just(List.of());
        }
        return Flux.range(firstPage, lastPage - firstPage + 1)
            .flatMapSequential(page -> fetch(CatalogQuery.category(category, page)), Math.max(1, maxConcurrent))
            .concatMapIterable(CatalogPage::getItems)
            .collectList();
    }

    private <T> Mono<T> execute(TransportRequest request, Duration timeout, String description, Function<String, T> decoder) {
        if (!properties.hasKey()) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, request.getOperation(), description, "no API key configured");
            return Mono.error(new TransportException(TransportFailure.CLIENT_ERROR, "No catalog API key configured", 401, null, null));
        }
        int maxRetries = Math.max(0, properties.getRetry().getMaxRetries());
        return Mono.defer(() -> {
            AtomicLong attempts = new AtomicLong();
            Timer.Sample sample = metricsService.startApiTimer();
            return Mono.defer(() -> {
                    ExternalApiLogger.logApiCallAttempt(log, API_NAME, request.getOperation(), description, attempts.getAndIncrement());
                    return transport.send(request).timeout(timeout);
                })
                .onErrorMap(TransportErrorClassifier::toTransportException)
                .flatMap(response -> toResult(response, decoder))
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    TransportException failure = TransportErrorClassifier.toTransportException(signal.failure());
                    long retryIndex = signal.totalRetries();
                    if (!failure.isRetryable() || retryIndex >= maxRetries) {
                        return Mono.error(failure);
                    }
                    if (failure.getKind() == TransportFailure.RATE_LIMITED) {
                        metricsService.incrementApiRateLimit();
                    }
                    Duration delay = backoff.delayFor(retryIndex, failure.getRetryAfter().orElse(null));
                    metricsService.incrementApiRetry();
                    ExternalApiLogger.logRetryScheduled(log, API_NAME, request.getOperation(), retryIndex + 1, delay.toMillis(), failure.getMessage());
                    return Mono.delay(delay).thenReturn(retryIndex);
                })))
                .doOnError(TransportException.class, e -> {
                    metricsService.recordApiFailure(e.getKind());
                    ExternalApiLogger.logApiCallFailure(log, API_NAME, request.getOperation(), description,
                        e.getKind() + " after " + attempts.get() + " attempt(s): " + e.getMessage());
                })
                .doFinally(signal -> metricsService.stopApiTimer(sample));
        });
    }

    private <T> Mono<T> toResult(TransportResponse response, Function<String, T> decoder) {
        if (!response.isSuccessful()) {
            return Mono.error(TransportErrorClassifier.fromStatus(response.getStatusCode(), response.getRetryAfter()));
        }
        return Mono.fromCallable(() -> decoder.apply(response.getBody()));
    }

    private <T> T decode(String body, Class<T> type) {
        try {
            T value = objectMapper.readValue(body, type);
            if (value == null) {
                throw TransportException.decodingError(new IllegalStateException("Response body was empty"));
            }
            return value;
        } catch (JsonProcessingException e) {
            throw TransportException.decodingError(e);
        }
    }

    private TransportRequest buildRequest(CatalogQuery query) {
        TransportRequest.TransportRequestBuilder builder = withCommonParams(TransportRequest.builder())
            .queryParam("page", String.valueOf(query.getPage()));
        if (query.isSearch()) {
            return builder
                .path("/search/movie")
                .operation("search")
                .queryParam("query", SearchQueryUtils.normalize(query.getSearchText()))
                .queryParam("include_adult", "false")
                .build();
        }
        CatalogCategory category = query.getCategory();
        builder.path(category.getPath()).operation(category.cacheName());
        if (category == CatalogCategory.RECENT) {
            LocalDate today = LocalDate.now(clock);
            builder.queryParam("sort_by", "popularity.desc")
                .queryParam("include_adult", "false")
                .queryParam("primary_release_date.gte", today.minusMonths(6).toString())
                .queryParam("primary_release_date.lte", today.toString())
                .queryParam("vote_count.gte", "50");
        }
        return builder.build();
    }

    private TransportRequest.TransportRequestBuilder withCommonParams(TransportRequest.TransportRequestBuilder builder) {
        builder.queryParam("api_key", properties.getKey());
        if (properties.getLanguage() != null && !properties.getLanguage().isBlank()) {
            builder.queryParam("language", properties.getLanguage());
        }
        return builder;
    }
}
