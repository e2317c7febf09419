/**
 * Deduplicates concurrent identical requests and memoizes their results briefly
 *
 * @author William Callahan
 *
 * Features:
 * - Concurrent callers for the same key share one producer subscription
 * - Every waiter receives the same value or the same error
 * - Successful results are memoized per key for a caller-chosen TTL, backed by Caffeine
 * - A waiter that cancels leaves the others untouched; the producer is cancelled only
 *   when the last waiter goes away
 * - Pending requests can be cancelled individually or all at once
 * - Knows nothing about what the keys or values mean
 */
package com.williamcallahan.movie_discovery_engine.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.williamcallahan.movie_discovery_engine.monitoring.MetricsService;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Slf4j
public class RequestCoalescer<K, V> {

    /** Memo window used when the caller does not pass one */
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

    private static final long DEFAULT_MAX_MEMOIZED = 1_000;

    private final String name;
    private final Duration defaultTtl;
    private final Clock clock;
    private final MetricsService metricsService;

    private final Object lock = new Object();
    private final Map<K, InFlight<V>> inFlight = new HashMap<>();
    private final Cache<K, Memo<V>> memoized;

    public RequestCoalescer(String name, Clock clock, MetricsService metricsService) {
        this(name, DEFAULT_TTL, DEFAULT_MAX_MEMOIZED, clock, metricsService);
    }

    /**
     * @param name label used in logs
     * @param defaultTtl memo window for {@link #coalesce(Object, Supplier)}
     * @param maxMemoized upper bound on memoized keys
     * @param clock time source for memo expiry
     * @param metricsService metrics sink
     */
    public RequestCoalescer(String name, Duration defaultTtl, long maxMemoized, Clock clock, MetricsService metricsService) {
        this.name = name;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
        this.metricsService = metricsService;
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.memoized = Caffeine.newBuilder()
            .ticker(ticker)
            .executor(Runnable::run)
            .maximumSize(maxMemoized)
            .expireAfter(new MemoExpiry<K, V>(clock))
            .build();
    }

    /**
     * Coalesce using the default memo window
     */
    public Mono<V> coalesce(K key, Supplier<Mono<V>> producer) {
        return coalesce(key, defaultTtl, producer);
    }

    /**
     * Return the memoized value for {@code key}, join an in-flight request for it, or start one
     *
     * @param key request identity
     * @param ttl how long a successful result is served without calling the producer; zero disables memoization
     * @param producer creates the real request; invoked at most once per in-flight key
     * @return shared result
     */
    public Mono<V> coalesce(K key, Duration ttl, Supplier<Mono<V>> producer) {
        return Mono.defer(() -> {
            InFlight<V> flight;
            boolean owner = false;
            synchronized (lock) {
                Memo<V> memo = memoized.getIfPresent(key);
                if (memo != null && memo.isValidAt(clock.instant())) {
                    metricsService.incrementMemoHit();
                    log.debug("[{}] memo hit for {}", name, key);
                    return Mono.just(memo.value());
                }
                flight = inFlight.get(key);
                if (flight == null) {
                    flight = new InFlight<>();
                    inFlight.put(key, flight);
                    owner = true;
                } else {
                    metricsService.incrementCoalescedJoin();
                    log.debug("[{}] joining in-flight request for {}", name, key);
                }
                flight.waiters++;
            }
            if (owner) {
                start(key, ttl, producer, flight);
            }
            InFlight<V> joined = flight;
            return joined.sink.asMono().doOnCancel(() -> release(key, joined));
        });
    }

    /**
     * Drop the memoized result for one key. In-flight requests are unaffected.
     */
    public void clearCache(K key) {
        memoized.invalidate(key);
    }

    /**
     * Drop every memoized result. In-flight requests are unaffected.
     */
    public void clear() {
        memoized.invalidateAll();
    }

    /**
     * Remove memoized results whose window has passed
     *
     * @return number of entries removed
     */
    public int clearExpired() {
        // expired entries stay counted until maintenance runs
        long before = memoized.estimatedSize();
        memoized.cleanUp();
        int removed = (int) Math.max(0, before - memoized.estimatedSize());
        if (removed > 0) {
            log.debug("[{}] cleared {} expired memo entries", name, removed);
        }
        return removed;
    }

    /**
     * Cancel the in-flight request for {@code key}; every waiter receives a {@link CancellationException}
     *
     * @return true when a request was pending
     */
    public boolean cancel(K key) {
        InFlight<V> flight;
        synchronized (lock) {
            flight = inFlight.remove(key);
            if (flight == null) {
                return false;
            }
            flight.settled = true;
        }
        abort(key, flight);
        return true;
    }

    /**
     * Cancel every in-flight request
     *
     * @return number of requests cancelled
     */
    public int cancelAll() {
        Map<K, InFlight<V>> pending;
        synchronized (lock) {
            pending = new HashMap<>(inFlight);
            inFlight.clear();
            pending.values().forEach(flight -> flight.settled = true);
        }
        pending.forEach(this::abort);
        return pending.size();
    }

    public int pendingCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    /**
     * @return number of memoized results still inside their window
     */
    public int cachedCount() {
        Instant now = clock.instant();
        return (int) memoized.asMap().values().stream()
            .filter(memo -> memo.isValidAt(now))
            .count();
    }

    public String getName() {
        return name;
    }

    private void start(K key, Duration ttl, Supplier<Mono<V>> producer, InFlight<V> flight) {
        Mono<V> upstream;
        try {
            upstream = producer.get();
        } catch (RuntimeException e) {
            upstream = Mono.error(e);
        }
        Disposable subscription = upstream.subscribe(
            value -> settle(key, flight, ttl, value, null),
            error -> settle(key, flight, ttl, null, error),
            () -> settle(key, flight, ttl, null, null));
        flight.upstream.update(subscription);
    }

    private void settle(K key, InFlight<V> flight, Duration ttl, V value, Throwable error) {
        synchronized (lock) {
            if (flight.settled) {
                return;
            }
            flight.settled = true;
            // pending marker is removed before the memo write
            if (inFlight.get(key) == flight) {
                inFlight.remove(key);
            }
            if (error == null && value != null && ttl != null && !ttl.isZero() && !ttl.isNegative()) {
                memoized.put(key, new Memo<>(value, clock.instant().plus(ttl)));
            }
        }
        if (error != null) {
            log.debug("[{}] request for {} failed: {}", name, key, error.toString());
            flight.sink.tryEmitError(error);
        } else if (value != null) {
            flight.sink.tryEmitValue(value);
        } else {
            flight.sink.tryEmitEmpty();
        }
    }

    private void release(K key, InFlight<V> flight) {
        synchronized (lock) {
            if (flight.settled) {
                return;
            }
            flight.waiters--;
            if (flight.waiters > 0) {
                log.debug("[{}] waiter left {}, {} still waiting", name, key, flight.waiters);
                return;
            }
            flight.settled = true;
            if (inFlight.get(key) == flight) {
                inFlight.remove(key);
            }
        }
        log.debug("[{}] last waiter cancelled {}, cancelling upstream", name, key);
        flight.upstream.dispose();
    }

    private void abort(K key, InFlight<V> flight) {
        log.debug("[{}] cancelling in-flight request for {}", name, key);
        flight.upstream.dispose();
        flight.sink.tryEmitError(new CancellationException("Request " + key + " was cancelled"));
    }

    private static final class InFlight<V> {
        private final Sinks.One<V> sink = Sinks.one();
        private final Disposable.Swap upstream = Disposables.swap();
        private int waiters;
        private boolean settled;
    }

    private record Memo<V>(V value, Instant expiresAt) {
        boolean isValidAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }

    private static final class MemoExpiry<K, V> implements Expiry<K, Memo<V>> {
        private final Clock clock;

        private MemoExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(K key, Memo<V> memo, long currentTime) {
            return remainingNanos(memo);
        }

        @Override
        public long expireAfterUpdate(K key, Memo<V> memo, long currentTime, long currentDuration) {
            return remainingNanos(memo);
        }

        @Override
        public long expireAfterRead(K key, Memo<V> memo, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(Memo<V> memo) {
            return Math.max(0, Duration.between(clock.instant(), memo.expiresAt()).toNanos());
        }
    }
}
