/**
 * Service for tracking catalog access metrics
 * Provides counters and timers for the fetch, retry, coalescing and offline fallback paths
 *
 * @author William Callahan
 */

package com.williamcallahan.movie_discovery_engine.monitoring;

import com.williamcallahan.movie_discovery_engine.types.TransportFailure;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter apiRetries;
    private final Counter apiRateLimits;
    private final Counter coalescedJoins;
    private final Counter memoHits;
    private final Counter offlineFallbacks;
    private final Counter persistenceFailures;

    // Timers
    private final Timer apiCallTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.apiRetries = Counter.builder("catalog.api.retries")
            .description("Number of retried catalog API attempts")
            .register(meterRegistry);

        this.apiRateLimits = Counter.builder("catalog.api.rate_limits")
            .description("Number of catalog API rate limit responses")
            .register(meterRegistry);

        this.coalescedJoins = Counter.builder("catalog.coalescer.joins")
            .description("Number of callers that joined an in-flight request")
            .register(meterRegistry);

        this.memoHits = Counter.builder("catalog.coalescer.memo_hits")
            .description("Number of callers served from a memoized result")
            .register(meterRegistry);

        this.offlineFallbacks = Counter.builder("catalog.offline.fallbacks")
            .description("Number of requests answered from the offline cache after a transport failure")
            .register(meterRegistry);

        this.persistenceFailures = Counter.builder("catalog.offline.persistence_failures")
            .description("Number of failed offline cache snapshot writes")
            .register(meterRegistry);

        this.apiCallTimer = Timer.builder("catalog.api.call.duration")
            .description("Catalog API call duration including retries")
            .register(meterRegistry);
    }

    public void incrementApiRetry() {
        apiRetries.increment();
    }

    public void incrementApiRateLimit() {
        apiRateLimits.increment();
    }

    public void incrementCoalescedJoin() {
        coalescedJoins.increment();
    }

    public void incrementMemoHit() {
        memoHits.increment();
    }

    public void incrementOfflineFallback() {
        offlineFallbacks.increment();
    }

    public void incrementPersistenceFailure() {
        persistenceFailures.increment();
    }

    /**
     * Count a failed catalog call by failure kind
     */
    public void recordApiFailure(TransportFailure kind) {
        meterRegistry.counter("catalog.api.failures", "kind", kind.name()).increment();
    }

    public Timer.Sample startApiTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopApiTimer(Timer.Sample sample) {
        sample.stop(apiCallTimer);
    }
}
