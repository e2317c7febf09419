/**
 * Exponential backoff with proportional jitter for remote catalog retries
 *
 * @author William Callahan
 *
 * Features:
 * - delay = min(base * 2^attempt + U(0, jitterFactor) * base * 2^attempt, maxDelay)
 * - Honors a server Retry-After hint as a lower bound, still capped at maxDelay
 * - Jitter source is injectable so delays are deterministic in tests
 */

package com.williamcallahan.movie_discovery_engine.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public class RetryBackoff {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final DoubleSupplier unitRandom;

    public RetryBackoff(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(baseDelay, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param baseDelay delay before the first retry, before jitter
     * @param maxDelay upper bound for any delay
     * @param jitterFactor upper bound of the random multiplier added on top of the exponential term
     * @param unitRandom source of values in [0, 1)
     */
    public RetryBackoff(Duration baseDelay, Duration maxDelay, double jitterFactor, DoubleSupplier unitRandom) {
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (jitterFactor < 0) {
            throw new IllegalArgumentException("Jitter factor must not be negative");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
        this.unitRandom = unitRandom;
    }

    /**
     * Delay before retry number {@code attempt}
     *
     * @param attempt zero-based retry index
     * @return jittered delay, never above maxDelay
     */
    public Duration delayFor(long attempt) {
        double exponential = baseDelay.toMillis() * Math.pow(2, Math.max(0, attempt));
        double jitter = unitRandom.getAsDouble() * jitterFactor * exponential;
        double millis = Math.min(exponential + jitter, maxDelay.toMillis());
        return Duration.ofMillis((long) millis);
    }

    /**
     * Delay before retry number {@code attempt}, waiting at least as long as the server asked
     *
     * @param attempt zero-based retry index
     * @param retryAfter server hint, may be null
     * @return the larger of the backoff and the hint, never above maxDelay
     */
    public Duration delayFor(long attempt, Duration retryAfter) {
        Duration backoff = delayFor(attempt);
        if (retryAfter == null || retryAfter.compareTo(backoff) <= 0) {
            return backoff;
        }
        return retryAfter.compareTo(maxDelay) > 0 ? maxDelay : retryAfter;
    }
}
