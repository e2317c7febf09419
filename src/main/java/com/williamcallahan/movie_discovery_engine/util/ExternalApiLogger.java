package com.williamcallahan.movie_discovery_engine.util;

import org.slf4j.Logger;

/**
 * Uniform log lines for calls to the remote catalog service.
 *
 * Every line carries the {@code [EXTERNAL-API]} prefix so the fetch, retry and
 * offline fallback flow can be followed with a single grep.
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
        // Utility class
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query, long attempt) {
        log.info("{} [{}] ATTEMPT {}: {} for query='{}'", PREFIX, apiName, attempt + 1, operation, query);
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info("{} [{}] SUCCESS: {} returned {} result(s) for query='{}'", PREFIX, apiName, operation, resultCount, query);
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn("{} [{}] FAILURE: {} failed for query='{}' - {}", PREFIX, apiName, operation, query, reason);
    }

    /**
     * Log a scheduled retry
     */
    public static void logRetryScheduled(Logger log, String apiName, String operation, long retryNumber, long delayMillis, String reason) {
        log.warn("{} [{}] RETRY {} for {} in {}ms - {}", PREFIX, apiName, retryNumber, operation, delayMillis, reason);
    }

    /**
     * Log a request that was answered from the offline cache instead of the network
     */
    public static void logOfflineFallback(Logger log, String apiName, String operation, String query, int cachedCount) {
        log.info("{} [{}] OFFLINE-FALLBACK: {} served {} cached item(s) for query='{}'", PREFIX, apiName, operation, cachedCount, query);
    }

    /**
     * Log a request skipped before reaching the network
     */
    public static void logApiCallSkipped(Logger log, String apiName, String operation, String reason) {
        log.debug("{} [{}] SKIPPED: {} - {}", PREFIX, apiName, operation, reason);
    }

    /**
     * Log HTTP response details
     */
    public static void logHttpResponse(Logger log, int statusCode, String path, int bodySize) {
        log.debug("{} [HTTP] Response: status={}, path={}, bodySize={} chars", PREFIX, statusCode, path, bodySize);
    }
}
