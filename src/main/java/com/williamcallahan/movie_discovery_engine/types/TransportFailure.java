/**
 * Closed set of failure kinds raised by the catalog transport layer
 *
 * @author William Callahan
 *
 * Features:
 * - Distinguishes transient failures from permanent ones
 * - Drives the retry decision in the catalog client
 * - Lets callers decide when to fall back to offline data
 */
package com.williamcallahan.movie_discovery_engine.types;

/**
 * Failure kinds for remote catalog calls
 * - TIMEOUT, RATE_LIMITED and SERVER_ERROR are transient and retried
 * - Everything else surfaces to the caller on the first occurrence
 */
public enum TransportFailure {
    /**
     * Attempt exceeded the per-request timeout
     */
    TIMEOUT(true),

    /**
     * Host unreachable, DNS failure or connection refused
     */
    NO_CONNECTIVITY(false),

    /**
     * HTTP 429, optionally with a Retry-After hint
     */
    RATE_LIMITED(true),

    /**
     * HTTP 5xx
     */
    SERVER_ERROR(true),

    /**
     * HTTP 4xx other than 429
     */
    CLIENT_ERROR(false),

    /**
     * Body could not be decoded into the expected shape
     */
    DECODING_ERROR(false),

    /**
     * Certificate or TLS handshake rejected
     */
    TRUST_FAILURE(false),

    /**
     * Caller or coalescer cancelled the request
     */
    CANCELLED(false),

    UNKNOWN(false);

    private final boolean retryable;

    TransportFailure(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * @return true when another attempt may succeed without caller action
     */
    public boolean isRetryable() {
        return retryable;
    }
}
