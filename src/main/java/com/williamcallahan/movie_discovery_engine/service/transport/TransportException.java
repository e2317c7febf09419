/**
 * Unchecked exception carrying a classified transport failure
 *
 * @author William Callahan
 *
 * Features:
 * - Exposes the failure kind callers branch on
 * - Keeps the HTTP status and Retry-After hint when the server sent them
 * - Preserves the underlying cause for logging
 */
package com.williamcallahan.movie_discovery_engine.service.transport;

import com.williamcallahan.movie_discovery_engine.types.TransportFailure;

import java.time.Duration;
import java.util.Optional;

public class TransportException extends RuntimeException {

    private final TransportFailure kind;
    private final Integer statusCode;
    private final Duration retryAfter;

    public TransportException(TransportFailure kind, String message) {
        this(kind, message, null, null, null);
    }

    public TransportException(TransportFailure kind, String message, Throwable cause) {
        this(kind, message, null, null, cause);
    }

    public TransportException(TransportFailure kind, String message, Integer statusCode, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public static TransportException timeout(Throwable cause) {
        return new TransportException(TransportFailure.TIMEOUT, "Request timed out", cause);
    }

    public static TransportException noConnectivity(Throwable cause) {
        return new TransportException(TransportFailure.NO_CONNECTIVITY, "No network connectivity", cause);
    }

    public static TransportException rateLimited(Duration retryAfter) {
        return new TransportException(TransportFailure.RATE_LIMITED, "Rate limited by catalog service", 429, retryAfter, null);
    }

    public static TransportException serverError(int statusCode) {
        return new TransportException(TransportFailure.SERVER_ERROR, "Catalog service error (HTTP " + statusCode + ")", statusCode, null, null);
    }

    public static TransportException clientError(int statusCode) {
        return new TransportException(TransportFailure.CLIENT_ERROR, "Catalog request rejected (HTTP " + statusCode + ")", statusCode, null, null);
    }

    public static TransportException decodingError(Throwable cause) {
        return new TransportException(TransportFailure.DECODING_ERROR, "Unable to decode catalog response", cause);
    }

    public static TransportException trustFailure(Throwable cause) {
        return new TransportException(TransportFailure.TRUST_FAILURE, "Server certificate was not trusted", cause);
    }

    public static TransportException cancelled() {
        return new TransportException(TransportFailure.CANCELLED, "Request was cancelled");
    }

    public TransportFailure getKind() {
        return kind;
    }

    public Optional<Integer> getStatusCode() {
        return Optional.ofNullable(statusCode);
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
