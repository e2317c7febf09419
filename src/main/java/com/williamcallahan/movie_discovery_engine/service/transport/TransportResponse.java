package com.williamcallahan.movie_discovery_engine.service.transport;

import lombok.Value;

import java.time.Duration;
import java.util.Optional;

/**
 * Raw HTTP outcome. Non-2xx statuses arrive here rather than as errors so the client can classify them.
 */
@Value
public class TransportResponse {
    int statusCode;
    String body;
    Duration retryAfter;

    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, body, null);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfter);
    }
}
