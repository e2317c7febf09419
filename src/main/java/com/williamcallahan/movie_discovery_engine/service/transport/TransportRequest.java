package com.williamcallahan.movie_discovery_engine.service.transport;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A GET against the catalog service, relative to the configured base URL
 */
@Value
@Builder
public class TransportRequest {
    String path;
    @Singular
    Map<String, String> queryParams;
    /** Short operation name used in logs and metrics, e.g. {@code popular} or {@code details} */
    String operation;
}
