package com.williamcallahan.movie_discovery_engine.service.transport;

import reactor.core.publisher.Mono;

/**
 * Outbound HTTP primitive used by the catalog client.
 * Implementations complete with the response for any HTTP status and signal an error only for I/O failures.
 * Cancelling the subscription cancels the exchange.
 */
public interface CatalogTransport {

    Mono<TransportResponse> send(TransportRequest request);
}
