/**
 * Configuration for the catalog WebClient
 * - Builds the WebClient used by the catalog transport
 * - Sets connect, read, write and response timeouts on Reactor Netty
 * - Raises the in-memory buffer limit for large list responses
 *
 * @author William Callahan
 */
package com.williamcallahan.movie_discovery_engine.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    /**
     * Creates the WebClient for the remote catalog service
     * - Connect timeout from {@code catalog.api.connect-timeout}
     * - Socket and response timeouts from {@code catalog.api.request-timeout}
     * - The client also applies its own per-attempt timeout on top of these
     *
     * @param properties catalog API settings
     * @return WebClient rooted at the catalog base URL
     */
    @Bean
    public WebClient catalogWebClient(CatalogApiProperties properties) {
        Duration requestTimeout = properties.getRequestTimeout();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis())
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(requestTimeout.toMillis(), TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(requestTimeout.toMillis(), TimeUnit.MILLISECONDS))
            )
            .responseTimeout(requestTimeout);

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(properties.getMaxInMemorySize()))
            .build();

        return WebClient.builder()
            .baseUrl(properties.getBaseUrl())
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
