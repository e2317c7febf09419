/**
 * Remote catalog API configuration properties
 *
 * @author William Callahan
 */

package com.williamcallahan.movie_discovery_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "catalog.api")
public class CatalogApiProperties {
    private String baseUrl = "https://api.themoviedb.org/3";
    private String key;
    private String language = "en-US";
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration searchTimeout = Duration.ofSeconds(10);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private int maxInMemorySize = 4 * 1024 * 1024;

    @NestedConfigurationProperty
    private Retry retry = new Retry();

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

    public Duration getSearchTimeout() { return searchTimeout; }
    public void setSearchTimeout(Duration searchTimeout) { this.searchTimeout = searchTimeout; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public int getMaxInMemorySize() { return maxInMemorySize; }
    public void setMaxInMemorySize(int maxInMemorySize) { this.maxInMemorySize = maxInMemorySize; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public boolean hasKey() {
        return key != null && !key.isBlank();
    }

    public static class Retry {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double jitterFactor = 0.5;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

        public double getJitterFactor() { return jitterFactor; }
        public void setJitterFactor(double jitterFactor) { this.jitterFactor = jitterFactor; }
    }
}
