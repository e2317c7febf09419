/**
 * Browsable catalog categories with their remote paths and cache lifetimes
 *
 * @author William Callahan
 *
 * Features:
 * - Maps each category to its remote list endpoint
 * - Carries the offline cache TTL used when the category is written through
 * - Carries the short in-memory memo window used by the request coalescer
 */
package com.williamcallahan.movie_discovery_engine.types;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

public enum CatalogCategory {
    TRENDING("/trending/movie/day", Duration.ofHours(1), Duration.ofMinutes(5)),
    POPULAR("/movie/popular", Duration.ofHours(24), Duration.ofMinutes(10)),
    TOP_RATED("/movie/top_rated", Duration.ofHours(24), Duration.ofHours(1)),
    NOW_PLAYING("/movie/now_playing", Duration.ofHours(1), Duration.ofMinutes(10)),
    UPCOMING("/movie/upcoming", Duration.ofHours(12), Duration.ofHours(1)),
    RECENT("/discover/movie", Duration.ofHours(6), Duration.ofMinutes(30));

    private final String path;
    private final Duration offlineTtl;
    private final Duration memoTtl;

    CatalogCategory(String path, Duration offlineTtl, Duration memoTtl) {
        this.path = path;
        this.offlineTtl = offlineTtl;
        this.memoTtl = memoTtl;
    }

    public String getPath() {
        return path;
    }

    public Duration getOfflineTtl() {
        return offlineTtl;
    }

    public Duration getMemoTtl() {
        return memoTtl;
    }

    /**
     * Name used for the offline category index and coalescer keys
     *
     * @return lower snake case name, e.g. {@code top_rated}
     */
    public String cacheName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a category from its cache name or enum name, ignoring case
     *
     * @param value name to resolve
     * @return the category, or empty when the name is unknown
     */
    public static Optional<CatalogCategory> fromName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (CatalogCategory category : values()) {
            if (category.name().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
