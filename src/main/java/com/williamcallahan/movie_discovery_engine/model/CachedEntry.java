/**
 * Offline cache record wrapping a catalog item with its lifetime
 *
 * @author William Callahan
 *
 * Features:
 * - Records when the item was cached and when it stops being served
 * - Validity is a pure function of the supplied instant
 * - Serialized as-is into the offline cache snapshot
 */

package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CachedEntry {

    private final CatalogItem item;
    private final Instant cachedAt;
    private final Instant expiresAt;

    @JsonCreator
    public CachedEntry(@JsonProperty("item") CatalogItem item,
                       @JsonProperty("cachedAt") Instant cachedAt,
                       @JsonProperty("expiresAt") Instant expiresAt) {
        this.item = Objects.requireNonNull(item, "item");
        this.cachedAt = Objects.requireNonNull(cachedAt, "cachedAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(cachedAt)) {
            throw new IllegalArgumentException("expiresAt must be after cachedAt for item " + item.getId());
        }
    }

    /**
     * Creates an entry cached at {@code now} that lives for {@code ttl}
     *
     * @param item catalog item
     * @param now cache time
     * @param ttl strictly positive lifetime
     * @return new entry
     */
    public static CachedEntry of(CatalogItem item, Instant now, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttl);
        }
        return new CachedEntry(item, now, now.plus(ttl));
    }

    /**
     * @param now instant to evaluate against
     * @return true while {@code now} is strictly before {@code expiresAt}
     */
    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
