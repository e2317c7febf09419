/**
 * A single user judgment on a catalog item
 *
 * @author William Callahan
 *
 * Features:
 * - Captures the item's genres and rating at judgment time
 * - Immutable, so the preference engine can replay history safely
 * - Persisted in the signal journal
 */

package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.movie_discovery_engine.types.Judgment;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SwipeSignal {

    private final int itemId;
    private final Judgment judgment;
    private final Set<Integer> genreIds;
    private final double rating;
    private final Instant timestamp;

    @JsonCreator
    public SwipeSignal(@JsonProperty("itemId") int itemId,
                       @JsonProperty("judgment") Judgment judgment,
                       @JsonProperty("genreIds") Collection<Integer> genreIds,
                       @JsonProperty("rating") double rating,
                       @JsonProperty("timestamp") Instant timestamp) {
        this.itemId = itemId;
        this.judgment = Objects.requireNonNull(judgment, "judgment");
        this.genreIds = genreIds == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(genreIds));
        this.rating = rating;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    /**
     * Builds a signal from an item the user just judged
     *
     * @param item judged item
     * @param judgment the user's judgment
     * @param timestamp when it happened
     * @return new signal
     */
    public static SwipeSignal of(CatalogItem item, Judgment judgment, Instant timestamp) {
        return new SwipeSignal(item.getId(), judgment, item.getGenreIds(), item.getRating(), timestamp);
    }
}
