/**
 * Immutable catalog item as returned by the remote metadata service
 *
 * @author William Callahan
 *
 * Features:
 * - Identity is the numeric catalog id only
 * - Decodes directly from the remote JSON field names
 * - Round-trips through the offline cache snapshot with the same names
 * - Empty release dates decode to absent
 * - Builds poster and backdrop URLs for the image CDN
 */

package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

@Getter
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CatalogItem {

    private static final String IMAGE_BASE_URL = "https://image.tmdb.org/t/p/";

    @ToString.Include
    @EqualsAndHashCode.Include
    @JsonProperty("id")
    private final int id;

    @ToString.Include
    @JsonProperty("title")
    private final String title;

    @JsonProperty("overview")
    private final String overview;

    @JsonIgnore
    private final LocalDate releaseDate;

    @JsonProperty("vote_average")
    private final double rating;

    @JsonProperty("vote_count")
    private final int voteCount;

    @JsonProperty("popularity")
    private final double popularity;

    @JsonProperty("genre_ids")
    private final Set<Integer> genreIds;

    @JsonProperty("poster_path")
    private final String posterPath;

    @JsonProperty("backdrop_path")
    private final String backdropPath;

    @Builder(toBuilder = true)
    private CatalogItem(int id,
                        String title,
                        String overview,
                        LocalDate releaseDate,
                        double rating,
                        int voteCount,
                        double popularity,
                        Collection<Integer> genreIds,
                        String posterPath,
                        String backdropPath) {
        if (title == null) {
            throw new IllegalArgumentException("Catalog item " + id + " has no title");
        }
        this.id = id;
        this.title = title;
        this.overview = overview == null ? "" : overview;
        this.releaseDate = releaseDate;
        this.rating = rating;
        this.voteCount = voteCount;
        this.popularity = popularity;
        this.genreIds = genreIds == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(genreIds));
        this.posterPath = posterPath;
        this.backdropPath = backdropPath;
    }

    /**
     * Decodes an item from remote or snapshot JSON
     * - id and title are required
     * - missing numbers default to zero
     * - an empty or malformed release_date is treated as absent
     */
    @JsonCreator
    static CatalogItem fromJson(@JsonProperty("id") Integer id,
                                @JsonProperty("title") String title,
                                @JsonProperty("overview") String overview,
                                @JsonProperty("release_date") String releaseDate,
                                @JsonProperty("vote_average") Double rating,
                                @JsonProperty("vote_count") Integer voteCount,
                                @JsonProperty("popularity") Double popularity,
                                @JsonProperty("genre_ids") Collection<Integer> genreIds,
                                @JsonProperty("poster_path") String posterPath,
                                @JsonProperty("backdrop_path") String backdropPath) {
        if (id == null) {
            throw new IllegalArgumentException("Catalog item is missing an id");
        }
        return new CatalogItem(
            id,
            title,
            overview,
            parseReleaseDate(releaseDate),
            rating == null ? 0.0 : rating,
            voteCount == null ? 0 : voteCount,
            popularity == null ? 0.0 : popularity,
            genreIds,
            posterPath,
            backdropPath);
    }

    /**
     * Release date in the remote wire format
     *
     * @return ISO date string, or null when unknown
     */
    @JsonProperty("release_date")
    String getReleaseDateText() {
        return releaseDate == null ? null : releaseDate.toString();
    }

    /**
     * @return the release year, or empty when the release date is unknown
     */
    @JsonIgnore
    public Optional<Integer> getReleaseYear() {
        return releaseDate == null ? Optional.empty() : Optional.of(releaseDate.getYear());
    }

    /**
     * Poster URL for a CDN size bucket such as {@code w500}
     *
     * @param size image size bucket
     * @return full URL, or empty when the item has no poster
     */
    public Optional<String> posterUrl(String size) {
        return imageUrl(posterPath, size);
    }

    /**
     * Backdrop URL for a CDN size bucket such as {@code w780}
     *
     * @param size image size bucket
     * @return full URL, or empty when the item has no backdrop
     */
    public Optional<String> backdropUrl(String size) {
        return imageUrl(backdropPath, size);
    }

    private static Optional<String> imageUrl(String path, String size) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(IMAGE_BASE_URL + size + path);
    }

    private static LocalDate parseReleaseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
