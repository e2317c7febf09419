package com.williamcallahan.movie_discovery_engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * One page of catalog results
 * - Decodes from the remote {@code results/page/total_pages/total_results} envelope
 * - Items keep the order the remote service returned them in
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CatalogPage {

    @JsonProperty("results")
    private final List<CatalogItem> items;

    @JsonProperty("page")
    private final int page;

    @JsonProperty("total_pages")
    private final int totalPages;

    @JsonProperty("total_results")
    private final int totalResults;

    @JsonCreator
    public CatalogPage(@JsonProperty("results") List<CatalogItem> items,
                       @JsonProperty("page") int page,
                       @JsonProperty("total_pages") int totalPages,
                       @JsonProperty("total_results") int totalResults) {
        this.items = items == null ? Collections.emptyList() : List.copyOf(items);
        this.page = page;
        this.totalPages = totalPages;
        this.totalResults = totalResults;
    }

    /**
     * Page with no results, used for blank searches
     *
     * @param page requested page number
     * @return empty page with zero totals
     */
    public static CatalogPage empty(int page) {
        return new CatalogPage(Collections.emptyList(), page, 0, 0);
    }

    public boolean hasMorePages() {
        return page < totalPages;
    }
}
