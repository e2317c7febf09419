package com.williamcallahan.movie_discovery_engine.model;

import com.williamcallahan.movie_discovery_engine.types.CatalogCategory;
import com.williamcallahan.movie_discovery_engine.util.SearchQueryUtils;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * A request for one page of catalog results, either a category listing or a free-text search
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CatalogQuery {

    private final CatalogCategory category;
    private final String searchText;
    private final int page;

    private CatalogQuery(CatalogCategory category, String searchText, int page) {
        if (page < 1) {
            throw new IllegalArgumentException("Page numbers start at 1, got " + page);
        }
        this.category = category;
        this.searchText = searchText;
        this.page = page;
    }

    public static CatalogQuery category(CatalogCategory category, int page) {
        if (category == null) {
            throw new IllegalArgumentException("Category is required");
        }
        return new CatalogQuery(category, null, page);
    }

    public static CatalogQuery search(String text, int page) {
        return new CatalogQuery(null, text == null ? "" : text, page);
    }

    public boolean isSearch() {
        return category == null;
    }

    public Optional<CatalogCategory> categoryOptional() {
        return Optional.ofNullable(category);
    }

    /**
     * Stable key for coalescing identical requests
     * - {@code popular_1} for categories
     * - {@code search_the_matrix_2} for searches, normalized so equivalent texts share a key
     *
     * @return coalescing key
     */
    public String cacheKey() {
        if (isSearch()) {
            return "search_" + SearchQueryUtils.keyFragment(searchText) + "_" + page;
        }
        return category.cacheName() + "_" + page;
    }
}
