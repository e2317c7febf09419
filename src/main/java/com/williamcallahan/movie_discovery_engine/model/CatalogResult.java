package com.williamcallahan.movie_discovery_engine.model;

import lombok.Value;

import java.util.List;

/**
 * Items handed to a caller, flagged with whether they came from the offline cache instead of the network
 */
@Value
public class CatalogResult {
    List<CatalogItem> items;
    boolean fromCache;

    public static CatalogResult live(List<CatalogItem> items) {
        return new CatalogResult(List.copyOf(items), false);
    }

    public static CatalogResult cached(List<CatalogItem> items) {
        return new CatalogResult(List.copyOf(items), true);
    }
}
