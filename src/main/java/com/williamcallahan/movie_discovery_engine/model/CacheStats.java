package com.williamcallahan.movie_discovery_engine.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time counts for the offline cache
 */
@Value
@Builder
public class CacheStats {
    int totalItems;
    int validItems;
    int expiredItems;
    /** Number of ids indexed per category name */
    Map<String, Integer> categoryCounts;
}
