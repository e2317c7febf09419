package com.williamcallahan.movie_discovery_engine.service.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.williamcallahan.movie_discovery_engine.model.CachedEntry;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk form of the offline catalog cache: every entry plus the ordered category indices
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CacheSnapshot {
    private int version = 1;
    private Instant savedAt;
    private List<CachedEntry> entries = new ArrayList<>();
    private Map<String, List<Integer>> categories = new LinkedHashMap<>();
}
