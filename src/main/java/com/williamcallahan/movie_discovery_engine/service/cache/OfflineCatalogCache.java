/**
 * Durable catalog cache that keeps browsing usable without a network
 *
 * @author William Callahan
 *
 * Features:
 * - Per-item entries with individual TTLs
 * - Ordered category indices replaced wholesale on every write
 * - Write-through JSON snapshot on every mutation, reloaded at startup
 * - Missing or corrupt snapshots start an empty cache instead of failing
 * - Bounded size, trimming the oldest cached entries first
 * - Entries older than the maximum disk age are dropped on load
 * - Expiry is only enforced on read and by explicit eviction; there is no internal timer
 */
package com.williamcallahan.movie_discovery_engine.service.cache;

import com.williamcallahan.movie_discovery_engine.model.CacheStats;
import com.williamcallahan.movie_discovery_engine.model.CachedEntry;
import com.williamcallahan.movie_discovery_engine.model.CatalogItem;
import com.williamcallahan.movie_discovery_engine.monitoring.MetricsService;
import com.williamcallahan.movie_discovery_engine.types.CatalogCategory;
import com.williamcallahan.movie_discovery_engine.util.JsonFileStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
public class OfflineCatalogCache {

    private final Object lock = new Object();
    // iteration order is write order
    private final Map<Integer, CachedEntry> entries = new LinkedHashMap<>();
    private final Map<String, List<Integer>> categories = new LinkedHashMap<>();

    private final JsonFileStore<CacheSnapshot> store;
    private final Clock clock;
    private final int maxEntries;
    private final Duration maxDiskAge;
    private final MetricsService metricsService;

    /**
     * Creates the cache and loads any persisted snapshot
     *
     * @param store snapshot file, or null for a memory-only cache
     * @param clock time source for expiry
     * @param maxEntries upper bound on cached items
     * @param maxDiskAge persisted entries cached longer ago than this are dropped on load
     * @param metricsService metrics sink
     */
    public OfflineCatalogCache(JsonFileStore<CacheSnapshot> store,
                               Clock clock,
                               int maxEntries,
                               Duration maxDiskAge,
                               MetricsService metricsService) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        this.store = store;
        this.clock = clock;
        this.maxEntries = maxEntries;
        this.maxDiskAge = maxDiskAge;
        this.metricsService = metricsService;
        load();
    }

    /**
     * Cache a single item
     *
     * @param item item to cache
     * @param ttl strictly positive lifetime
     */
    public void put(CatalogItem item, Duration ttl) {
        requirePositive(ttl);
        synchronized (lock) {
            putEntry(CachedEntry.of(item, clock.instant(), ttl));
            trimToCapacity();
            persist();
        }
    }

    /**
     * @param itemId catalog id
     * @return the item while its entry is valid, otherwise empty
     */
    public Optional<CatalogItem> get(int itemId) {
        synchronized (lock) {
            CachedEntry entry = entries.get(itemId);
            if (entry == null || !entry.isValidAt(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.getItem());
        }
    }

    /**
     * Replace a category index and cache every item in it with the same TTL
     *
     * @param name category index name
     * @param items items in display order
     * @param ttl strictly positive lifetime
     */
    public void putCategory(String name, List<CatalogItem> items, Duration ttl) {
        requirePositive(ttl);
        synchronized (lock) {
            Instant now = clock.instant();
            Set<Integer> ids = new LinkedHashSet<>();
            for (CatalogItem item : items) {
                putEntry(CachedEntry.of(item, now, ttl));
                ids.add(item.getId());
            }
            categories.put(name, new ArrayList<>(ids));
            trimToCapacity();
            persist();
        }
        log.debug("Cached {} item(s) for category '{}' for {}", items.size(), name, ttl);
    }

    /**
     * Replace a category index using the category's own offline TTL
     */
    public void putCategory(CatalogCategory category, List<CatalogItem> items) {
        putCategory(category.cacheName(), items, category.getOfflineTtl());
    }

    /**
     * Valid items for a category in index order, skipping missing and expired ids
     *
     * @param name category index name
     * @return items, empty when the category is unknown
     */
    public List<CatalogItem> getCategory(String name) {
        synchronized (lock) {
            List<Integer> ids = categories.get(name);
            if (ids == null) {
                return List.of();
            }
            Instant now = clock.instant();
            List<CatalogItem> items = new ArrayList<>(ids.size());
            for (Integer id : ids) {
                CachedEntry entry = entries.get(id);
                if (entry != null && entry.isValidAt(now)) {
                    items.add(entry.getItem());
                }
            }
            return List.copyOf(items);
        }
    }

    public List<CatalogItem> getCategory(CatalogCategory category) {
        return getCategory(category.cacheName());
    }

    /**
     * A category is usable offline when more than half of its indexed items are still valid
     */
    public boolean hasValid(String name) {
        synchronized (lock) {
            List<Integer> ids = categories.get(name);
            if (ids == null || ids.isEmpty()) {
                return false;
            }
            Instant now = clock.instant();
            long valid = ids.stream()
                .map(entries::get)
                .filter(entry -> entry != null && entry.isValidAt(now))
                .count();
            return valid * 2 > ids.size();
        }
    }

    public boolean hasValid(CatalogCategory category) {
        return hasValid(category.cacheName());
    }

    /**
     * Remove every expired entry and every index id that no longer has an entry
     *
     * @return number of entries removed
     */
    public int evictExpired() {
        synchronized (lock) {
            Instant now = clock.instant();
            int before = entries.size();
            entries.values().removeIf(entry -> !entry.isValidAt(now));
            int removed = before - entries.size();
            boolean indicesChanged = pruneDanglingIds();
            if (removed > 0 || indicesChanged) {
                persist();
                log.info("Evicted {} expired offline cache entr{}", removed, removed == 1 ? "y" : "ies");
            }
            return removed;
        }
    }

    /**
     * Drop every entry and index, including the persisted snapshot contents
     */
    public void clear() {
        synchronized (lock) {
            entries.clear();
            categories.clear();
            persist();
        }
        log.info("Offline catalog cache cleared");
    }

    public CacheStats getStats() {
        synchronized (lock) {
            Instant now = clock.instant();
            int valid = (int) entries.values().stream().filter(entry -> entry.isValidAt(now)).count();
            Map<String, Integer> counts = new LinkedHashMap<>();
            categories.forEach((name, ids) -> counts.put(name, ids.size()));
            return CacheStats.builder()
                .totalItems(entries.size())
                .validItems(valid)
                .expiredItems(entries.size() - valid)
                .categoryCounts(Map.copyOf(counts))
                .build();
        }
    }

    /**
     * @return category index names in insertion order
     */
    public List<String> categoryNames() {
        synchronized (lock) {
            return List.copyOf(categories.keySet());
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    private void load() {
        if (store == null) {
            return;
        }
        Optional<CacheSnapshot> snapshot = store.read();
        if (snapshot.isEmpty()) {
            return;
        }
        synchronized (lock) {
            Instant oldestAllowed = clock.instant().minus(maxDiskAge);
            int stale = 0;
            for (CachedEntry entry : nullToEmpty(snapshot.get().getEntries())) {
                if (entry == null) {
                    continue;
                }
                if (entry.getCachedAt().isBefore(oldestAllowed)) {
                    stale++;
                    continue;
                }
                putEntry(entry);
            }
            Map<String, List<Integer>> storedCategories = snapshot.get().getCategories();
            if (storedCategories != null) {
                storedCategories.forEach((name, ids) -> {
                    if (name != null && ids != null) {
                        categories.put(name, new ArrayList<>(new LinkedHashSet<>(ids)));
                    }
                });
            }
            pruneDanglingIds();
            trimToCapacity();
            log.info("Loaded {} offline cache entr{} across {} categor{} from {} ({} older than {} dropped)",
                entries.size(), entries.size() == 1 ? "y" : "ies",
                categories.size(), categories.size() == 1 ? "y" : "ies",
                store.getFile(), stale, maxDiskAge);
        }
    }

    private void putEntry(CachedEntry entry) {
        Integer id = entry.getItem().getId();
        entries.remove(id);
        entries.put(id, entry);
    }

    /**
     * Drops the oldest entries until the cache fits. Entries cached at the same instant
     * are dropped latest-written first, so an oversized category write loses its tail.
     */
    private void trimToCapacity() {
        int excess = entries.size() - maxEntries;
        if (excess <= 0) {
            return;
        }
        List<CachedEntry> newestWriteFirst = new ArrayList<>(entries.values());
        Collections.reverse(newestWriteFirst);
        newestWriteFirst.stream()
            .sorted(Comparator.comparing(CachedEntry::getCachedAt))
            .limit(excess)
            .map(entry -> entry.getItem().getId())
            .toList()
            .forEach(entries::remove);
        pruneDanglingIds();
        log.debug("Trimmed {} oldest offline cache entr{} to stay within {}", excess, excess == 1 ? "y" : "ies", maxEntries);
    }

    private boolean pruneDanglingIds() {
        boolean changed = false;
        Iterator<Map.Entry<String, List<Integer>>> iterator = categories.entrySet().iterator();
        while (iterator.hasNext()) {
            List<Integer> ids = iterator.next().getValue();
            changed |= ids.removeIf(id -> !entries.containsKey(id));
            if (ids.isEmpty()) {
                iterator.remove();
                changed = true;
            }
        }
        return changed;
    }

    private void persist() {
        if (store == null) {
            return;
        }
        CacheSnapshot snapshot = new CacheSnapshot();
        snapshot.setSavedAt(clock.instant());
        snapshot.setEntries(new ArrayList<>(entries.values()));
        Map<String, List<Integer>> indexCopy = new LinkedHashMap<>();
        categories.forEach((name, ids) -> indexCopy.put(name, new ArrayList<>(ids)));
        snapshot.setCategories(indexCopy);
        if (!store.write(snapshot)) {
            metricsService.incrementPersistenceFailure();
        }
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttl);
        }
    }

    private static <T> Collection<T> nullToEmpty(Collection<T> values) {
        return values == null ? List.of() : values;
    }
}
