/**
 * Main application class for the Movie Discovery Engine
 *
 * @author William Callahan
 *
 * Features:
 * - Runs as a non-web Spring Boot application hosting the catalog access core
 * - Enables scheduling for cache maintenance
 * - Loads a local .env file so the catalog API key can live outside configuration
 * - Supports one-shot command line tasks such as offline prefetch and cache statistics
 */

package com.williamcallahan.movie_discovery_engine;

import com.williamcallahan.movie_discovery_engine.model.CacheStats;
import com.williamcallahan.movie_discovery_engine.service.CatalogDiscoveryService;
import com.williamcallahan.movie_discovery_engine.service.cache.OfflineCatalogCache;
import com.williamcallahan.movie_discovery_engine.types.CatalogCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

@SpringBootApplication
@EnableScheduling
public class MovieDiscoveryEngineApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(MovieDiscoveryEngineApplication.class);

    private static final Duration PREFETCH_TIMEOUT = Duration.ofMinutes(5);

    private final CatalogDiscoveryService catalogDiscoveryService;
    private final OfflineCatalogCache offlineCatalogCache;

    public MovieDiscoveryEngineApplication(CatalogDiscoveryService catalogDiscoveryService,
                                           OfflineCatalogCache offlineCatalogCache) {
        this.catalogDiscoveryService = catalogDiscoveryService;
        this.offlineCatalogCache = offlineCatalogCache;
    }

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile(Paths.get(".env"));
        SpringApplication.run(MovieDiscoveryEngineApplication.class, args);
    }

    /**
     * Copies entries from a .env file into system properties unless the environment already defines them
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(envFile)) {
            props.load(is);
        } catch (IOException | SecurityException e) {
            log.warn("Unable to read {}: {}", envFile, e.getMessage());
            return;
        }
        for (String key : props.stringPropertyNames()) {
            if (System.getenv(key) == null && System.getProperty(key) == null) {
                System.setProperty(key, props.getProperty(key));
            }
        }
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("offline.prefetch")) {
            List<CatalogCategory> categories = parseCategories(firstOptionValue(args, "offline.prefetch"));
            log.info("Prefetching {} categor{} for offline use", categories.size(), categories.size() == 1 ? "y" : "ies");
            Map<CatalogCategory, Integer> stored = catalogDiscoveryService.prefetchForOffline(categories)
                .block(PREFETCH_TIMEOUT);
            log.info("Offline prefetch stored: {}", stored);
        }

        if (args.containsOption("offline.evict")) {
            int evicted = offlineCatalogCache.evictExpired();
            log.info("Evicted {} expired offline cache entries", evicted);
        }

        if (args.containsOption("offline.stats")) {
            CacheStats stats = offlineCatalogCache.getStats();
            log.info("Offline cache: total={}, valid={}, expired={}, categories={}",
                stats.getTotalItems(), stats.getValidItems(), stats.getExpiredItems(), stats.getCategoryCounts());
        }
    }

    /**
     * Parse a comma separated category list; an absent or blank value means every category
     */
    static List<CatalogCategory> parseCategories(String value) {
        if (value == null || value.isBlank()) {
            return Arrays.asList(CatalogCategory.values());
        }
        List<CatalogCategory> categories = new ArrayList<>();
        for (String name : value.split(",")) {
            Optional<CatalogCategory> category = CatalogCategory.fromName(name);
            if (category.isPresent()) {
                categories.add(category.get());
            } else {
                log.warn("Ignoring unknown category '{}'", name.trim());
            }
        }
        return categories;
    }

    private String firstOptionValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return (values == null || values.isEmpty()) ? null : values.get(0);
    }
}
