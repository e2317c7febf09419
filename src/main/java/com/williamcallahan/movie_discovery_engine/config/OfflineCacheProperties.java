/**
 * Offline catalog cache configuration properties
 *
 * @author William Callahan
 */

package com.williamcallahan.movie_discovery_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.offline-cache")
public class OfflineCacheProperties {
    private String file = "data/offline-catalog-cache.json";
    private int maxEntries = 500;
    private Duration maxDiskAge = Duration.ofDays(7);
    private Duration searchTtl = Duration.ofMinutes(30);
    private Duration detailsTtl = Duration.ofHours(24);
    private boolean maintenanceEnabled = true;
    private Duration maintenanceInterval = Duration.ofMinutes(15);

    public String getFile() { return file; }
    public void setFile(String file) { this.file = file; }

    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

    public Duration getMaxDiskAge() { return maxDiskAge; }
    public void setMaxDiskAge(Duration maxDiskAge) { this.maxDiskAge = maxDiskAge; }

    public Duration getSearchTtl() { return searchTtl; }
    public void setSearchTtl(Duration searchTtl) { this.searchTtl = searchTtl; }

    public Duration getDetailsTtl() { return detailsTtl; }
    public void setDetailsTtl(Duration detailsTtl) { this.detailsTtl = detailsTtl; }

    public boolean isMaintenanceEnabled() { return maintenanceEnabled; }
    public void setMaintenanceEnabled(boolean maintenanceEnabled) { this.maintenanceEnabled = maintenanceEnabled; }

    public Duration getMaintenanceInterval() { return maintenanceInterval; }
    public void setMaintenanceInterval(Duration maintenanceInterval) { this.maintenanceInterval = maintenanceInterval; }
}
