package com.trading.retention.health;

import com.trading.retention.monitor.StorageHealth;
import com.trading.retention.monitor.StorageMonitor;
import com.trading.retention.monitor.StorageStats;

import java.util.Objects;

/**
 * Reports the storage size band of the record store: healthy is UP, caution and warning are
 * DEGRADED, critical is DOWN.
 */
public class StorageHealthCheck implements HealthCheck {

    private final StorageMonitor monitor;

    public StorageHealthCheck(StorageMonitor monitor) {
        this.monitor = Objects.requireNonNull(monitor, "monitor");
    }

    @Override
    public String getName() {
        return "storage";
    }

    @Override
    public HealthStatus check() {
        StorageStats stats = monitor.getCurrentStats();
        double sizeMb = stats.totalSizeMb();
        StorageHealth health = StorageHealth.assess(sizeMb);
        String message = String.format("Storage %s at %.1fMB", health.getValue(), sizeMb);

        HealthStatus base = switch (health) {
            case HEALTHY -> HealthStatus.up(message);
            case CAUTION, WARNING -> HealthStatus.degraded(message);
            case CRITICAL -> HealthStatus.down(message);
        };
        return base
                .withDetail("health", health.getValue())
                .withDetail("totalSizeMb", Math.round(sizeMb * 100.0) / 100.0)
                .withDetail("dataTypes", stats.dataTypeBreakdown().size())
                .withDetail("lastCleanupDate", stats.lastCleanupDate() != null ? stats.lastCleanupDate().toString() : null);
    }
}
