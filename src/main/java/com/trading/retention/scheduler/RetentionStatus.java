package com.trading.retention.scheduler;

import com.trading.retention.monitor.StorageStats;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Overall retention status: policy counts, current storage and active scheduler configuration.
 */
public record RetentionStatus(
        boolean enabled,
        int policiesCount,
        int activePolicies,
        StorageStats storageStats,
        Instant lastCleanup,
        SchedulerConfig config
) {
    public Map<String, Object> toMap() {
        Map<String, Object> storage = new LinkedHashMap<>();
        storage.put("total_size_mb", storageStats.totalSizeMb());
        storage.put("data_type_breakdown", storageStats.dataTypeBreakdown());
        storage.put("record_counts", storageStats.recordCounts());

        Map<String, Object> configMap = new LinkedHashMap<>();
        configMap.put("cleanup_schedule", config.cleanupSchedule());
        configMap.put("backup_before_cleanup", config.backupBeforeCleanup());
        configMap.put("dry_run", config.dryRun());

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("enabled", enabled);
        map.put("policies_count", policiesCount);
        map.put("active_policies", activePolicies);
        map.put("storage_stats", storage);
        map.put("last_cleanup", lastCleanup != null ? lastCleanup.toString() : null);
        map.put("config", configMap);
        return map;
    }
}
