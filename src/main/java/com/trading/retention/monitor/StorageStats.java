package com.trading.retention.monitor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Storage usage at one point in time.
 *
 * @param totalSizeBytes    sum of all data-type sizes
 * @param dataTypeBreakdown bytes per data type
 * @param recordCounts      rows per data type
 * @param oldestRecordDate  oldest row timestamp across all types, null if unknown
 * @param newestRecordDate  newest row timestamp across all types, null if unknown
 * @param lastCleanupDate   completion time of the latest cleanup cycle, null if none yet
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageStats(
        @JsonProperty("total_size_bytes") long totalSizeBytes,
        @JsonProperty("data_type_breakdown") Map<String, Long> dataTypeBreakdown,
        @JsonProperty("record_counts") Map<String, Long> recordCounts,
        @JsonProperty("oldest_record_date") Instant oldestRecordDate,
        @JsonProperty("newest_record_date") Instant newestRecordDate,
        @JsonProperty("last_cleanup_date") Instant lastCleanupDate
) {
    static final double BYTES_PER_MB = 1024.0 * 1024.0;

    public StorageStats {
        if (totalSizeBytes < 0) {
            throw new IllegalArgumentException("totalSizeBytes must not be negative");
        }
        dataTypeBreakdown = dataTypeBreakdown != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(dataTypeBreakdown)) : Map.of();
        recordCounts = recordCounts != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(recordCounts)) : Map.of();
    }

    public static StorageStats empty() {
        return new StorageStats(0, Map.of(), Map.of(), null, null, null);
    }

    @JsonIgnore
    public double totalSizeMb() {
        return totalSizeBytes / BYTES_PER_MB;
    }

    /**
     * Per data type sizes in megabytes, in breakdown order.
     */
    @JsonIgnore
    public Map<String, Double> dataTypeBreakdownMb() {
        Map<String, Double> mb = new LinkedHashMap<>();
        dataTypeBreakdown.forEach((type, bytes) -> mb.put(type, bytes / BYTES_PER_MB));
        return mb;
    }
}
