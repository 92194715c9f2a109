package com.trading.retention.monitor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Storage statistics captured at a given time, kept in the monitor's history.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageSnapshot(
        @JsonProperty("snapshot_id") String snapshotId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("stats") StorageStats stats
) {
    public StorageSnapshot {
        Objects.requireNonNull(snapshotId, "snapshotId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(stats, "stats is required");
    }

    public long totalSizeBytes() {
        return stats.totalSizeBytes();
    }
}
