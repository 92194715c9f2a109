package com.trading.retention.monitor;

/**
 * Trend of a single data type over the analysis window.
 */
public record DataTypeTrend(
        Trend trend,
        double growthRateBytesPerDay,
        long currentSizeBytes
) {
    public double currentSizeMb() {
        return currentSizeBytes / StorageStats.BYTES_PER_MB;
    }
}
