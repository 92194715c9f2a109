package com.trading.retention.metrics;

import com.trading.retention.cleanup.CleanupOperation;

/**
 * No-op implementation of {@link RetentionMetrics}.
 */
public class NoOpRetentionMetrics implements RetentionMetrics {

    @Override
    public void recordCleanupOperation(CleanupOperation operation) {
    }

    @Override
    public void recordCycle(boolean success) {
    }

    @Override
    public void recordStorageSize(long totalSizeBytes) {
    }
}
