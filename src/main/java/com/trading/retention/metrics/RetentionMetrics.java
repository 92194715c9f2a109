package com.trading.retention.metrics;

import com.trading.retention.cleanup.CleanupOperation;

/**
 * Interface for recording retention metrics.
 * The default {@link NoOpRetentionMetrics} does nothing, so the retention system runs
 * without a meter registry.
 */
public interface RetentionMetrics {

    /**
     * Records duration, deleted records and freed bytes of one data-type cleanup.
     */
    void recordCleanupOperation(CleanupOperation operation);

    /**
     * Records the outcome of a whole cleanup cycle.
     */
    void recordCycle(boolean success);

    /**
     * Records the total storage size observed by the latest snapshot.
     */
    void recordStorageSize(long totalSizeBytes);
}
