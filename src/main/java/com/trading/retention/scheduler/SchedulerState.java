package com.trading.retention.scheduler;

import java.time.Instant;

/**
 * Mutable counters owned by one {@link RetentionScheduler}. All access is synchronized on
 * the instance; only the cycle completion path writes to it.
 */
final class SchedulerState {

    private Instant lastCleanup;
    private int totalCleanups;
    private int successfulCleanups;
    private int failedCleanups;
    private String lastError;
    private boolean lastCycleFailed;

    synchronized void recordCompleted(Instant startedAt, int failedOperations) {
        totalCleanups++;
        successfulCleanups++;
        lastCleanup = startedAt;
        lastError = failedOperations > 0 ? failedOperations + " operations failed" : null;
        lastCycleFailed = false;
    }

    synchronized void recordFailed(String error) {
        failedCleanups++;
        lastError = error;
        lastCycleFailed = true;
    }

    synchronized Instant lastCleanup() {
        return lastCleanup;
    }

    synchronized boolean lastCycleFailed() {
        return lastCycleFailed;
    }

    synchronized SchedulerStatus toStatus(boolean running, Instant nextCleanup, double uptimeSeconds) {
        return new SchedulerStatus(running, lastCleanup, nextCleanup, totalCleanups, successfulCleanups,
                failedCleanups, lastError, uptimeSeconds);
    }
}
