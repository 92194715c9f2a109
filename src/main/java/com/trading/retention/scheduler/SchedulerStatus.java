package com.trading.retention.scheduler;

import java.time.Instant;

/**
 * Point-in-time view of the scheduler's counters.
 *
 * @param running            whether the timer is active
 * @param lastCleanup        completion time of the last successful cycle, null if none
 * @param nextCleanup        next scheduled run while running, null when stopped
 * @param totalCleanups      cycles that completed without an exception
 * @param successfulCleanups cycles that completed without an exception
 * @param failedCleanups     cycles aborted by an exception
 * @param lastError          message of the most recent problem, null if none
 * @param uptimeSeconds      seconds since start while running, otherwise 0
 */
public record SchedulerStatus(
        boolean running,
        Instant lastCleanup,
        Instant nextCleanup,
        int totalCleanups,
        int successfulCleanups,
        int failedCleanups,
        String lastError,
        double uptimeSeconds
) {
}
