package com.trading.retention.health;

import com.trading.retention.scheduler.RetentionScheduler;
import com.trading.retention.scheduler.SchedulerStatus;

import java.util.Objects;

/**
 * DOWN when the scheduler is enabled but not running, DEGRADED when its latest cycle failed.
 */
public class SchedulerHealthCheck implements HealthCheck {

    private final RetentionScheduler scheduler;

    public SchedulerHealthCheck(RetentionScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    @Override
    public String getName() {
        return "scheduler";
    }

    @Override
    public HealthStatus check() {
        SchedulerStatus status = scheduler.getStatus();

        HealthStatus base;
        if (!scheduler.getConfig().enabled()) {
            base = HealthStatus.up("Scheduler disabled");
        } else if (!status.running()) {
            base = HealthStatus.down("Scheduler enabled but not running");
        } else if (scheduler.lastCycleFailed()) {
            base = HealthStatus.degraded("Last cleanup cycle failed: " + status.lastError());
        } else {
            base = HealthStatus.up("Scheduler running");
        }

        return base
                .withDetail("running", status.running())
                .withDetail("totalCleanups", status.totalCleanups())
                .withDetail("failedCleanups", status.failedCleanups())
                .withDetail("lastCleanup", status.lastCleanup() != null ? status.lastCleanup().toString() : null)
                .withDetail("nextCleanup", status.nextCleanup() != null ? status.nextCleanup().toString() : null);
    }
}
