package com.trading.retention.config;

import com.trading.retention.cleanup.CleanupSettings;
import com.trading.retention.monitor.MonitoringConfig;
import com.trading.retention.policy.PolicyStore;
import com.trading.retention.scheduler.SchedulerConfig;

import java.util.Objects;

/**
 * Complete retention configuration as loaded from one YAML document.
 *
 * @param enabled    global switch for cleanup
 * @param dryRun     global dry-run flag; also forces the scheduler into dry run
 * @param scheduler  scheduler settings
 * @param policies   retention policies by data type
 * @param cleanup    cleanup bookkeeping switches
 * @param monitoring storage monitoring settings
 */
public record RetentionConfiguration(
        boolean enabled,
        boolean dryRun,
        SchedulerConfig scheduler,
        PolicyStore policies,
        CleanupSettings cleanup,
        MonitoringConfig monitoring
) {
    public RetentionConfiguration {
        Objects.requireNonNull(scheduler, "scheduler is required");
        Objects.requireNonNull(policies, "policies is required");
        Objects.requireNonNull(cleanup, "cleanup is required");
        Objects.requireNonNull(monitoring, "monitoring is required");
    }

    public static RetentionConfiguration defaults() {
        return builder().build();
    }

    /**
     * Scheduler settings with the global dry-run flag applied.
     */
    public SchedulerConfig effectiveSchedulerConfig() {
        if (dryRun && !scheduler.dryRun()) {
            return scheduler.toBuilder().dryRun(true).build();
        }
        return scheduler;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private boolean dryRun = false;
        private SchedulerConfig scheduler = SchedulerConfig.defaults();
        private PolicyStore policies = PolicyStore.defaults();
        private CleanupSettings cleanup = CleanupSettings.defaults();
        private MonitoringConfig monitoring = MonitoringConfig.defaults();

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder scheduler(SchedulerConfig scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder policies(PolicyStore policies) {
            this.policies = policies;
            return this;
        }

        public Builder cleanup(CleanupSettings cleanup) {
            this.cleanup = cleanup;
            return this;
        }

        public Builder monitoring(MonitoringConfig monitoring) {
            this.monitoring = monitoring;
            return this;
        }

        public RetentionConfiguration build() {
            return new RetentionConfiguration(enabled, dryRun, scheduler, policies, cleanup, monitoring);
        }
    }
}
