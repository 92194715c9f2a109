package com.trading.retention.monitor;

/**
 * Storage monitoring settings.
 *
 * @param enabled               whether periodic snapshots run
 * @param checkIntervalHours    hours between periodic snapshots
 * @param warningThresholdMb    size at which the warning alert level applies
 * @param criticalThresholdMb   size at which the critical alert level applies
 * @param historyRetentionDays  minimum number of days of snapshots to keep
 * @param includeTrends         whether reports include trend analysis by default
 */
public record MonitoringConfig(
        boolean enabled,
        int checkIntervalHours,
        double warningThresholdMb,
        double criticalThresholdMb,
        int historyRetentionDays,
        boolean includeTrends
) {
    public MonitoringConfig {
        if (checkIntervalHours <= 0) {
            throw new IllegalArgumentException("checkIntervalHours must be positive");
        }
        if (warningThresholdMb < 0 || criticalThresholdMb < 0) {
            throw new IllegalArgumentException("thresholds must not be negative");
        }
        if (criticalThresholdMb < warningThresholdMb) {
            throw new IllegalArgumentException("criticalThresholdMb must not be below warningThresholdMb");
        }
        if (historyRetentionDays <= 0) {
            throw new IllegalArgumentException("historyRetentionDays must be positive");
        }
    }

    public static MonitoringConfig defaults() {
        return new MonitoringConfig(true, 6, 1000, 5000, 30, true);
    }
}
