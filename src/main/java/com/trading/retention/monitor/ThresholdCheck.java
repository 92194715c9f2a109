package com.trading.retention.monitor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of comparing the current storage size with the warning and critical thresholds.
 *
 * @param status              normal, warning or critical
 * @param alertLevel          null below the warning threshold
 * @param currentSizeMb       current total size
 * @param warningThresholdMb  warning threshold that was applied
 * @param criticalThresholdMb critical threshold that was applied
 * @param message             human-readable summary
 * @param timestamp           when the check ran
 */
public record ThresholdCheck(
        String status,
        AlertLevel alertLevel,
        double currentSizeMb,
        double warningThresholdMb,
        double criticalThresholdMb,
        String message,
        Instant timestamp
) {
    public static final String NORMAL = "normal";

    static ThresholdCheck evaluate(double currentSizeMb, double warningMb, double criticalMb, Instant now) {
        if (currentSizeMb >= criticalMb) {
            return new ThresholdCheck(AlertLevel.CRITICAL.getValue(), AlertLevel.CRITICAL, currentSizeMb,
                    warningMb, criticalMb,
                    String.format("CRITICAL: Database size (%.1fMB) exceeds critical threshold (%.1fMB)",
                            currentSizeMb, criticalMb), now);
        }
        if (currentSizeMb >= warningMb) {
            return new ThresholdCheck(AlertLevel.WARNING.getValue(), AlertLevel.WARNING, currentSizeMb,
                    warningMb, criticalMb,
                    String.format("WARNING: Database size (%.1fMB) exceeds warning threshold (%.1fMB)",
                            currentSizeMb, warningMb), now);
        }
        return new ThresholdCheck(NORMAL, null, currentSizeMb, warningMb, criticalMb,
                String.format("Database size (%.1fMB) is within normal limits", currentSizeMb), now);
    }

    public boolean isAlert() {
        return alertLevel != null;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("status", status);
        map.put("alert_level", alertLevel != null ? alertLevel.getValue() : null);
        map.put("current_size_mb", currentSizeMb);
        map.put("warning_threshold_mb", warningThresholdMb);
        map.put("critical_threshold_mb", criticalThresholdMb);
        map.put("message", message);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
