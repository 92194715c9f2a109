package com.trading.retention.scheduler;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of the retention scheduler.
 *
 * @param enabled                 whether {@link RetentionScheduler#start()} starts the timer
 * @param cleanupSchedule         daily cleanup time as {@code HH:MM}
 * @param checkIntervalMinutes    minutes between eligibility checks; also the width of the run window
 * @param maxCleanupDurationHours expected upper bound of a cycle; exceeding it is only logged
 * @param backupBeforeCleanup     create a backup before each scheduled cycle
 * @param notificationChannels    channels notified after each cycle
 * @param logLevel                log level reported with the configuration
 * @param dryRun                  run cleanup without deleting
 */
public record SchedulerConfig(
        boolean enabled,
        String cleanupSchedule,
        int checkIntervalMinutes,
        int maxCleanupDurationHours,
        boolean backupBeforeCleanup,
        List<String> notificationChannels,
        String logLevel,
        boolean dryRun
) {
    private static final DateTimeFormatter SCHEDULE_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    public SchedulerConfig {
        Objects.requireNonNull(cleanupSchedule, "cleanupSchedule is required");
        parseSchedule(cleanupSchedule);
        if (checkIntervalMinutes <= 0) {
            throw new IllegalArgumentException("checkIntervalMinutes must be positive");
        }
        if (maxCleanupDurationHours <= 0) {
            throw new IllegalArgumentException("maxCleanupDurationHours must be positive");
        }
        notificationChannels = notificationChannels != null ? List.copyOf(notificationChannels) : List.of();
        logLevel = logLevel != null ? logLevel : "INFO";
    }

    public static SchedulerConfig defaults() {
        return builder().build();
    }

    /**
     * The daily cleanup time.
     */
    public LocalTime scheduledTime() {
        return parseSchedule(cleanupSchedule);
    }

    private static LocalTime parseSchedule(String schedule) {
        try {
            return LocalTime.parse(schedule.trim(), SCHEDULE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("cleanupSchedule must be HH:MM, got '" + schedule + "'", e);
        }
    }

    public Builder toBuilder() {
        return new Builder()
                .enabled(enabled)
                .cleanupSchedule(cleanupSchedule)
                .checkIntervalMinutes(checkIntervalMinutes)
                .maxCleanupDurationHours(maxCleanupDurationHours)
                .backupBeforeCleanup(backupBeforeCleanup)
                .notificationChannels(notificationChannels)
                .logLevel(logLevel)
                .dryRun(dryRun);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private String cleanupSchedule = "03:00";
        private int checkIntervalMinutes = 60;
        private int maxCleanupDurationHours = 4;
        private boolean backupBeforeCleanup = true;
        private List<String> notificationChannels = List.of("log");
        private String logLevel = "INFO";
        private boolean dryRun = false;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder cleanupSchedule(String cleanupSchedule) {
            this.cleanupSchedule = cleanupSchedule;
            return this;
        }

        public Builder checkIntervalMinutes(int minutes) {
            this.checkIntervalMinutes = minutes;
            return this;
        }

        public Builder maxCleanupDurationHours(int hours) {
            this.maxCleanupDurationHours = hours;
            return this;
        }

        public Builder backupBeforeCleanup(boolean backupBeforeCleanup) {
            this.backupBeforeCleanup = backupBeforeCleanup;
            return this;
        }

        public Builder notificationChannels(List<String> channels) {
            this.notificationChannels = channels;
            return this;
        }

        public Builder logLevel(String logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(enabled, cleanupSchedule, checkIntervalMinutes, maxCleanupDurationHours,
                    backupBeforeCleanup, notificationChannels, logLevel, dryRun);
        }
    }
}
