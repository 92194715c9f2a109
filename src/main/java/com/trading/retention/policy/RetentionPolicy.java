package com.trading.retention.policy;

import java.util.Objects;

/**
 * Retention windows and priority tier for one data type.
 *
 * <p>The four windows are alternative ways of stating how long data is kept. Cleanup strategies
 * convert them to day counts (weeks x 7, months x 30, years x 365) and pick the longest or the
 * shortest depending on the tier of the data type.</p>
 *
 * @param enabled         whether cleanup may select records of this type
 * @param retentionDays   retention window in days
 * @param retentionWeeks  retention window in weeks
 * @param retentionMonths retention window in months (30 days each)
 * @param retentionYears  retention window in years (365 days each)
 * @param priority        declared priority tier
 * @param description     human-readable description
 */
public record RetentionPolicy(
        boolean enabled,
        int retentionDays,
        int retentionWeeks,
        int retentionMonths,
        int retentionYears,
        DataPriority priority,
        String description
) {
    static final int DAYS_PER_WEEK = 7;
    static final int DAYS_PER_MONTH = 30;
    static final int DAYS_PER_YEAR = 365;

    public RetentionPolicy {
        Objects.requireNonNull(priority, "priority is required");
        if (retentionDays < 0) {
            throw new IllegalArgumentException("retentionDays must not be negative");
        }
        if (retentionWeeks < 0) {
            throw new IllegalArgumentException("retentionWeeks must not be negative");
        }
        if (retentionMonths < 0) {
            throw new IllegalArgumentException("retentionMonths must not be negative");
        }
        if (retentionYears < 0) {
            throw new IllegalArgumentException("retentionYears must not be negative");
        }
        description = description != null ? description : "";
    }

    /**
     * Returns the longest configured window expressed in days.
     */
    public int longestWindowDays() {
        return Math.max(Math.max(retentionDays, retentionWeeks * DAYS_PER_WEEK),
                Math.max(retentionMonths * DAYS_PER_MONTH, retentionYears * DAYS_PER_YEAR));
    }

    /**
     * Returns the shortest configured window expressed in days.
     */
    public int shortestWindowDays() {
        return Math.min(Math.min(retentionDays, retentionWeeks * DAYS_PER_WEEK),
                Math.min(retentionMonths * DAYS_PER_MONTH, retentionYears * DAYS_PER_YEAR));
    }

    /**
     * True if at least one window is positive. A policy without any positive window never
     * selects records older than "now" in a meaningful way.
     */
    public boolean hasPositiveWindow() {
        return retentionDays > 0 || retentionWeeks > 0 || retentionMonths > 0 || retentionYears > 0;
    }

    /**
     * Policy used for critical trading records: 30 days / 4 weeks / 6 months / 1 year.
     */
    public static RetentionPolicy critical(String description) {
        return new RetentionPolicy(true, 30, 4, 6, 1, DataPriority.CRITICAL, description);
    }

    /**
     * Policy used for important time series: 15 days / 2 weeks / 3 months / 1 year.
     */
    public static RetentionPolicy important(String description) {
        return new RetentionPolicy(true, 15, 2, 3, 1, DataPriority.IMPORTANT, description);
    }

    /**
     * Policy used for raw operational data: 7 days / 1 week / 1 month / 1 year.
     */
    public static RetentionPolicy operational(String description) {
        return new RetentionPolicy(true, 7, 1, 1, 1, DataPriority.OPERATIONAL, description);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private int retentionDays = 30;
        private int retentionWeeks = 4;
        private int retentionMonths = 6;
        private int retentionYears = 1;
        private DataPriority priority = DataPriority.OPERATIONAL;
        private String description = "";

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder retentionDays(int days) {
            this.retentionDays = days;
            return this;
        }

        public Builder retentionWeeks(int weeks) {
            this.retentionWeeks = weeks;
            return this;
        }

        public Builder retentionMonths(int months) {
            this.retentionMonths = months;
            return this;
        }

        public Builder retentionYears(int years) {
            this.retentionYears = years;
            return this;
        }

        public Builder priority(DataPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public RetentionPolicy build() {
            return new RetentionPolicy(enabled, retentionDays, retentionWeeks, retentionMonths,
                    retentionYears, priority, description);
        }
    }
}
