package com.trading.retention.cleanup;

/**
 * Throughput rating of cleanup work, based on records and megabytes removed per second.
 */
public enum EfficiencyRating {
    EXCELLENT("Excellent"),
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor");

    private final String label;

    EfficiencyRating(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Rates a throughput. Both figures must clear a band for it to apply.
     */
    public static EfficiencyRating of(double recordsPerSecond, double mbPerSecond) {
        if (recordsPerSecond > 1000 && mbPerSecond > 10) {
            return EXCELLENT;
        } else if (recordsPerSecond > 500 && mbPerSecond > 5) {
            return GOOD;
        } else if (recordsPerSecond > 100 && mbPerSecond > 1) {
            return FAIR;
        }
        return POOR;
    }
}
