package com.trading.retention.monitor;

/**
 * Coarse health classification of the total storage size.
 */
public enum StorageHealth {
    HEALTHY("healthy"),
    CAUTION("caution"),
    WARNING("warning"),
    CRITICAL("critical");

    static final double CAUTION_MB = 500;
    static final double WARNING_MB = 1000;
    static final double CRITICAL_MB = 5000;

    private final String value;

    StorageHealth(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Classifies a total size: below 500 MB healthy, below 1000 MB caution,
     * below 5000 MB warning, otherwise critical.
     */
    public static StorageHealth assess(double totalSizeMb) {
        if (totalSizeMb >= CRITICAL_MB) {
            return CRITICAL;
        } else if (totalSizeMb >= WARNING_MB) {
            return WARNING;
        } else if (totalSizeMb >= CAUTION_MB) {
            return CAUTION;
        }
        return HEALTHY;
    }
}
