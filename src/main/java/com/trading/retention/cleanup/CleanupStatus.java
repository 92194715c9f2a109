package com.trading.retention.cleanup;

/**
 * Outcome of the cleanup of one data type.
 */
public enum CleanupStatus {
    SUCCESS("success"),
    FAILED("failed");

    private final String value;

    CleanupStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
