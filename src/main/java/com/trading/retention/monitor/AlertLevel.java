package com.trading.retention.monitor;

/**
 * Alert level raised by a threshold check.
 */
public enum AlertLevel {
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    AlertLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
