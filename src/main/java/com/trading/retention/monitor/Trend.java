package com.trading.retention.monitor;

/**
 * Direction of a series of storage measurements.
 */
public enum Trend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String value;

    Trend(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
