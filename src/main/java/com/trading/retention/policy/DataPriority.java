package com.trading.retention.policy;

import java.util.Locale;

/**
 * Priority tier of a data type.
 * Declaration order is processing order: CRITICAL data is cleaned up first, OPERATIONAL last.
 */
public enum DataPriority {
    CRITICAL("critical"),
    IMPORTANT("important"),
    OPERATIONAL("operational");

    private final String value;

    DataPriority(String value) {
        this.value = value;
    }

    /**
     * Lowercase name used in configuration documents and reports.
     */
    public String getValue() {
        return value;
    }

    /**
     * Parses a configuration value such as {@code "critical"}. Case-insensitive.
     *
     * @throws IllegalArgumentException if the value names no tier
     */
    public static DataPriority fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("priority must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DataPriority priority : values()) {
            if (priority.value.equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown data priority: " + value);
    }
}
