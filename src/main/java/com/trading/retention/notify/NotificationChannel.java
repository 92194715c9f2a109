package com.trading.retention.notify;

import java.util.Locale;
import java.util.Optional;

/**
 * Places a cleanup notification can be sent to.
 */
public enum NotificationChannel {
    LOG("log"),
    CONSOLE("console"),
    FILE("file");

    private final String value;

    NotificationChannel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolves a configured channel name, ignoring case. Empty for unknown names.
     */
    public static Optional<NotificationChannel> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (NotificationChannel channel : values()) {
            if (channel.value.equals(normalized)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }
}
