package com.trading.retention.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Sends one-line cleanup notifications to the configured channels.
 *
 * <p>A channel that fails to deliver is logged and skipped; notification problems never
 * fail a cleanup cycle.</p>
 */
public class ChannelNotifier {
    private static final Logger log = LoggerFactory.getLogger(ChannelNotifier.class);

    public static final Path DEFAULT_FILE = Path.of("logs", "retention", "notifications.log");

    private final Path notificationFile;
    private final PrintStream console;
    private final Clock clock;

    public ChannelNotifier() {
        this(DEFAULT_FILE, System.out, Clock.systemUTC());
    }

    public ChannelNotifier(Path notificationFile, PrintStream console, Clock clock) {
        this.notificationFile = Objects.requireNonNull(notificationFile, "notificationFile");
        this.console = Objects.requireNonNull(console, "console");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Sends an informational message.
     */
    public void notify(List<String> channels, String message) {
        send(channels, message, false);
    }

    /**
     * Sends an error message. The log channel writes it at ERROR.
     */
    public void notifyError(List<String> channels, String message) {
        send(channels, message, true);
    }

    private void send(List<String> channels, String message, boolean error) {
        for (String name : channels) {
            NotificationChannel channel = NotificationChannel.fromName(name).orElse(null);
            if (channel == null) {
                log.warn("notification.unknownChannel channel={}", name);
                continue;
            }
            switch (channel) {
                case LOG -> {
                    if (error) {
                        log.error("notification.sent message={}", message);
                    } else {
                        log.info("notification.sent message={}", message);
                    }
                }
                case CONSOLE -> console.println("NOTIFICATION: " + message);
                case FILE -> appendToFile(message);
            }
        }
    }

    private void appendToFile(String message) {
        String line = clock.instant() + " - " + message + System.lineSeparator();
        try {
            Path parent = notificationFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(notificationFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("notification.fileFailed file={} error={}", notificationFile, e.getMessage());
        }
    }

    public Path getNotificationFile() {
        return notificationFile;
    }
}
