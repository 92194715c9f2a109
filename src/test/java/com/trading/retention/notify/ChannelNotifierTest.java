package com.trading.retention.notify;

import com.trading.retention.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChannelNotifier Tests")
class ChannelNotifierTest {

    private static final Instant NOW = Instant.parse("2026-03-01T03:05:00Z");

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream console;
    private Path file;
    private ChannelNotifier notifier;

    @BeforeEach
    void setUp() {
        console = new ByteArrayOutputStream();
        file = tempDir.resolve("nested").resolve("notifications.log");
        notifier = new ChannelNotifier(file, new PrintStream(console, true, StandardCharsets.UTF_8),
                new MutableClock(NOW));
    }

    @Test
    @DisplayName("Console channel should print a prefixed line")
    void testConsole() {
        notifier.notify(List.of("console"), "cleanup done");

        assertEquals("NOTIFICATION: cleanup done", console.toString(StandardCharsets.UTF_8).trim());
        assertFalse(Files.exists(file));
    }

    @Test
    @DisplayName("File channel should append timestamped lines and create directories")
    void testFile() throws IOException {
        notifier.notify(List.of("file"), "first");
        notifier.notifyError(List.of("FILE"), "second");

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(List.of(NOW + " - first", NOW + " - second"), lines);
    }

    @Test
    @DisplayName("Unknown channels should be skipped")
    void testUnknownChannel() {
        assertDoesNotThrow(() -> notifier.notify(List.of("pager", "console"), "hello"));

        assertTrue(console.toString(StandardCharsets.UTF_8).contains("NOTIFICATION: hello"));
    }

    @Test
    @DisplayName("Log channel should not write to console or file")
    void testLogChannel() {
        notifier.notify(List.of("log"), "quiet");

        assertEquals("", console.toString(StandardCharsets.UTF_8));
        assertFalse(Files.exists(file));
    }

    @Test
    @DisplayName("Channel names should resolve case-insensitively")
    void testFromName() {
        assertEquals(NotificationChannel.CONSOLE, NotificationChannel.fromName(" Console ").orElseThrow());
        assertTrue(NotificationChannel.fromName("email").isEmpty());
        assertTrue(NotificationChannel.fromName(null).isEmpty());
    }
}
