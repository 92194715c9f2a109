package com.trading.retention;

import com.trading.retention.cleanup.CleanupOperation;
import com.trading.retention.config.RetentionConfiguration;
import com.trading.retention.health.HealthStatus;
import com.trading.retention.monitor.MonitoringConfig;
import com.trading.retention.scheduler.ManualCleanupResult;
import com.trading.retention.scheduler.RetentionStatus;
import com.trading.retention.scheduler.SchedulerConfig;
import com.trading.retention.store.InMemoryRecordStore;
import com.trading.retention.store.StoredRecord;
import com.trading.retention.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetentionSystem Tests")
class RetentionSystemTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private InMemoryRecordStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new InMemoryRecordStore();
        store.insert("market_data", new StoredRecord("md-old", NOW.minus(Duration.ofDays(30)), 4096));
        store.insert("market_data", new StoredRecord("md-new", NOW.minus(Duration.ofDays(1)), 4096));
        store.insert("trades", new StoredRecord("t-old", NOW.minus(Duration.ofDays(500)), 1024));
    }

    private RetentionSystem.Builder system() {
        return RetentionSystem.builder()
                .configuration(RetentionConfiguration.builder()
                        .scheduler(SchedulerConfig.builder()
                                .backupBeforeCleanup(false)
                                .notificationChannels(List.of())
                                .build())
                        .build())
                .recordStore(store)
                .clock(clock);
    }

    @Test
    @DisplayName("Should require a record store")
    void requiresRecordStore() {
        assertThrows(IllegalStateException.class, () -> RetentionSystem.builder().build());
    }

    @Test
    @DisplayName("Missing config file should load defaults")
    void missingConfigFile() {
        try (RetentionSystem system = RetentionSystem.builder()
                .configFile(tempDir.resolve("none.yaml"))
                .recordStore(store)
                .build()) {
            assertEquals(RetentionConfiguration.defaults(), system.getConfiguration());
        }
    }

    @Test
    @DisplayName("Dry run should report without deleting")
    void dryRun() {
        try (RetentionSystem system = system().build()) {
            List<CleanupOperation> operations = system.runCleanup(null, true);

            assertEquals(List.of("trades", "orders", "positions", "equity_curve", "market_data"),
                    operations.stream().map(CleanupOperation::dataType).toList());
            assertEquals(3, store.rowCount("market_data") + store.rowCount("trades"));
        }
    }

    @Test
    @DisplayName("Manual cleanup should delete and record metrics")
    void manualCleanup() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (RetentionSystem system = system().meterRegistry(registry).build()) {
            ManualCleanupResult result = system.runManualCleanup(null);

            assertTrue(result.success());
            assertEquals(2, result.totalRecordsDeleted());
            assertEquals(1, store.rowCount("market_data"));
            assertNotNull(registry.find("retention.records.deleted").tag("dataType", "market_data").counter());
        }
    }

    @Test
    @DisplayName("Global dry run should reach the scheduler")
    void globalDryRun() {
        RetentionConfiguration config = RetentionConfiguration.builder().dryRun(true).build();
        try (RetentionSystem system = system().configuration(config).build()) {
            system.runManualCleanup(List.of("market_data"));

            assertTrue(system.getScheduler().getConfig().dryRun());
            assertEquals(2, store.rowCount("market_data"));
        }
    }

    @Test
    @DisplayName("Start and close should drive scheduler and monitor")
    void lifecycle() {
        RetentionSystem system = system().build();

        system.start();
        assertTrue(system.getScheduler().isRunning());
        assertTrue(system.getMonitor().isRunning());
        assertTrue(system.health().isUp());

        system.close();
        assertFalse(system.getScheduler().isRunning());
        assertFalse(system.getMonitor().isRunning());
        assertTrue(system.health().isDown());
    }

    @Test
    @DisplayName("Status should combine policies, stats and configuration")
    void retentionStatus() {
        try (RetentionSystem system = system().build()) {
            RetentionStatus status = system.getRetentionStatus();

            assertEquals(5, status.policiesCount());
            assertEquals(9216, status.storageStats().totalSizeBytes());
            assertNull(status.lastCleanup());
            assertEquals(0, system.getSchedulerStatus().totalCleanups());
        }
    }

    @Test
    @DisplayName("History file should receive snapshots")
    void historyFile() {
        Path history = tempDir.resolve("history.json");
        RetentionConfiguration config = RetentionConfiguration.builder()
                .monitoring(new MonitoringConfig(false, 6, 1000, 5000, 30, true))
                .build();
        try (RetentionSystem system = system().configuration(config).historyFile(history).build()) {
            system.getMonitor().recordSnapshot();

            assertTrue(Files.exists(history));
            assertEquals(1, system.getMonitor().getHistory().size());
            Map<?, ?> metadata = (Map<?, ?>) system.generateReport().toMap().get("report_metadata");
            assertEquals("storage_analysis", metadata.get("report_type"));
        }
    }
}
