package com.trading.retention.metrics;

import com.trading.retention.cleanup.CleanupOperation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RetentionMetrics Tests")
class RetentionMetricsTest {

    private static final Instant NOW = Instant.parse("2026-03-01T03:00:00Z");

    @Nested
    @DisplayName("NoOpRetentionMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpRetentionMetrics noOp = new NoOpRetentionMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordCleanupOperation(CleanupOperation.success("op", NOW, "trades", 1, 1, 10, 0.1));
                noOp.recordCycle(true);
                noOp.recordStorageSize(1024);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerRetentionMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerRetentionMetrics metrics = new MicrometerRetentionMetrics(registry);

        @Test
        @DisplayName("Should time cleanup operations by data type and status")
        void recordsTimer() {
            metrics.recordCleanupOperation(CleanupOperation.success("op-1", NOW, "trades", 5, 5, 500, 0.25));
            metrics.recordCleanupOperation(CleanupOperation.success("op-2", NOW, "trades", 3, 3, 300, 0.10));
            metrics.recordCleanupOperation(CleanupOperation.failure("op-3", NOW, "orders", 0.05, "boom"));

            Timer tradesTimer = registry.find("retention.cleanup.duration")
                    .tag("dataType", "trades")
                    .tag("status", "success")
                    .timer();
            Timer ordersTimer = registry.find("retention.cleanup.duration")
                    .tag("dataType", "orders")
                    .tag("status", "failed")
                    .timer();

            assertNotNull(tradesTimer);
            assertEquals(2, tradesTimer.count());
            assertNotNull(ordersTimer);
            assertEquals(1, ordersTimer.count());
        }

        @Test
        @DisplayName("Should count deleted records and freed bytes per data type")
        void countsDeletedAndFreed() {
            metrics.recordCleanupOperation(CleanupOperation.success("op-1", NOW, "market_data", 40, 40, 4000, 1.0));
            metrics.recordCleanupOperation(CleanupOperation.success("op-2", NOW, "market_data", 10, 10, 1000, 1.0));

            Counter deleted = registry.find("retention.records.deleted").tag("dataType", "market_data").counter();
            Counter freed = registry.find("retention.storage.freed").tag("dataType", "market_data").counter();

            assertNotNull(deleted);
            assertEquals(50.0, deleted.count());
            assertNotNull(freed);
            assertEquals(5000.0, freed.count());
        }

        @Test
        @DisplayName("Should count cycles by outcome")
        void countsCycles() {
            metrics.recordCycle(true);
            metrics.recordCycle(true);
            metrics.recordCycle(false);

            Counter success = registry.find("retention.cycle").tag("outcome", "success").counter();
            Counter failure = registry.find("retention.cycle").tag("outcome", "failure").counter();

            assertNotNull(success);
            assertEquals(2.0, success.count());
            assertNotNull(failure);
            assertEquals(1.0, failure.count());
        }

        @Test
        @DisplayName("Storage gauge should follow the latest value")
        void storageGauge() {
            metrics.recordStorageSize(2048);
            metrics.recordStorageSize(4096);

            Gauge gauge = registry.find("retention.storage.size").gauge();

            assertNotNull(gauge);
            assertEquals(4096.0, gauge.value());
        }
    }
}
