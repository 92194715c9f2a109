package com.trading.retention.health;

import com.trading.retention.audit.AuditService;
import com.trading.retention.cleanup.RetentionManager;
import com.trading.retention.monitor.StorageMonitor;
import com.trading.retention.scheduler.RetentionScheduler;
import com.trading.retention.scheduler.SchedulerConfig;
import com.trading.retention.store.InMemoryRecordStore;
import com.trading.retention.store.StoredRecord;
import com.trading.retention.testutil.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final long MB = 1024L * 1024L;

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factories should set status and message")
        void factories() {
            assertTrue(HealthStatus.up("fine").isUp());
            assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.degraded("slow").status());
            assertTrue(HealthStatus.down("gone").isDown());
            assertEquals("gone", HealthStatus.down("gone").message());
        }

        @Test
        @DisplayName("withDetail() should add values and skip nulls")
        void withDetail() {
            HealthStatus status = HealthStatus.up("ok")
                    .withDetail("sizeMb", 12.5)
                    .withDetail("lastCleanup", null);

            assertEquals(Map.of("sizeMb", 12.5), status.details());
            assertThrows(UnsupportedOperationException.class, () -> status.details().put("x", 1));
        }

        @Test
        @DisplayName("Severity should follow UP < DEGRADED < DOWN")
        void severity() {
            assertTrue(HealthStatus.down("a").isWorseThan(HealthStatus.degraded("b")));
            assertTrue(HealthStatus.degraded("a").isWorseThan(HealthStatus.up("b")));
            assertFalse(HealthStatus.up("a").isWorseThan(HealthStatus.up("b")));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private HealthCheck fixed(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }

        @Test
        @DisplayName("Empty registry should be UP")
        void emptyRegistry() {
            HealthCheckRegistry registry = new HealthCheckRegistry();

            assertTrue(registry.checkAll().isUp());
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("Aggregate should take the worst status and name its source")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("storage", HealthStatus.degraded("Storage warning")));
            registry.register(fixed("scheduler", HealthStatus.up("Scheduler running")));
            registry.register(null);

            HealthStatus aggregate = registry.checkAll();

            assertEquals(HealthStatus.Status.DEGRADED, aggregate.status());
            assertEquals("storage: Storage warning", aggregate.message());
            assertEquals(2, aggregate.details().size());
            assertEquals(2, registry.size());
        }

        @Test
        @DisplayName("A throwing check should count as DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(fixed("storage", HealthStatus.up("fine")));
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("no connection");
                }
            });

            HealthStatus aggregate = registry.checkAll();

            assertTrue(aggregate.isDown());
            assertTrue(aggregate.message().contains("no connection"));
        }
    }

    @Nested
    @DisplayName("StorageHealthCheck")
    class StorageHealthCheckTests {

        private final InMemoryRecordStore store = new InMemoryRecordStore();
        private final StorageMonitor monitor = StorageMonitor.builder()
                .recordStore(store)
                .clock(new MutableClock(NOW))
                .build();

        private HealthStatus checkWith(long bytes) {
            store.insert("market_data", new StoredRecord("r-" + bytes, NOW, bytes));
            return new StorageHealthCheck(monitor).check();
        }

        @Test
        @DisplayName("Small store should be UP")
        void healthy() {
            HealthStatus status = checkWith(10 * MB);

            assertTrue(status.isUp());
            assertEquals("healthy", status.details().get("health"));
        }

        @Test
        @DisplayName("Caution and warning bands should be DEGRADED")
        void degraded() {
            assertEquals(HealthStatus.Status.DEGRADED, checkWith(600 * MB).status());
            assertEquals(HealthStatus.Status.DEGRADED, checkWith(900 * MB).status());
        }

        @Test
        @DisplayName("Critical band should be DOWN")
        void critical() {
            HealthStatus status = checkWith(5000 * MB);

            assertTrue(status.isDown());
            assertEquals("critical", status.details().get("health"));
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("SchedulerHealthCheck")
    class SchedulerHealthCheckTests {

        @Mock
        private RetentionManager manager;

        @Mock
        private StorageMonitor monitor;

        private RetentionScheduler scheduler;

        @BeforeEach
        void setUp() {
            scheduler = schedulerWith(SchedulerConfig.builder()
                    .backupBeforeCleanup(false)
                    .notificationChannels(List.of())
                    .build());
        }

        @AfterEach
        void tearDown() {
            scheduler.stop();
        }

        private RetentionScheduler schedulerWith(SchedulerConfig config) {
            return RetentionScheduler.builder()
                    .retentionManager(manager)
                    .storageMonitor(monitor)
                    .config(config)
                    .auditService(new AuditService())
                    .clock(new MutableClock(NOW))
                    .build();
        }

        @Test
        @DisplayName("Enabled but stopped scheduler should be DOWN")
        void stopped() {
            assertTrue(new SchedulerHealthCheck(scheduler).check().isDown());
        }

        @Test
        @DisplayName("Running scheduler should be UP")
        void running() {
            scheduler.start();

            HealthStatus status = new SchedulerHealthCheck(scheduler).check();

            assertTrue(status.isUp());
            assertEquals(true, status.details().get("running"));
        }

        @Test
        @DisplayName("Failed last cycle should be DEGRADED")
        void failedCycle() {
            when(manager.runCleanup(anyBoolean())).thenThrow(new IllegalStateException("disk error"));
            scheduler.runCleanupCycle();
            scheduler.start();

            HealthStatus status = new SchedulerHealthCheck(scheduler).check();

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertTrue(status.message().contains("disk error"));
        }

        @Test
        @DisplayName("Disabled scheduler should be UP")
        void disabled() {
            scheduler = schedulerWith(SchedulerConfig.builder().enabled(false).build());

            assertTrue(new SchedulerHealthCheck(scheduler).check().isUp());
        }
    }
}
