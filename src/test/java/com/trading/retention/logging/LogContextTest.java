package com.trading.retention.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forCleanupCycle should set cycleId, trigger and operation")
    void forCleanupCycleSetsMDC() {
        try (LogContext ctx = LogContext.forCleanupCycle("cycle-1", "schedule")) {
            assertEquals("cycle-1", MDC.get("cycleId"));
            assertEquals("schedule", MDC.get("trigger"));
            assertEquals("cleanup-cycle", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forCleanupOperation should set operationId and dataType")
    void forCleanupOperationSetsMDC() {
        try (LogContext ctx = LogContext.forCleanupOperation("op-7", "trades")) {
            assertEquals("op-7", MDC.get("operationId"));
            assertEquals("trades", MDC.get("dataType"));
            assertEquals("cleanup", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forSnapshot should set snapshotId")
    void forSnapshotSetsMDC() {
        try (LogContext ctx = LogContext.forSnapshot("snap-3")) {
            assertEquals("snap-3", MDC.get("snapshotId"));
            assertEquals("snapshot", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("Keys should be removed on close, including with() additions")
    void keysRemovedOnClose() {
        try (LogContext ctx = LogContext.forCleanupOperation("op-1", "orders")
                .with("dryRun", "true")) {
            assertEquals("true", MDC.get("dryRun"));
        }
        assertNull(MDC.get("operationId"));
        assertNull(MDC.get("dataType"));
        assertNull(MDC.get("dryRun"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Inner operation context should leave outer cycle keys in place")
    void nestedContexts() {
        try (LogContext outer = LogContext.forCleanupCycle("cycle-9", "manual")) {
            try (LogContext inner = LogContext.forCleanupOperation("op-2", "market_data")) {
                assertEquals("cycle-9", MDC.get("cycleId"));
                assertEquals("market_data", MDC.get("dataType"));
            }
            assertNull(MDC.get("dataType"));
            assertEquals("cycle-9", MDC.get("cycleId"));
        }
        assertNull(MDC.get("cycleId"));
    }

    @Test
    @DisplayName("generateId should return unique values")
    void generateIdUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(LogContext.generateId());
        }
        assertEquals(50, ids.size());
    }
}
