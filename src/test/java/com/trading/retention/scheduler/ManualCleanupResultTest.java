package com.trading.retention.scheduler;

import com.trading.retention.cleanup.CleanupOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ManualCleanupResult Tests")
class ManualCleanupResultTest {

    private static final Instant NOW = Instant.parse("2026-03-01T03:00:00Z");

    @Test
    @DisplayName("Should aggregate counts across operations")
    void testAggregate() {
        ManualCleanupResult result = ManualCleanupResult.of(List.of(
                CleanupOperation.success("op-1", NOW, "trades", 4, 4, 400, 0.2),
                CleanupOperation.success("op-2", NOW, "market_data", 6, 6, 600, 0.3),
                CleanupOperation.failure("op-3", NOW, "orders", 0.1, "timeout")));

        assertTrue(result.success());
        assertEquals(3, result.operationsCount());
        assertEquals(2, result.successfulOperations());
        assertEquals(1, result.failedOperations());
        assertEquals(10, result.totalRecordsDeleted());
        assertEquals(1000, result.totalStorageFreedBytes());
        assertNull(result.error());
    }

    @Test
    @DisplayName("No operations should not count as success")
    void testEmpty() {
        ManualCleanupResult result = ManualCleanupResult.of(List.of());

        assertFalse(result.success());
        assertEquals(0, result.operationsCount());
        assertTrue(result.toMap().keySet().containsAll(List.of("success", "operations_count",
                "successful_operations", "failed_operations", "total_records_deleted", "total_storage_freed_bytes")));
    }

    @Test
    @DisplayName("Map view should carry aggregates, operations and error")
    @SuppressWarnings("unchecked")
    void testToMap() {
        Map<String, Object> map = ManualCleanupResult.of(List.of(
                CleanupOperation.failure("op-1", NOW, "orders", 0.1, "timeout"))).toMap();

        assertEquals(1, map.get("failed_operations"));
        List<Map<String, Object>> ops = (List<Map<String, Object>>) map.get("operations");
        assertEquals("orders", ops.get(0).get("data_type"));
        assertEquals("timeout", ops.get(0).get("error_message"));
        assertFalse(map.containsKey("error"));

        Map<String, Object> failed = ManualCleanupResult.failed("locked").toMap();
        assertEquals("locked", failed.get("error"));
        assertEquals(false, failed.get("success"));
    }
}
