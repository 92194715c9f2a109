package com.trading.retention.cleanup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CleanupSummaryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T03:00:00Z");
    private static final long MB = 1024L * 1024L;

    @Test
    @DisplayName("Should total operations and break them down per data type")
    void testTotals() {
        List<CleanupOperation> ops = List.of(
                CleanupOperation.success("1", NOW, "trades", 10, 10, 2 * MB, 1.0),
                CleanupOperation.failure("2", NOW, "orders", 0.5, "boom"),
                CleanupOperation.success("3", NOW, "market_data", 30, 30, 3 * MB, 0.5));

        CleanupSummary summary = CleanupSummary.of(ops);

        assertEquals(3, summary.totalOperations());
        assertEquals(2, summary.successfulOperations());
        assertEquals(1, summary.failedOperations());
        assertEquals(40, summary.totalRecordsDeleted());
        assertEquals(5 * MB, summary.totalStorageFreedBytes());
        assertEquals(5.0, summary.totalStorageFreedMb(), 1e-9);
        assertEquals(2.0, summary.totalDurationSeconds(), 1e-9);
        assertEquals(200.0 / 3, summary.successRate(), 1e-9);
        assertEquals(1, summary.byDataType().get("orders").failedCount());
        assertEquals(30, summary.byDataType().get("market_data").recordsDeleted());
    }

    @Test
    @DisplayName("Recommendations should flag failures and per-type failure dominance")
    void testFailureRecommendations() {
        CleanupSummary summary = CleanupSummary.of(List.of(
                CleanupOperation.failure("1", NOW, "orders", 0.0, "boom")));

        assertTrue(summary.recommendations().get(0).startsWith("1 operations failed"));
        assertTrue(summary.recommendations().stream().anyMatch(r -> r.contains("High failure rate for orders")));
        assertTrue(summary.recommendations().stream().anyMatch(r -> r.startsWith("Minimal storage freed")));
    }

    @Test
    @DisplayName("Fast cleanup of enough data should yield the all-clear line")
    void testAllClear() {
        CleanupSummary summary = CleanupSummary.of(List.of(
                CleanupOperation.success("1", NOW, "market_data", 5000, 5000, 50 * MB, 2.0)));

        assertEquals(EfficiencyRating.EXCELLENT, summary.efficiencyRating());
        assertEquals(List.of("Cleanup operations completed successfully - no issues detected"),
                summary.recommendations());
    }

    @Test
    @DisplayName("Empty input should produce zero totals")
    void testEmpty() {
        CleanupSummary summary = CleanupSummary.of(List.of());

        assertEquals(0, summary.totalOperations());
        assertEquals(0.0, summary.successRate());
        assertEquals(EfficiencyRating.POOR, summary.efficiencyRating());
    }

    @Test
    @DisplayName("Efficiency bands require both throughput figures")
    void testEfficiencyBands() {
        assertEquals(EfficiencyRating.EXCELLENT, EfficiencyRating.of(1001, 10.5));
        assertEquals(EfficiencyRating.GOOD, EfficiencyRating.of(2000, 6));
        assertEquals(EfficiencyRating.FAIR, EfficiencyRating.of(150, 1.5));
        assertEquals(EfficiencyRating.POOR, EfficiencyRating.of(5000, 0.5));
        assertEquals("Good", EfficiencyRating.GOOD.getLabel());
    }
}
