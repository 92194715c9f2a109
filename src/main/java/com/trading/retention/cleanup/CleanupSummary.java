package com.trading.retention.cleanup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over the operations of one cleanup run.
 *
 * @param totalOperations        number of operations
 * @param successfulOperations   operations with status success
 * @param failedOperations       operations with status failed
 * @param totalRecordsDeleted    sum of records deleted
 * @param totalStorageFreedBytes sum of bytes freed
 * @param totalDurationSeconds   sum of operation durations
 * @param successRate            successful operations in percent, 0 when empty
 * @param recordsPerSecond       overall deletion throughput
 * @param mbPerSecond            overall freed-storage throughput
 * @param efficiencyRating       rating of the overall throughput
 * @param byDataType             per data type totals, in operation order
 * @param recommendations        follow-up suggestions, never empty
 */
public record CleanupSummary(
        int totalOperations,
        int successfulOperations,
        int failedOperations,
        long totalRecordsDeleted,
        long totalStorageFreedBytes,
        double totalDurationSeconds,
        double successRate,
        double recordsPerSecond,
        double mbPerSecond,
        EfficiencyRating efficiencyRating,
        Map<String, DataTypeTotals> byDataType,
        List<String> recommendations
) {
    static final long BYTES_PER_MB = 1024L * 1024L;
    static final double LOW_THROUGHPUT_RECORDS_PER_SECOND = 100.0;

    public CleanupSummary {
        byDataType = Collections.unmodifiableMap(new LinkedHashMap<>(byDataType));
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Totals for one data type.
     */
    public record DataTypeTotals(int operations, long recordsDeleted, long storageFreedBytes,
                                 int successCount, int failedCount) {

        DataTypeTotals add(CleanupOperation op) {
            return new DataTypeTotals(
                    operations + 1,
                    recordsDeleted + op.recordsDeleted(),
                    storageFreedBytes + op.storageFreedBytes(),
                    successCount + (op.isSuccess() ? 1 : 0),
                    failedCount + (op.isFailure() ? 1 : 0));
        }
    }

    public static CleanupSummary of(List<CleanupOperation> operations) {
        long records = 0;
        long bytes = 0;
        double duration = 0;
        int successful = 0;
        int failed = 0;
        Map<String, DataTypeTotals> byType = new LinkedHashMap<>();

        for (CleanupOperation op : operations) {
            records += op.recordsDeleted();
            bytes += op.storageFreedBytes();
            duration += op.durationSeconds();
            if (op.isSuccess()) {
                successful++;
            } else {
                failed++;
            }
            byType.merge(op.dataType(), new DataTypeTotals(0, 0, 0, 0, 0).add(op),
                    (existing, ignored) -> existing.add(op));
        }

        double recordsPerSecond = duration > 0 ? records / duration : 0;
        double mbPerSecond = duration > 0 ? (bytes / (double) BYTES_PER_MB) / duration : 0;
        double successRate = operations.isEmpty() ? 0 : successful * 100.0 / operations.size();

        return new CleanupSummary(operations.size(), successful, failed, records, bytes, duration,
                successRate, recordsPerSecond, mbPerSecond,
                EfficiencyRating.of(recordsPerSecond, mbPerSecond),
                byType, recommendations(failed, duration, recordsPerSecond, byType, bytes));
    }

    private static List<String> recommendations(int failed, double duration, double recordsPerSecond,
                                                Map<String, DataTypeTotals> byType, long bytes) {
        List<String> recommendations = new ArrayList<>();
        if (failed > 0) {
            recommendations.add(failed + " operations failed - review error logs and retention policies");
        }
        if (duration > 0 && recordsPerSecond < LOW_THROUGHPUT_RECORDS_PER_SECOND) {
            recommendations.add("Low cleanup efficiency detected - consider optimizing database indexes");
        }
        byType.forEach((dataType, totals) -> {
            if (totals.failedCount() > totals.successCount()) {
                recommendations.add("High failure rate for " + dataType + " - review retention policy configuration");
            }
        });
        if (bytes < BYTES_PER_MB) {
            recommendations.add("Minimal storage freed - consider adjusting retention periods");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Cleanup operations completed successfully - no issues detected");
        }
        return recommendations;
    }

    public double totalStorageFreedMb() {
        return totalStorageFreedBytes / (double) BYTES_PER_MB;
    }
}
