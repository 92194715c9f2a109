package com.trading.retention.scheduler;

import com.trading.retention.cleanup.CleanupOperation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of a manually triggered cleanup.
 *
 * @param success                true if at least one operation ran
 * @param operationsCount        number of operations
 * @param successfulOperations   operations with status success
 * @param failedOperations       operations with status failed
 * @param totalRecordsDeleted    sum of records deleted
 * @param totalStorageFreedBytes sum of bytes freed
 * @param operations             the operations, in processing order
 * @param error                  failure message when the manager itself failed, otherwise null
 */
public record ManualCleanupResult(
        boolean success,
        int operationsCount,
        int successfulOperations,
        int failedOperations,
        long totalRecordsDeleted,
        long totalStorageFreedBytes,
        List<CleanupOperation> operations,
        String error
) {
    public ManualCleanupResult {
        operations = List.copyOf(operations);
    }

    public static ManualCleanupResult of(List<CleanupOperation> operations) {
        int successful = (int) operations.stream().filter(CleanupOperation::isSuccess).count();
        long deleted = operations.stream().mapToLong(CleanupOperation::recordsDeleted).sum();
        long freed = operations.stream().mapToLong(CleanupOperation::storageFreedBytes).sum();
        return new ManualCleanupResult(!operations.isEmpty(), operations.size(), successful,
                operations.size() - successful, deleted, freed, operations, null);
    }

    public static ManualCleanupResult failed(String error) {
        return new ManualCleanupResult(false, 0, 0, 0, 0, 0, List.of(), error);
    }

    /**
     * Map view with the six aggregate keys and the per-operation list, plus {@code error} when set.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success);
        map.put("operations_count", operationsCount);
        map.put("successful_operations", successfulOperations);
        map.put("failed_operations", failedOperations);
        map.put("total_records_deleted", totalRecordsDeleted);
        map.put("total_storage_freed_bytes", totalStorageFreedBytes);
        List<Map<String, Object>> ops = new ArrayList<>();
        for (CleanupOperation op : operations) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("data_type", op.dataType());
            entry.put("records_deleted", op.recordsDeleted());
            entry.put("storage_freed_bytes", op.storageFreedBytes());
            entry.put("status", op.status().getValue());
            entry.put("duration_seconds", op.durationSeconds());
            entry.put("error_message", op.errorMessage());
            ops.add(entry);
        }
        map.put("operations", ops);
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }
}
