package com.trading.retention.cleanup;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of cleaning up one data type during one run.
 *
 * @param operationId       unique id of the operation
 * @param timestamp         when the operation started
 * @param dataType          data type that was cleaned up
 * @param status            success or failure
 * @param recordsProcessed  number of eligible records found
 * @param recordsDeleted    number of records deleted, or that would be deleted in a dry run
 * @param storageFreedBytes estimated bytes freed
 * @param durationSeconds   wall-clock duration
 * @param errorMessage      failure reason, null on success
 */
public record CleanupOperation(
        String operationId,
        Instant timestamp,
        String dataType,
        CleanupStatus status,
        int recordsProcessed,
        int recordsDeleted,
        long storageFreedBytes,
        double durationSeconds,
        String errorMessage
) {
    public CleanupOperation {
        Objects.requireNonNull(operationId, "operationId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(dataType, "dataType is required");
        Objects.requireNonNull(status, "status is required");
        if (recordsProcessed < 0 || recordsDeleted < 0) {
            throw new IllegalArgumentException("record counts must not be negative");
        }
        if (storageFreedBytes < 0) {
            throw new IllegalArgumentException("storageFreedBytes must not be negative");
        }
    }

    public static CleanupOperation success(String operationId, Instant timestamp, String dataType,
                                           int recordsProcessed, int recordsDeleted,
                                           long storageFreedBytes, double durationSeconds) {
        return new CleanupOperation(operationId, timestamp, dataType, CleanupStatus.SUCCESS,
                recordsProcessed, recordsDeleted, storageFreedBytes, durationSeconds, null);
    }

    public static CleanupOperation failure(String operationId, Instant timestamp, String dataType,
                                           double durationSeconds, String errorMessage) {
        return new CleanupOperation(operationId, timestamp, dataType, CleanupStatus.FAILED,
                0, 0, 0L, durationSeconds, errorMessage);
    }

    public boolean isSuccess() {
        return status == CleanupStatus.SUCCESS;
    }

    public boolean isFailure() {
        return status == CleanupStatus.FAILED;
    }
}
