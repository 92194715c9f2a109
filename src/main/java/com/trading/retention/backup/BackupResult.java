package com.trading.retention.backup;

import java.util.Objects;

/**
 * Outcome of a backup request.
 *
 * @param status       success or failure
 * @param backupId     identifier of the created backup, null on failure
 * @param errorMessage failure reason, null on success
 */
public record BackupResult(Status status, String backupId, String errorMessage) {

    public enum Status { SUCCESS, FAILED }

    public BackupResult {
        Objects.requireNonNull(status, "status is required");
    }

    public static BackupResult success(String backupId) {
        return new BackupResult(Status.SUCCESS, Objects.requireNonNull(backupId, "backupId"), null);
    }

    public static BackupResult failed(String errorMessage) {
        return new BackupResult(Status.FAILED, null, errorMessage);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
