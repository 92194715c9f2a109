package com.trading.retention.backup;

/**
 * Runtime exception thrown by a {@link BackupManager} that could not produce a backup.
 */
public class BackupException extends RuntimeException {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
