package com.trading.retention.backup;

/**
 * Creates a backup of the record store before destructive cleanup.
 * Implementations may raise a {@link BackupException}; a returned failed result is a
 * soft failure that callers are free to tolerate.
 */
@FunctionalInterface
public interface BackupManager {

    BackupResult createBackup();
}
