package com.trading.retention.backup;

import java.util.UUID;

/**
 * Backup manager used when no backup collaborator is wired.
 * Reports success without copying anything.
 */
public class NoOpBackupManager implements BackupManager {

    @Override
    public BackupResult createBackup() {
        return BackupResult.success("noop-" + UUID.randomUUID());
    }
}
