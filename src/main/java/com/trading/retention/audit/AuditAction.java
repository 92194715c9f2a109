package com.trading.retention.audit;

/**
 * Types of auditable actions in the retention system.
 */
public enum AuditAction {
    CLEANUP_SUCCEEDED,
    CLEANUP_FAILED,
    CYCLE_COMPLETED,
    CYCLE_FAILED,
    BACKUP_CREATED,
    BACKUP_FAILED,
    STORAGE_THRESHOLD_EXCEEDED
}
