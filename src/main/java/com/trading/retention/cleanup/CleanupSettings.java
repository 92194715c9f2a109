package com.trading.retention.cleanup;

/**
 * Cleanup bookkeeping switches.
 *
 * @param createAuditTrail     append each cleanup operation to the audit trail
 * @param logCleanupOperations log a summary line per cleanup operation
 */
public record CleanupSettings(boolean createAuditTrail, boolean logCleanupOperations) {

    public static CleanupSettings defaults() {
        return new CleanupSettings(true, true);
    }
}
