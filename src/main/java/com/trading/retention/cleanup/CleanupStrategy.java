package com.trading.retention.cleanup;

import java.util.Objects;

/**
 * Pairing of a cutoff rule with a deletion method.
 *
 * @param name     strategy name used in logs
 * @param cutoff   how the cutoff date is computed
 * @param deletion how selected records are removed
 */
public record CleanupStrategy(String name, CutoffRule cutoff, DeletionMethod deletion) {

    public CleanupStrategy {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(cutoff, "cutoff is required");
        Objects.requireNonNull(deletion, "deletion is required");
    }

    /**
     * Conservative cutoff with verified deletion, for critical records.
     */
    public static CleanupStrategy conservative() {
        return new CleanupStrategy("conservative", CutoffRule.CONSERVATIVE, new VerifiedDeletion());
    }

    /**
     * Standard cutoff with batched deletion. Also the fallback for unregistered types.
     */
    public static CleanupStrategy standard() {
        return new CleanupStrategy("standard", CutoffRule.STANDARD, new BatchedDeletion());
    }

    /**
     * Aggressive cutoff with a single bulk delete, for operational data.
     */
    public static CleanupStrategy aggressive() {
        return new CleanupStrategy("aggressive", CutoffRule.AGGRESSIVE, new BulkDeletion());
    }
}
