package com.trading.retention.store;

import java.time.Instant;
import java.util.Objects;

/**
 * A row of some data type as seen by the retention system.
 *
 * @param id        identifier unique within its data type
 * @param timestamp the time the row refers to; drives cutoff eligibility
 * @param sizeBytes estimated on-disk size of the row
 */
public record StoredRecord(String id, Instant timestamp, long sizeBytes) {

    public StoredRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes must not be negative");
        }
    }

    public boolean isOlderThan(Instant cutoff) {
        return timestamp.isBefore(cutoff);
    }
}
