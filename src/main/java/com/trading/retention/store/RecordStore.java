package com.trading.retention.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage backend holding the operational records that retention applies to.
 * Implementations own query execution and locking; callers treat the store as shared
 * external state.
 */
public interface RecordStore {

    /**
     * Returns the records of a data type strictly older than the cutoff, oldest first.
     *
     * @param dataType the data type (table) name
     * @param cutoff   exclusive upper bound on record timestamps
     * @return eligible records, never null
     * @throws RecordStoreException if the store cannot serve the query
     */
    List<StoredRecord> fetchOlderThan(String dataType, Instant cutoff);

    /**
     * Deletes the given records.
     *
     * @param dataType the data type the records belong to
     * @param records  records previously returned by {@link #fetchOlderThan}
     * @return number of rows actually removed
     * @throws RecordStoreException if the delete fails
     */
    int delete(String dataType, List<StoredRecord> records);

    /**
     * Estimates the size in bytes currently used by a data type.
     */
    long estimateSize(String dataType);

    /**
     * Returns the number of rows currently held for a data type.
     */
    long rowCount(String dataType);

    /**
     * Returns the data types known to the store.
     */
    Set<String> dataTypes();

    /**
     * Timestamp of the oldest row of a data type, if any.
     */
    default Optional<Instant> oldestTimestamp(String dataType) {
        return Optional.empty();
    }

    /**
     * Timestamp of the newest row of a data type, if any.
     */
    default Optional<Instant> newestTimestamp(String dataType) {
        return Optional.empty();
    }
}
