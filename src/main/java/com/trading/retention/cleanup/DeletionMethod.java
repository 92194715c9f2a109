package com.trading.retention.cleanup;

import com.trading.retention.store.RecordStore;
import com.trading.retention.store.StoredRecord;

import java.time.Instant;
import java.util.List;

/**
 * Removes a previously selected set of records from the store.
 */
public interface DeletionMethod {

    /**
     * Deletes the records.
     *
     * @param store    record store to delete from
     * @param dataType data type the records belong to
     * @param records  records selected with {@code cutoff}, never empty
     * @param cutoff   cutoff the records were selected with
     * @return number of records deleted
     */
    int delete(RecordStore store, String dataType, List<StoredRecord> records, Instant cutoff);

    /**
     * Short name used in logs and audit details.
     */
    String name();
}
