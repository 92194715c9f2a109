package com.trading.retention.cleanup;

import com.trading.retention.store.RecordStore;
import com.trading.retention.store.StoredRecord;

import java.time.Instant;
import java.util.List;

/**
 * Minimal deletion for operational data: one bulk delete, no verification.
 */
public class BulkDeletion implements DeletionMethod {

    @Override
    public int delete(RecordStore store, String dataType, List<StoredRecord> records, Instant cutoff) {
        return store.delete(dataType, records);
    }

    @Override
    public String name() {
        return "minimal";
    }
}
