package com.trading.retention.cleanup;

import com.trading.retention.store.RecordStore;
import com.trading.retention.store.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Standard deletion. Deletes in fixed-size batches without a post-delete check.
 */
public class BatchedDeletion implements DeletionMethod {
    private static final Logger log = LoggerFactory.getLogger(BatchedDeletion.class);

    static final int DEFAULT_BATCH_SIZE = 1000;

    private final int batchSize;

    public BatchedDeletion() {
        this(DEFAULT_BATCH_SIZE);
    }

    public BatchedDeletion(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = batchSize;
    }

    @Override
    public int delete(RecordStore store, String dataType, List<StoredRecord> records, Instant cutoff) {
        int totalDeleted = 0;
        for (int from = 0; from < records.size(); from += batchSize) {
            List<StoredRecord> batch = records.subList(from, Math.min(from + batchSize, records.size()));
            int deleted = store.delete(dataType, batch);
            totalDeleted += deleted;
            log.debug("cleanup.batchDeleted dataType={} batch={} total={}", dataType, deleted, totalDeleted);
        }
        return totalDeleted;
    }

    @Override
    public String name() {
        return "standard";
    }

    public int getBatchSize() {
        return batchSize;
    }
}
