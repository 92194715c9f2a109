package com.trading.retention.cleanup;

import com.trading.retention.store.RecordStore;
import com.trading.retention.store.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Deletion for critical data. Checks the delete count against the selection and re-fetches
 * the cutoff range afterwards to confirm none of the selected records survived.
 */
public class VerifiedDeletion implements DeletionMethod {
    private static final Logger log = LoggerFactory.getLogger(VerifiedDeletion.class);

    @Override
    public int delete(RecordStore store, String dataType, List<StoredRecord> records, Instant cutoff) {
        int deleted = store.delete(dataType, records);
        if (deleted != records.size()) {
            throw new DeletionVerificationException(dataType, records.size(), deleted);
        }

        Set<String> selected = new HashSet<>();
        for (StoredRecord record : records) {
            selected.add(record.id());
        }
        long survivors = store.fetchOlderThan(dataType, cutoff).stream()
                .filter(r -> selected.contains(r.id()))
                .count();
        if (survivors > 0) {
            throw new DeletionVerificationException(dataType, records.size(), (int) (records.size() - survivors),
                    "Deletion verification failed for " + dataType + ": " + survivors
                            + " selected records still present after delete");
        }

        log.debug("cleanup.verified dataType={} deleted={}", dataType, deleted);
        return deleted;
    }

    @Override
    public String name() {
        return "verified";
    }
}
