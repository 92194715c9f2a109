package com.trading.retention.monitor;

import java.time.Instant;
import java.util.List;

/**
 * Ordered sequence of storage snapshots. Insertion order is time order.
 */
public interface StorageHistory {

    void append(StorageSnapshot snapshot);

    /**
     * All snapshots, oldest first.
     */
    List<StorageSnapshot> snapshots();

    /**
     * Snapshots taken strictly after the given instant, oldest first.
     */
    default List<StorageSnapshot> since(Instant after) {
        return snapshots().stream()
                .filter(s -> s.timestamp().isAfter(after))
                .toList();
    }

    /**
     * Removes snapshots taken at or before the cutoff.
     *
     * @return number of snapshots removed
     */
    int pruneBefore(Instant cutoff);

    default int size() {
        return snapshots().size();
    }
}
