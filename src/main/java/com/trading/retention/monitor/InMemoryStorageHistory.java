package com.trading.retention.monitor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link StorageHistory}.
 */
public class InMemoryStorageHistory implements StorageHistory {

    private final List<StorageSnapshot> snapshots = new CopyOnWriteArrayList<>();

    @Override
    public void append(StorageSnapshot snapshot) {
        snapshots.add(Objects.requireNonNull(snapshot, "snapshot"));
    }

    @Override
    public List<StorageSnapshot> snapshots() {
        return Collections.unmodifiableList(new ArrayList<>(snapshots));
    }

    @Override
    public int pruneBefore(Instant cutoff) {
        int before = snapshots.size();
        snapshots.removeIf(s -> !s.timestamp().isAfter(cutoff));
        return before - snapshots.size();
    }

    @Override
    public int size() {
        return snapshots.size();
    }
}
