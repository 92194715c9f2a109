package com.trading.retention.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link RecordStore}.
 * Thread-safe via per-type CopyOnWriteArrayList.
 */
public class InMemoryRecordStore implements RecordStore {

    private final Map<String, List<StoredRecord>> tables = new ConcurrentHashMap<>();

    /**
     * Adds a record to a data type, creating the data type on first use.
     */
    public InMemoryRecordStore insert(String dataType, StoredRecord record) {
        tables.computeIfAbsent(dataType, k -> new CopyOnWriteArrayList<>()).add(record);
        return this;
    }

    public InMemoryRecordStore insertAll(String dataType, Collection<StoredRecord> records) {
        tables.computeIfAbsent(dataType, k -> new CopyOnWriteArrayList<>()).addAll(records);
        return this;
    }

    @Override
    public List<StoredRecord> fetchOlderThan(String dataType, Instant cutoff) {
        return table(dataType).stream()
                .filter(r -> r.isOlderThan(cutoff))
                .sorted(Comparator.comparing(StoredRecord::timestamp))
                .toList();
    }

    @Override
    public int delete(String dataType, List<StoredRecord> records) {
        List<StoredRecord> table = tables.get(dataType);
        if (table == null || records.isEmpty()) {
            return 0;
        }
        Set<String> ids = new HashSet<>();
        for (StoredRecord record : records) {
            ids.add(record.id());
        }
        int before = table.size();
        table.removeIf(r -> ids.contains(r.id()));
        return before - table.size();
    }

    @Override
    public long estimateSize(String dataType) {
        return table(dataType).stream().mapToLong(StoredRecord::sizeBytes).sum();
    }

    @Override
    public long rowCount(String dataType) {
        return table(dataType).size();
    }

    @Override
    public Set<String> dataTypes() {
        return new LinkedHashSet<>(tables.keySet());
    }

    @Override
    public Optional<Instant> oldestTimestamp(String dataType) {
        return table(dataType).stream().map(StoredRecord::timestamp).min(Comparator.naturalOrder());
    }

    @Override
    public Optional<Instant> newestTimestamp(String dataType) {
        return table(dataType).stream().map(StoredRecord::timestamp).max(Comparator.naturalOrder());
    }

    /**
     * Returns a copy of the records currently held for a data type.
     */
    public List<StoredRecord> records(String dataType) {
        return new ArrayList<>(table(dataType));
    }

    private List<StoredRecord> table(String dataType) {
        return tables.getOrDefault(dataType, List.of());
    }
}
