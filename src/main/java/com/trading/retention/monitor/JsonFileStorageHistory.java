package com.trading.retention.monitor;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * {@link StorageHistory} persisted as a JSON array in a file.
 *
 * <p>The file is read once on construction and rewritten after every change. An unreadable
 * file is logged and treated as empty; a failed write is logged and the in-memory history
 * stays authoritative until the next successful write.</p>
 */
public class JsonFileStorageHistory implements StorageHistory {
    private static final Logger log = LoggerFactory.getLogger(JsonFileStorageHistory.class);

    private static final TypeReference<List<StorageSnapshot>> SNAPSHOT_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final InMemoryStorageHistory delegate = new InMemoryStorageHistory();

    public JsonFileStorageHistory(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<StorageSnapshot> loaded = objectMapper.readValue(file.toFile(), SNAPSHOT_LIST);
            loaded.forEach(delegate::append);
            log.info("storageHistory.loaded file={} snapshots={}", file, loaded.size());
        } catch (IOException e) {
            log.warn("storageHistory.loadFailed file={} error={}", file, e.getMessage());
        }
    }

    private synchronized void save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), delegate.snapshots());
        } catch (IOException e) {
            log.warn("storageHistory.saveFailed file={} error={}", file, e.getMessage());
        }
    }

    @Override
    public void append(StorageSnapshot snapshot) {
        delegate.append(snapshot);
        save();
    }

    @Override
    public List<StorageSnapshot> snapshots() {
        return delegate.snapshots();
    }

    @Override
    public int pruneBefore(Instant cutoff) {
        int removed = delegate.pruneBefore(cutoff);
        if (removed > 0) {
            save();
        }
        return removed;
    }

    @Override
    public int size() {
        return delegate.size();
    }

    public Path getFile() {
        return file;
    }
}
