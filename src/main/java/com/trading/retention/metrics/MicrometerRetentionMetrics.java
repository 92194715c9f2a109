package com.trading.retention.metrics;

import com.trading.retention.cleanup.CleanupOperation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link RetentionMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code retention.cleanup.duration}: Timer (tags: dataType, status)</li>
 *   <li>{@code retention.records.deleted}: Counter (tag: dataType)</li>
 *   <li>{@code retention.storage.freed}: Counter in bytes (tag: dataType)</li>
 *   <li>{@code retention.cycle}: Counter (tag: outcome)</li>
 *   <li>{@code retention.storage.size}: Gauge in bytes</li>
 * </ul>
 */
public class MicrometerRetentionMetrics implements RetentionMetrics {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final AtomicLong storageSize = new AtomicLong();

    public MicrometerRetentionMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("retention.storage.size", storageSize, AtomicLong::get)
                .description("Total storage size seen by the latest snapshot")
                .baseUnit("bytes")
                .register(registry);
    }

    @Override
    public void recordCleanupOperation(CleanupOperation operation) {
        String dataType = operation.dataType();
        String status = operation.status().getValue();
        Timer timer = timerCache.computeIfAbsent(dataType + ":" + status, k ->
                Timer.builder("retention.cleanup.duration")
                        .description("Duration of per-data-type cleanup operations")
                        .tag("dataType", dataType)
                        .tag("status", status)
                        .register(registry));
        timer.record(Duration.ofNanos((long) (operation.durationSeconds() * 1_000_000_000L)));

        if (operation.recordsDeleted() > 0) {
            counter("retention.records.deleted", "Number of records deleted by cleanup", dataType)
                    .increment(operation.recordsDeleted());
        }
        if (operation.storageFreedBytes() > 0) {
            counter("retention.storage.freed", "Bytes freed by cleanup", dataType)
                    .increment(operation.storageFreedBytes());
        }
    }

    @Override
    public void recordCycle(boolean success) {
        String outcome = success ? "success" : "failure";
        counterCache.computeIfAbsent("cycle:" + outcome, k ->
                Counter.builder("retention.cycle")
                        .description("Number of cleanup cycles by outcome")
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordStorageSize(long totalSizeBytes) {
        storageSize.set(totalSizeBytes);
    }

    private Counter counter(String name, String description, String dataType) {
        return counterCache.computeIfAbsent(name + ":" + dataType, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("dataType", dataType)
                        .register(registry));
    }
}
