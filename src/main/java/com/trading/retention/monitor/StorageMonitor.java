package com.trading.retention.monitor;

import com.trading.retention.audit.AuditAction;
import com.trading.retention.audit.AuditService;
import com.trading.retention.logging.LogContext;
import com.trading.retention.metrics.NoOpRetentionMetrics;
import com.trading.retention.metrics.RetentionMetrics;
import com.trading.retention.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks storage usage of the record store over time.
 *
 * <p>Snapshots are taken on demand or, after {@link #start()}, every
 * {@code checkIntervalHours}. History is pruned on every snapshot but always keeps at
 * least as many days as the longest trend window requested so far.</p>
 */
public class StorageMonitor {
    private static final Logger log = LoggerFactory.getLogger(StorageMonitor.class);

    public static final int DEFAULT_TREND_DAYS = 7;
    static final int PREDICTION_DAYS = 7;
    static final double LARGE_DATABASE_MB = 1000;
    static final double HIGH_GROWTH_MB_PER_DAY = 100;
    static final double HIGH_TYPE_GROWTH_BYTES_PER_DAY = StorageStats.BYTES_PER_MB;

    private final RecordStore store;
    private final StorageHistory history;
    private final MonitoringConfig config;
    private final RetentionMetrics metrics;
    private final AuditService auditService;
    private final Clock clock;

    private final AtomicReference<ScheduledExecutorService> executor = new AtomicReference<>();
    private final AtomicInteger longestRequestedWindow = new AtomicInteger();
    private volatile Instant lastCleanupDate;

    private StorageMonitor(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "record store is required");
        this.history = builder.history != null ? builder.history : new InMemoryStorageHistory();
        this.config = builder.config != null ? builder.config : MonitoringConfig.defaults();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpRetentionMetrics();
        this.auditService = builder.auditService;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    /**
     * Starts periodic snapshots. No-op when monitoring is disabled or already started.
     */
    public void start() {
        if (!config.enabled()) {
            log.info("storageMonitor.disabled");
            return;
        }
        if (executor.get() != null) {
            return;
        }
        ScheduledExecutorService ses = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "storage-monitor");
            t.setDaemon(true);
            return t;
        });
        if (!executor.compareAndSet(null, ses)) {
            ses.shutdown();
            return;
        }
        long interval = config.checkIntervalHours();
        ses.scheduleAtFixedRate(this::periodicCheck, 0, interval, TimeUnit.HOURS);
        log.info("storageMonitor.started intervalHours={}", interval);
    }

    /**
     * Stops periodic snapshots. A snapshot in progress is allowed to finish.
     */
    public void stop() {
        ScheduledExecutorService ses = executor.getAndSet(null);
        if (ses != null) {
            ses.shutdown();
            log.info("storageMonitor.stopped");
        }
    }

    public boolean isRunning() {
        return executor.get() != null;
    }

    private void periodicCheck() {
        try {
            recordSnapshot();
            checkThresholds();
        } catch (RuntimeException e) {
            log.error("storageMonitor.checkFailed error={}", e.getMessage(), e);
        }
    }

    /**
     * Queries the record store for current per-type sizes and row counts.
     */
    public StorageStats getCurrentStats() {
        Map<String, Long> sizes = new LinkedHashMap<>();
        Map<String, Long> counts = new LinkedHashMap<>();
        Instant oldest = null;
        Instant newest = null;
        long total = 0;

        for (String dataType : store.dataTypes()) {
            long size = store.estimateSize(dataType);
            sizes.put(dataType, size);
            counts.put(dataType, store.rowCount(dataType));
            total += size;

            Instant typeOldest = store.oldestTimestamp(dataType).orElse(null);
            Instant typeNewest = store.newestTimestamp(dataType).orElse(null);
            if (typeOldest != null && (oldest == null || typeOldest.isBefore(oldest))) {
                oldest = typeOldest;
            }
            if (typeNewest != null && (newest == null || typeNewest.isAfter(newest))) {
                newest = typeNewest;
            }
        }
        return new StorageStats(total, sizes, counts, oldest, newest, lastCleanupDate);
    }

    /**
     * Captures current statistics, appends them to history and prunes old snapshots.
     */
    public StorageSnapshot recordSnapshot() {
        String snapshotId = LogContext.generateId();
        try (LogContext ctx = LogContext.forSnapshot(snapshotId)) {
            StorageStats stats = getCurrentStats();
            Instant now = clock.instant();
            StorageSnapshot snapshot = new StorageSnapshot(snapshotId, now, stats);
            history.append(snapshot);
            metrics.recordStorageSize(stats.totalSizeBytes());

            int keepDays = Math.max(config.historyRetentionDays(), longestRequestedWindow.get());
            int pruned = history.pruneBefore(now.minus(Duration.ofDays(keepDays)));
            log.debug("storage.snapshot totalMb={} types={} pruned={}",
                    String.format("%.2f", stats.totalSizeMb()), stats.dataTypeBreakdown().size(), pruned);
            return snapshot;
        }
    }

    public TrendAnalysis analyzeTrends() {
        return analyzeTrends(DEFAULT_TREND_DAYS);
    }

    /**
     * Analyzes snapshots taken within the last {@code days} days.
     */
    public TrendAnalysis analyzeTrends(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive");
        }
        longestRequestedWindow.accumulateAndGet(days, Math::max);

        List<StorageSnapshot> window = history.since(clock.instant().minus(Duration.ofDays(days)));
        if (window.size() < 2) {
            double currentMb = window.isEmpty() ? 0.0 : window.get(window.size() - 1).stats().totalSizeMb();
            return TrendAnalysis.insufficient(days, window.size(), currentMb);
        }

        List<Long> sizes = window.stream().map(StorageSnapshot::totalSizeBytes).toList();
        double growthBytes = TrendCalculator.growthRate(sizes);
        double predictedBytes = TrendCalculator.predict(sizes, PREDICTION_DAYS);
        Map<String, DataTypeTrend> typeTrends = dataTypeTrends(window);

        double currentMb = sizes.get(sizes.size() - 1) / StorageStats.BYTES_PER_MB;
        double growthMb = growthBytes / StorageStats.BYTES_PER_MB;
        return new TrendAnalysis(days, window.size(), currentMb,
                TrendCalculator.trend(sizes), growthMb, predictedBytes / StorageStats.BYTES_PER_MB,
                typeTrends, trendRecommendations(sizes, growthMb, typeTrends), null);
    }

    private static Map<String, DataTypeTrend> dataTypeTrends(List<StorageSnapshot> window) {
        Map<String, DataTypeTrend> trends = new LinkedHashMap<>();
        Set<String> types = new LinkedHashSet<>(window.get(window.size() - 1).stats().dataTypeBreakdown().keySet());
        for (String type : types) {
            List<Long> values = new ArrayList<>();
            for (StorageSnapshot snapshot : window) {
                Long size = snapshot.stats().dataTypeBreakdown().get(type);
                if (size != null) {
                    values.add(size);
                }
            }
            if (values.size() >= 2) {
                trends.put(type, new DataTypeTrend(TrendCalculator.trend(values),
                        TrendCalculator.growthRate(values), values.get(values.size() - 1)));
            }
        }
        return trends;
    }

    static List<String> trendRecommendations(List<Long> sizes, double growthMbPerDay,
                                             Map<String, DataTypeTrend> typeTrends) {
        List<String> recommendations = new ArrayList<>();
        double currentMb = sizes.get(sizes.size() - 1) / StorageStats.BYTES_PER_MB;

        if (growthMbPerDay > HIGH_GROWTH_MB_PER_DAY) {
            recommendations.add("High storage growth rate detected - consider more aggressive retention policies");
        }
        if (currentMb > LARGE_DATABASE_MB) {
            recommendations.add("Large database size detected - review retention periods and consider archiving");
        }
        typeTrends.forEach((type, trend) -> {
            if (trend.trend() == Trend.INCREASING && trend.growthRateBytesPerDay() > HIGH_TYPE_GROWTH_BYTES_PER_DAY) {
                recommendations.add("High growth in " + type + " - consider shorter retention period");
            }
        });
        if (sizes.size() >= 3) {
            List<Long> recent = sizes.subList(sizes.size() - 3, sizes.size());
            if (recent.get(1) >= recent.get(0) && recent.get(2) >= recent.get(1)) {
                recommendations.add("Storage not decreasing - check if cleanup operations are running effectively");
            }
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Storage usage appears normal - no immediate action required");
        }
        return recommendations;
    }

    /**
     * Compares the current total size with the configured thresholds.
     */
    public ThresholdCheck checkThresholds() {
        return checkThresholds(config.warningThresholdMb(), config.criticalThresholdMb());
    }

    /**
     * Compares the current total size with the given thresholds.
     */
    public ThresholdCheck checkThresholds(double warningThresholdMb, double criticalThresholdMb) {
        double currentMb = getCurrentStats().totalSizeMb();
        ThresholdCheck check = ThresholdCheck.evaluate(currentMb, warningThresholdMb, criticalThresholdMb,
                clock.instant());
        if (check.isAlert()) {
            log.warn("storage.thresholdExceeded level={} currentMb={} warningMb={} criticalMb={}",
                    check.alertLevel().getValue(), String.format("%.2f", currentMb),
                    warningThresholdMb, criticalThresholdMb);
            if (auditService != null) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("alertLevel", check.alertLevel().getValue());
                details.put("currentSizeMb", currentMb);
                details.put("warningThresholdMb", warningThresholdMb);
                details.put("criticalThresholdMb", criticalThresholdMb);
                auditService.record(AuditAction.STORAGE_THRESHOLD_EXCEEDED, "storage", "storage-monitor", details);
            }
        }
        return check;
    }

    public StorageReport generateReport() {
        return generateReport(config.includeTrends());
    }

    /**
     * Builds a report of current usage and health, with a {@value #DEFAULT_TREND_DAYS}-day
     * trend analysis when requested.
     */
    public StorageReport generateReport(boolean includeTrends) {
        StorageStats stats = getCurrentStats();
        double totalMb = stats.totalSizeMb();
        TrendAnalysis trends = includeTrends ? analyzeTrends(DEFAULT_TREND_DAYS) : null;
        StorageReport report = new StorageReport(clock.instant(), stats, StorageHealth.assess(totalMb),
                basicRecommendations(totalMb, stats.dataTypeBreakdownMb()), trends);
        log.info("storage.report totalMb={} health={}", String.format("%.2f", totalMb), report.health().getValue());
        return report;
    }

    /**
     * Below 1 GB a single normal-status line; above it a size warning followed by one line per
     * data type, largest first.
     */
    static List<String> basicRecommendations(double totalSizeMb, Map<String, Double> breakdownMb) {
        List<String> recommendations = new ArrayList<>();
        if (totalSizeMb <= LARGE_DATABASE_MB) {
            recommendations.add("Storage usage is within normal limits");
            return recommendations;
        }
        recommendations.add(String.format("Database size (%.1fMB) exceeds 1GB - consider running cleanup operations",
                totalSizeMb));
        breakdownMb.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
                .forEach(e -> recommendations.add(String.format("%s is using %.1fMB (%.1f%%) - review retention policy",
                        e.getKey(), e.getValue(), totalSizeMb > 0 ? e.getValue() * 100 / totalSizeMb : 0.0)));
        return recommendations;
    }

    /**
     * Sets the start time of the latest completed cleanup cycle, reported in storage stats.
     */
    public void recordCleanup(Instant startedAt) {
        this.lastCleanupDate = startedAt;
    }

    public StorageHistory getHistory() {
        return history;
    }

    public MonitoringConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RecordStore store;
        private StorageHistory history;
        private MonitoringConfig config;
        private RetentionMetrics metrics;
        private AuditService auditService;
        private Clock clock;

        public Builder recordStore(RecordStore store) {
            this.store = store;
            return this;
        }

        public Builder history(StorageHistory history) {
            this.history = history;
            return this;
        }

        public Builder config(MonitoringConfig config) {
            this.config = config;
            return this;
        }

        public Builder metrics(RetentionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public StorageMonitor build() {
            return new StorageMonitor(this);
        }
    }
}
