package com.trading.retention;

import com.trading.retention.audit.AuditService;
import com.trading.retention.backup.BackupManager;
import com.trading.retention.cleanup.CleanupOperation;
import com.trading.retention.cleanup.RetentionManager;
import com.trading.retention.cleanup.StrategyRegistry;
import com.trading.retention.cleanup.TierRegistry;
import com.trading.retention.config.RetentionConfigLoader;
import com.trading.retention.config.RetentionConfiguration;
import com.trading.retention.health.HealthCheckRegistry;
import com.trading.retention.health.HealthStatus;
import com.trading.retention.health.SchedulerHealthCheck;
import com.trading.retention.health.StorageHealthCheck;
import com.trading.retention.metrics.MicrometerRetentionMetrics;
import com.trading.retention.metrics.NoOpRetentionMetrics;
import com.trading.retention.metrics.RetentionMetrics;
import com.trading.retention.monitor.InMemoryStorageHistory;
import com.trading.retention.monitor.JsonFileStorageHistory;
import com.trading.retention.monitor.StorageHistory;
import com.trading.retention.monitor.StorageMonitor;
import com.trading.retention.monitor.StorageReport;
import com.trading.retention.monitor.StorageStats;
import com.trading.retention.notify.ChannelNotifier;
import com.trading.retention.scheduler.ManualCleanupResult;
import com.trading.retention.scheduler.RetentionScheduler;
import com.trading.retention.scheduler.RetentionStatus;
import com.trading.retention.scheduler.SchedulerStatus;
import com.trading.retention.store.RecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Entry point that wires the retention manager, scheduler and storage monitor around one
 * record store.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (RetentionSystem system = RetentionSystem.builder()
 *         .configFile(Path.of("config/retention.yaml"))
 *         .recordStore(store)
 *         .meterRegistry(registry)
 *         .build()) {
 *     system.start();
 *     List&lt;CleanupOperation&gt; preview = system.runCleanup(null, true);
 * }
 * </pre>
 */
public class RetentionSystem implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetentionSystem.class);

    private final RetentionConfiguration configuration;
    private final AuditService auditService;
    private final RetentionManager manager;
    private final StorageMonitor monitor;
    private final RetentionScheduler scheduler;
    private final HealthCheckRegistry healthCheckRegistry;

    private RetentionSystem(Builder builder) {
        this.configuration = builder.configuration != null
                ? builder.configuration : new RetentionConfigLoader().load(builder.configFile);
        Clock clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();

        this.auditService = builder.auditService != null ? builder.auditService : new AuditService(clock);

        RetentionMetrics metrics;
        if (builder.metrics != null) {
            metrics = builder.metrics;
        } else if (builder.meterRegistry != null) {
            metrics = new MicrometerRetentionMetrics(builder.meterRegistry);
        } else {
            metrics = new NoOpRetentionMetrics();
        }

        StorageHistory history;
        if (builder.history != null) {
            history = builder.history;
        } else if (builder.historyFile != null) {
            history = new JsonFileStorageHistory(builder.historyFile);
        } else {
            history = new InMemoryStorageHistory();
        }

        this.manager = RetentionManager.builder()
                .policies(configuration.policies())
                .recordStore(builder.recordStore)
                .enabled(configuration.enabled())
                .settings(configuration.cleanup())
                .tierRegistry(builder.tierRegistry)
                .strategyRegistry(builder.strategyRegistry)
                .auditService(auditService)
                .metrics(metrics)
                .clock(clock)
                .build();

        this.monitor = StorageMonitor.builder()
                .recordStore(builder.recordStore)
                .history(history)
                .config(configuration.monitoring())
                .metrics(metrics)
                .auditService(auditService)
                .clock(clock)
                .build();

        this.scheduler = RetentionScheduler.builder()
                .retentionManager(manager)
                .storageMonitor(monitor)
                .config(configuration.effectiveSchedulerConfig())
                .backupManager(builder.backupManager)
                .notifier(builder.notifier)
                .auditService(auditService)
                .metrics(metrics)
                .clock(clock)
                .build();

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new StorageHealthCheck(monitor));
        healthCheckRegistry.register(new SchedulerHealthCheck(scheduler));

        log.info("retentionSystem.initialized policies={} enabled={} dryRun={}",
                configuration.policies().size(), configuration.enabled(), configuration.dryRun());
    }

    /**
     * Starts the scheduler and the storage monitor, each subject to its own enabled flag.
     */
    public void start() {
        scheduler.start();
        monitor.start();
    }

    public void stop() {
        scheduler.stop();
        monitor.stop();
    }

    /**
     * Runs cleanup immediately.
     *
     * @param dataTypes data types to clean up, or null for all configured types
     */
    public List<CleanupOperation> runCleanup(List<String> dataTypes, boolean dryRun) {
        return manager.runCleanup(dataTypes, dryRun);
    }

    public ManualCleanupResult runManualCleanup(List<String> dataTypes) {
        return scheduler.runManualCleanup(dataTypes);
    }

    public RetentionStatus getRetentionStatus() {
        return scheduler.getRetentionStatus();
    }

    public SchedulerStatus getSchedulerStatus() {
        return scheduler.getStatus();
    }

    public StorageStats getStorageStats() {
        return scheduler.getStorageStats();
    }

    public StorageReport generateReport() {
        return monitor.generateReport();
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public RetentionConfiguration getConfiguration() {
        return configuration;
    }

    public RetentionManager getManager() {
        return manager;
    }

    public StorageMonitor getMonitor() {
        return monitor;
    }

    public RetentionScheduler getScheduler() {
        return scheduler;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RetentionConfiguration configuration;
        private Path configFile = Path.of("config", "retention.yaml");
        private RecordStore recordStore;
        private BackupManager backupManager;
        private MeterRegistry meterRegistry;
        private RetentionMetrics metrics;
        private AuditService auditService;
        private ChannelNotifier notifier;
        private StorageHistory history;
        private Path historyFile;
        private TierRegistry tierRegistry;
        private StrategyRegistry strategyRegistry;
        private Clock clock;

        /**
         * Uses the given configuration instead of reading a file.
         */
        public Builder configuration(RetentionConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        /**
         * YAML file to load when no configuration object is given. A missing file yields defaults.
         */
        public Builder configFile(Path configFile) {
            this.configFile = configFile;
            return this;
        }

        public Builder recordStore(RecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        public Builder backupManager(BackupManager backupManager) {
            this.backupManager = backupManager;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
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

        public Builder notifier(ChannelNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder storageHistory(StorageHistory history) {
            this.history = history;
            return this;
        }

        /**
         * Persists storage snapshots as JSON in the given file.
         */
        public Builder historyFile(Path historyFile) {
            this.historyFile = historyFile;
            return this;
        }

        public Builder tierRegistry(TierRegistry tierRegistry) {
            this.tierRegistry = tierRegistry;
            return this;
        }

        public Builder strategyRegistry(StrategyRegistry strategyRegistry) {
            this.strategyRegistry = strategyRegistry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RetentionSystem build() {
            if (recordStore == null) {
                throw new IllegalStateException("RecordStore is required");
            }
            return new RetentionSystem(this);
        }
    }
}
