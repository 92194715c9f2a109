package com.trading.retention.scheduler;

import com.trading.retention.audit.AuditAction;
import com.trading.retention.audit.AuditService;
import com.trading.retention.backup.BackupManager;
import com.trading.retention.backup.BackupResult;
import com.trading.retention.backup.NoOpBackupManager;
import com.trading.retention.cleanup.CleanupOperation;
import com.trading.retention.cleanup.CleanupSummary;
import com.trading.retention.cleanup.RetentionManager;
import com.trading.retention.logging.LogContext;
import com.trading.retention.metrics.NoOpRetentionMetrics;
import com.trading.retention.metrics.RetentionMetrics;
import com.trading.retention.monitor.StorageMonitor;
import com.trading.retention.monitor.StorageStats;
import com.trading.retention.notify.ChannelNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs retention cleanup once a day at a configured time.
 *
 * <p>After {@link #start()} a background timer checks every {@code checkIntervalMinutes}
 * whether a cleanup is due. A cleanup is due when none has completed on the current calendar
 * date and the current time lies within {@code [schedule, schedule + checkIntervalMinutes]}.
 * Checks run at a fixed rate so that exactly one check falls into each window.</p>
 *
 * <p>A cycle that completes counts towards both the total and the successful cleanups, even if
 * some of its per-type operations failed. A cycle aborted by an exception from the backup or the
 * manager counts only as failed and leaves the total and the last cleanup time unchanged. The last
 * cleanup time is the start of the cycle, so a cycle that runs past midnight still counts for the
 * day it started on. Failures while reporting a completed cycle are logged and do not change its
 * outcome. At most
 * one cycle runs at a time; {@link #stop()} stops the timer but lets a running cycle finish.</p>
 */
public class RetentionScheduler {
    private static final Logger log = LoggerFactory.getLogger(RetentionScheduler.class);

    private static final String ACTOR = "retention-scheduler";

    private final RetentionManager manager;
    private final StorageMonitor monitor;
    private final BackupManager backupManager;
    private final ChannelNotifier notifier;
    private final AuditService auditService;
    private final RetentionMetrics metrics;
    private final Clock clock;
    private final Supplier<ScheduledExecutorService> executorFactory;

    private final SchedulerState state = new SchedulerState();
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicReference<ScheduledExecutorService> executor = new AtomicReference<>();
    private final AtomicReference<ScheduledFuture<?>> ticker = new AtomicReference<>();

    private volatile SchedulerConfig config;
    private volatile Instant startTime;

    private RetentionScheduler(Builder builder) {
        this.manager = Objects.requireNonNull(builder.manager, "retention manager is required");
        this.monitor = Objects.requireNonNull(builder.monitor, "storage monitor is required");
        this.config = builder.config != null ? builder.config : SchedulerConfig.defaults();
        this.backupManager = builder.backupManager != null ? builder.backupManager : new NoOpBackupManager();
        this.notifier = builder.notifier != null ? builder.notifier : new ChannelNotifier();
        this.auditService = builder.auditService != null ? builder.auditService : manager.getAuditService();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpRetentionMetrics();
        this.clock = builder.clock != null ? builder.clock : Clock.systemDefaultZone();
        this.executorFactory = builder.executorFactory != null
                ? builder.executorFactory : RetentionScheduler::newTimerExecutor;
    }

    /**
     * Starts the timer. No-op when the scheduler is disabled or already running.
     */
    public void start() {
        SchedulerConfig current = config;
        if (!current.enabled()) {
            log.info("scheduler.disabled");
            return;
        }
        ScheduledExecutorService ses = executorFactory.get();
        if (!executor.compareAndSet(null, ses)) {
            ses.shutdown();
            log.warn("scheduler.alreadyRunning");
            return;
        }
        startTime = clock.instant();
        schedule(ses, current.checkIntervalMinutes(), 0);
        log.info("scheduler.started schedule={} intervalMinutes={} dryRun={} logLevel={}",
                current.cleanupSchedule(), current.checkIntervalMinutes(), current.dryRun(), current.logLevel());
    }

    /**
     * Stops the timer. A cycle already in progress runs to completion. No-op when stopped.
     */
    public void stop() {
        ScheduledExecutorService ses = executor.getAndSet(null);
        if (ses == null) {
            return;
        }
        ticker.set(null);
        ses.shutdown();
        startTime = null;
        log.info("scheduler.stopped");
    }

    public boolean isRunning() {
        return executor.get() != null;
    }

    /**
     * Replaces the configuration. The next timer tick uses the new settings; a changed check
     * interval reschedules the timer while running.
     */
    public void reconfigure(SchedulerConfig newConfig) {
        Objects.requireNonNull(newConfig, "config");
        SchedulerConfig previous = this.config;
        this.config = newConfig;
        log.info("scheduler.reconfigured schedule={} intervalMinutes={} enabled={} dryRun={}",
                newConfig.cleanupSchedule(), newConfig.checkIntervalMinutes(), newConfig.enabled(), newConfig.dryRun());

        ScheduledExecutorService ses = executor.get();
        if (ses != null && previous.checkIntervalMinutes() != newConfig.checkIntervalMinutes()) {
            ScheduledFuture<?> old = ticker.get();
            if (old != null) {
                old.cancel(false);
            }
            schedule(ses, newConfig.checkIntervalMinutes(), newConfig.checkIntervalMinutes());
        }
    }

    private void schedule(ScheduledExecutorService ses, long intervalMinutes, long initialDelayMinutes) {
        ticker.set(ses.scheduleAtFixedRate(this::tick, initialDelayMinutes, intervalMinutes, TimeUnit.MINUTES));
    }

    private static ScheduledExecutorService newTimerExecutor() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retention-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * One timer tick: runs a cleanup cycle if one is due.
     */
    void tick() {
        try {
            if (!config.enabled()) {
                log.debug("scheduler.tickSkipped reason=disabled");
                return;
            }
            if (shouldRunCleanup()) {
                runCycle("schedule");
            }
        } catch (RuntimeException e) {
            log.error("scheduler.tickFailed error={}", e.getMessage(), e);
        }
    }

    /**
     * Whether a cleanup is due now.
     */
    public boolean shouldRunCleanup() {
        SchedulerConfig current = config;
        ZoneId zone = clock.getZone();
        ZonedDateTime now = ZonedDateTime.now(clock);
        LocalDate today = now.toLocalDate();

        Instant lastCleanup = state.lastCleanup();
        if (lastCleanup != null && !LocalDate.ofInstant(lastCleanup, zone).isBefore(today)) {
            return false;
        }

        ZonedDateTime windowStart = ZonedDateTime.of(today, current.scheduledTime(), zone);
        ZonedDateTime windowEnd = windowStart.plusMinutes(current.checkIntervalMinutes());
        return !now.isBefore(windowStart) && !now.isAfter(windowEnd);
    }

    /**
     * Runs a full cleanup cycle immediately, bypassing the schedule.
     *
     * @return true if the cycle completed, false if it failed or another cycle was in progress
     */
    public boolean runCleanupCycle() {
        return runCycle("manual");
    }

    private boolean runCycle(String trigger) {
        if (!cycleLock.tryLock()) {
            log.warn("scheduler.cycleSkipped reason=inProgress trigger={}", trigger);
            return false;
        }
        String cycleId = LogContext.generateId();
        try (LogContext ctx = LogContext.forCleanupCycle(cycleId, trigger)) {
            return executeCycle(cycleId);
        } finally {
            cycleLock.unlock();
        }
    }

    private boolean executeCycle(String cycleId) {
        SchedulerConfig current = config;
        Instant cycleStart = clock.instant();
        long startNanos = System.nanoTime();
        log.info("scheduler.cycleStarting dryRun={} backup={}", current.dryRun(), current.backupBeforeCleanup());

        List<CleanupOperation> operations;
        try {
            if (current.backupBeforeCleanup() && !current.dryRun()) {
                createBackup(cycleId);
            }
            operations = manager.runCleanup(current.dryRun());
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("scheduler.cycleFailed error={}", error, e);
            state.recordFailed(error);
            reportFailure(cycleId, cycleStart, error, current);
            return false;
        }

        CleanupSummary summary = CleanupSummary.of(operations);
        state.recordCompleted(cycleStart, summary.failedOperations());
        double duration = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        try {
            reportCompletion(cycleId, cycleStart, summary, duration, current);
        } catch (RuntimeException e) {
            log.warn("scheduler.cycleReportFailed error={}", e.getMessage(), e);
        }
        return true;
    }

    private void reportCompletion(String cycleId, Instant cycleStart, CleanupSummary summary,
                                  double duration, SchedulerConfig current) {
        monitor.recordCleanup(cycleStart);
        metrics.recordCycle(true);

        log.info("scheduler.cycleCompleted operations={} failed={} deleted={} freedMb={} durationSeconds={} efficiency={}",
                summary.totalOperations(), summary.failedOperations(), summary.totalRecordsDeleted(),
                String.format("%.2f", summary.totalStorageFreedMb()), String.format("%.2f", duration),
                summary.efficiencyRating().getLabel());
        summary.recommendations().forEach(r -> log.info("scheduler.recommendation text={}", r));
        checkDuration(duration, current);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("startedAt", cycleStart.toString());
        details.put("operations", summary.totalOperations());
        details.put("failedOperations", summary.failedOperations());
        details.put("recordsDeleted", summary.totalRecordsDeleted());
        details.put("storageFreedBytes", summary.totalStorageFreedBytes());
        details.put("successRate", summary.successRate());
        details.put("dryRun", current.dryRun());
        auditService.record(AuditAction.CYCLE_COMPLETED, cycleId, ACTOR, details);

        notifier.notify(current.notificationChannels(), String.format(
                "Retention cleanup completed: %d successful, %d failed, %d records deleted, %.2f MB freed, %.2fs duration",
                summary.successfulOperations(), summary.failedOperations(), summary.totalRecordsDeleted(),
                summary.totalStorageFreedMb(), duration));
    }

    private void reportFailure(String cycleId, Instant cycleStart, String error, SchedulerConfig current) {
        try {
            metrics.recordCycle(false);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("startedAt", cycleStart.toString());
            details.put("error", error);
            auditService.record(AuditAction.CYCLE_FAILED, cycleId, ACTOR, details);

            notifier.notifyError(current.notificationChannels(), "Retention cleanup failed: " + error);
        } catch (RuntimeException e) {
            log.warn("scheduler.cycleReportFailed error={}", e.getMessage(), e);
        }
    }

    private void createBackup(String cycleId) {
        log.info("scheduler.backupStarting");
        BackupResult result = backupManager.createBackup();
        if (result.isSuccess()) {
            log.info("scheduler.backupCreated backupId={}", result.backupId());
            auditService.record(AuditAction.BACKUP_CREATED, cycleId, ACTOR,
                    Map.of("backupId", result.backupId()));
        } else {
            log.warn("scheduler.backupFailed error={}", result.errorMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error", result.errorMessage());
            auditService.record(AuditAction.BACKUP_FAILED, cycleId, ACTOR, details);
        }
    }

    private void checkDuration(double durationSeconds, SchedulerConfig current) {
        double limit = Duration.ofHours(current.maxCleanupDurationHours()).toSeconds();
        if (durationSeconds > limit) {
            log.warn("scheduler.cycleOverran durationSeconds={} maxHours={}",
                    String.format("%.2f", durationSeconds), current.maxCleanupDurationHours());
        }
    }

    /**
     * Runs cleanup for the given data types right away, outside the schedule and without
     * touching the cycle counters.
     *
     * @param dataTypes data types to clean up, or null for all configured types
     */
    public ManualCleanupResult runManualCleanup(List<String> dataTypes) {
        log.info("scheduler.manualCleanup dataTypes={}", dataTypes != null ? dataTypes : "all");
        try {
            ManualCleanupResult result = ManualCleanupResult.of(manager.runCleanup(dataTypes, config.dryRun()));
            log.info("scheduler.manualCleanupCompleted operations={} failed={} deleted={}",
                    result.operationsCount(), result.failedOperations(), result.totalRecordsDeleted());
            return result;
        } catch (RuntimeException e) {
            log.error("scheduler.manualCleanupFailed error={}", e.getMessage(), e);
            return ManualCleanupResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public SchedulerStatus getStatus() {
        boolean running = isRunning();
        Instant now = clock.instant();
        Instant started = startTime;
        double uptime = running && started != null ? Duration.between(started, now).toMillis() / 1000.0 : 0.0;
        return state.toStatus(running, running ? nextCleanup() : null, uptime);
    }

    /**
     * Today's scheduled time if still ahead, otherwise tomorrow's.
     */
    Instant nextCleanup() {
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime next = ZonedDateTime.of(now.toLocalDate(), config.scheduledTime(), clock.getZone());
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return next.toInstant();
    }

    /**
     * Policy counts, current storage usage and the active configuration.
     */
    public RetentionStatus getRetentionStatus() {
        StorageStats stats = monitor.getCurrentStats();
        return new RetentionStatus(
                manager.isEnabled(),
                manager.getPolicies().size(),
                manager.getPolicies().activeCount(),
                stats,
                state.lastCleanup(),
                config);
    }

    public StorageStats getStorageStats() {
        return monitor.getCurrentStats();
    }

    /**
     * Whether the most recent cycle was aborted by an exception.
     */
    public boolean lastCycleFailed() {
        return state.lastCycleFailed();
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RetentionManager manager;
        private StorageMonitor monitor;
        private SchedulerConfig config;
        private BackupManager backupManager;
        private ChannelNotifier notifier;
        private AuditService auditService;
        private RetentionMetrics metrics;
        private Clock clock;
        private Supplier<ScheduledExecutorService> executorFactory;

        public Builder retentionManager(RetentionManager manager) {
            this.manager = manager;
            return this;
        }

        public Builder storageMonitor(StorageMonitor monitor) {
            this.monitor = monitor;
            return this;
        }

        public Builder config(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        public Builder backupManager(BackupManager backupManager) {
            this.backupManager = backupManager;
            return this;
        }

        public Builder notifier(ChannelNotifier notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metrics(RetentionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Source of the timer executor; defaults to a single daemon thread.
         */
        Builder executorFactory(Supplier<ScheduledExecutorService> executorFactory) {
            this.executorFactory = executorFactory;
            return this;
        }

        public RetentionScheduler build() {
            return new RetentionScheduler(this);
        }
    }
}
