package com.trading.retention.cleanup;

import com.trading.retention.audit.AuditAction;
import com.trading.retention.audit.AuditService;
import com.trading.retention.logging.LogContext;
import com.trading.retention.metrics.NoOpRetentionMetrics;
import com.trading.retention.metrics.RetentionMetrics;
import com.trading.retention.policy.PolicyStore;
import com.trading.retention.policy.RetentionPolicy;
import com.trading.retention.store.RecordStore;
import com.trading.retention.store.StoredRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies retention policies to the record store.
 *
 * <p>Data types are processed one at a time in tier order (critical, important, operational,
 * then unregistered types). For each type the {@link StrategyRegistry} decides how the cutoff is
 * computed and how records are deleted; the tier registry only decides the order.</p>
 *
 * <p>A failure while cleaning one data type is reported as a failed {@link CleanupOperation} and
 * does not stop the remaining types. In dry-run mode the store is queried but never modified.</p>
 */
public class RetentionManager {
    private static final Logger log = LoggerFactory.getLogger(RetentionManager.class);

    private static final String ACTOR = "retention-manager";

    private final PolicyStore policies;
    private final RecordStore store;
    private final boolean enabled;
    private final CleanupSettings settings;
    private final TierRegistry tiers;
    private final StrategyRegistry strategies;
    private final AuditService auditService;
    private final RetentionMetrics metrics;
    private final Clock clock;

    private RetentionManager(Builder builder) {
        this.policies = Objects.requireNonNull(builder.policies, "policies is required");
        this.store = Objects.requireNonNull(builder.store, "record store is required");
        this.enabled = builder.enabled;
        this.settings = builder.settings != null ? builder.settings : CleanupSettings.defaults();
        this.tiers = builder.tiers != null ? builder.tiers : TierRegistry.defaults();
        this.strategies = builder.strategies != null ? builder.strategies : StrategyRegistry.defaults();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.metrics = builder.metrics != null ? builder.metrics : new NoOpRetentionMetrics();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    /**
     * Runs cleanup for every configured data type.
     */
    public List<CleanupOperation> runCleanup(boolean dryRun) {
        return runCleanup(null, dryRun);
    }

    /**
     * Runs cleanup for the given data types.
     *
     * @param dataTypes data types to clean up, or null for all configured types with an enabled policy
     * @param dryRun    when true, report what would be deleted without deleting
     * @return one operation per processed data type, in processing order
     */
    public List<CleanupOperation> runCleanup(List<String> dataTypes, boolean dryRun) {
        if (!enabled) {
            log.info("retention.disabled");
            return List.of();
        }

        List<String> targets = dataTypes != null ? dataTypes : policies.enabledDataTypes();
        if (targets.isEmpty()) {
            log.info("retention.noDataTypes");
            return List.of();
        }

        List<String> ordered = tiers.order(targets);
        log.info("retention.starting dataTypes={} dryRun={}", ordered, dryRun);

        List<CleanupOperation> operations = new ArrayList<>();
        for (String dataType : ordered) {
            RetentionPolicy policy = policies.get(dataType).orElse(null);
            if (policy == null) {
                log.warn("retention.noPolicy dataType={}", dataType);
                continue;
            }
            if (!policy.enabled()) {
                log.info("retention.policyDisabled dataType={}", dataType);
                continue;
            }
            operations.add(cleanupDataType(dataType, policy, dryRun));
        }

        log.info("retention.completed operations={} dryRun={}", operations.size(), dryRun);
        return operations;
    }

    /**
     * Computes the cutoff the registered strategy would use for a data type right now.
     *
     * @throws IllegalArgumentException if the data type has no policy
     */
    public Instant cutoffFor(String dataType) {
        RetentionPolicy policy = policies.get(dataType)
                .orElseThrow(() -> new IllegalArgumentException("No retention policy for " + dataType));
        return strategies.strategyFor(dataType).cutoff().cutoff(policy, clock.instant());
    }

    private CleanupOperation cleanupDataType(String dataType, RetentionPolicy policy, boolean dryRun) {
        String operationId = LogContext.generateId();
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        CleanupStrategy strategy = strategies.strategyFor(dataType);

        CleanupOperation operation;
        try (LogContext ctx = LogContext.forCleanupOperation(operationId, dataType)
                .with("strategy", strategy.name())) {
            try {
                Instant cutoff = strategy.cutoff().cutoff(policy, startedAt);
                List<StoredRecord> eligible = store.fetchOlderThan(dataType, cutoff);
                long freed = eligible.stream().mapToLong(StoredRecord::sizeBytes).sum();

                int deleted;
                if (eligible.isEmpty()) {
                    deleted = 0;
                    log.debug("cleanup.nothingEligible dataType={} cutoff={}", dataType, cutoff);
                } else if (dryRun) {
                    deleted = eligible.size();
                    log.info("cleanup.dryRun dataType={} wouldDelete={} cutoff={}", dataType, deleted, cutoff);
                } else {
                    deleted = strategy.deletion().delete(store, dataType, eligible, cutoff);
                }

                operation = CleanupOperation.success(operationId, startedAt, dataType,
                        eligible.size(), deleted, freed, elapsedSeconds(startNanos));
            } catch (RuntimeException e) {
                log.error("cleanup.failed dataType={} strategy={} error={}", dataType, strategy.name(), e.getMessage(), e);
                operation = CleanupOperation.failure(operationId, startedAt, dataType,
                        elapsedSeconds(startNanos), describe(e));
            }

            if (settings.logCleanupOperations()) {
                log.info("cleanup.completed dataType={} status={} processed={} deleted={} freedBytes={} durationSeconds={}",
                        dataType, operation.status().getValue(), operation.recordsProcessed(),
                        operation.recordsDeleted(), operation.storageFreedBytes(),
                        String.format("%.3f", operation.durationSeconds()));
            }
        }

        metrics.recordCleanupOperation(operation);
        if (settings.createAuditTrail()) {
            audit(operation, policy, strategy, dryRun);
        }
        return operation;
    }

    private void audit(CleanupOperation operation, RetentionPolicy policy, CleanupStrategy strategy, boolean dryRun) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("operationId", operation.operationId());
        details.put("strategy", strategy.name());
        details.put("priority", policy.priority().getValue());
        details.put("retentionDays", policy.retentionDays());
        details.put("retentionWeeks", policy.retentionWeeks());
        details.put("retentionMonths", policy.retentionMonths());
        details.put("retentionYears", policy.retentionYears());
        details.put("dryRun", dryRun);
        details.put("recordsProcessed", operation.recordsProcessed());
        details.put("recordsDeleted", operation.recordsDeleted());
        details.put("storageFreedBytes", operation.storageFreedBytes());
        details.put("durationSeconds", operation.durationSeconds());
        details.put("errorMessage", operation.errorMessage());

        AuditAction action = operation.isSuccess() ? AuditAction.CLEANUP_SUCCEEDED : AuditAction.CLEANUP_FAILED;
        auditService.record(action, operation.dataType(), ACTOR, details);
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public PolicyStore getPolicies() {
        return policies;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public CleanupSettings getSettings() {
        return settings;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PolicyStore policies = PolicyStore.defaults();
        private RecordStore store;
        private boolean enabled = true;
        private CleanupSettings settings;
        private TierRegistry tiers;
        private StrategyRegistry strategies;
        private AuditService auditService;
        private RetentionMetrics metrics;
        private Clock clock;

        public Builder policies(PolicyStore policies) {
            this.policies = policies;
            return this;
        }

        public Builder recordStore(RecordStore store) {
            this.store = store;
            return this;
        }

        /**
         * Global switch. A disabled manager returns no operations.
         */
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder settings(CleanupSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder tierRegistry(TierRegistry tiers) {
            this.tiers = tiers;
            return this;
        }

        public Builder strategyRegistry(StrategyRegistry strategies) {
            this.strategies = strategies;
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

        public RetentionManager build() {
            return new RetentionManager(this);
        }
    }
}
