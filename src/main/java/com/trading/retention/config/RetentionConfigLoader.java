package com.trading.retention.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.trading.retention.cleanup.CleanupSettings;
import com.trading.retention.monitor.MonitoringConfig;
import com.trading.retention.policy.DataPriority;
import com.trading.retention.policy.PolicyStore;
import com.trading.retention.policy.RetentionPolicy;
import com.trading.retention.scheduler.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link RetentionConfiguration} from a YAML document.
 *
 * <p>Expected layout (all sections and keys optional):</p>
 * <pre>
 * global:
 *   enabled: true
 *   dry_run: false
 * scheduler:
 *   cleanup_schedule: "03:00"
 *   check_interval_minutes: 60
 * retention_policies:
 *   trades:
 *     retention_days: 30
 *     priority: critical
 * cleanup:
 *   create_audit_trail: true
 * storage_monitoring:
 *   warning_threshold_mb: 1000
 * </pre>
 *
 * <p>Missing keys take their defaults and unknown keys are ignored. A {@code retention_policies}
 * section replaces the built-in policy set entirely.</p>
 */
public class RetentionConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(RetentionConfigLoader.class);

    static final int DEFAULT_POLICY_DAYS = 30;
    static final int DEFAULT_POLICY_WEEKS = 4;
    static final int DEFAULT_POLICY_MONTHS = 12;
    static final int DEFAULT_POLICY_YEARS = 3;

    private final ObjectMapper mapper;

    public RetentionConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads the configuration file, falling back to defaults when it does not exist.
     *
     * @throws RetentionConfigException if the file exists but cannot be read or is invalid
     */
    public RetentionConfiguration load(Path file) {
        if (!Files.exists(file)) {
            log.warn("config.notFound file={} using=defaults", file);
            return RetentionConfiguration.defaults();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RetentionConfigException("Cannot read retention configuration " + file, e);
        }
        RetentionConfiguration configuration = parse(content);
        log.info("config.loaded file={} policies={} enabled={} dryRun={}",
                file, configuration.policies().size(), configuration.enabled(), configuration.dryRun());
        return configuration;
    }

    /**
     * Parses a YAML document. An empty document yields the defaults.
     *
     * @throws RetentionConfigException if the document is malformed or holds invalid values
     */
    public RetentionConfiguration parse(String yaml) {
        JsonNode root;
        try {
            root = mapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new RetentionConfigException("Malformed retention configuration: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return RetentionConfiguration.defaults();
        }
        if (!root.isObject()) {
            throw new RetentionConfigException("Retention configuration must be a mapping");
        }

        try {
            JsonNode global = root.path("global");
            return RetentionConfiguration.builder()
                    .enabled(global.path("enabled").asBoolean(true))
                    .dryRun(global.path("dry_run").asBoolean(false))
                    .scheduler(scheduler(root.path("scheduler")))
                    .policies(policies(root.path("retention_policies")))
                    .cleanup(cleanup(root.path("cleanup")))
                    .monitoring(monitoring(root.path("storage_monitoring")))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new RetentionConfigException("Invalid retention configuration: " + e.getMessage(), e);
        }
    }

    private SchedulerConfig scheduler(JsonNode node) {
        SchedulerConfig defaults = SchedulerConfig.defaults();
        SchedulerConfig.Builder builder = defaults.toBuilder()
                .enabled(node.path("enabled").asBoolean(defaults.enabled()))
                .cleanupSchedule(node.path("cleanup_schedule").asText(defaults.cleanupSchedule()))
                .checkIntervalMinutes(node.path("check_interval_minutes").asInt(defaults.checkIntervalMinutes()))
                .maxCleanupDurationHours(node.path("max_cleanup_duration_hours").asInt(defaults.maxCleanupDurationHours()))
                .backupBeforeCleanup(node.path("backup_before_cleanup").asBoolean(defaults.backupBeforeCleanup()))
                .logLevel(node.path("log_level").asText(defaults.logLevel()))
                .dryRun(node.path("dry_run").asBoolean(defaults.dryRun()));

        JsonNode channels = node.path("notification_channels");
        if (channels.isArray()) {
            List<String> names = new ArrayList<>();
            channels.forEach(c -> names.add(c.asText()));
            builder.notificationChannels(names);
        }
        return builder.build();
    }

    private PolicyStore policies(JsonNode node) {
        if (!node.isObject()) {
            return PolicyStore.defaults();
        }
        Map<String, RetentionPolicy> policies = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode p = entry.getValue();
            policies.put(entry.getKey(), new RetentionPolicy(
                    p.path("enabled").asBoolean(true),
                    p.path("retention_days").asInt(DEFAULT_POLICY_DAYS),
                    p.path("retention_weeks").asInt(DEFAULT_POLICY_WEEKS),
                    p.path("retention_months").asInt(DEFAULT_POLICY_MONTHS),
                    p.path("retention_years").asInt(DEFAULT_POLICY_YEARS),
                    DataPriority.fromValue(p.path("priority").asText(DataPriority.OPERATIONAL.getValue())),
                    p.path("description").asText("")));
        }
        return new PolicyStore(policies);
    }

    private CleanupSettings cleanup(JsonNode node) {
        CleanupSettings defaults = CleanupSettings.defaults();
        return new CleanupSettings(
                node.path("create_audit_trail").asBoolean(defaults.createAuditTrail()),
                node.path("log_cleanup_operations").asBoolean(defaults.logCleanupOperations()));
    }

    private MonitoringConfig monitoring(JsonNode node) {
        MonitoringConfig defaults = MonitoringConfig.defaults();
        return new MonitoringConfig(
                node.path("enabled").asBoolean(defaults.enabled()),
                node.path("check_interval_hours").asInt(defaults.checkIntervalHours()),
                node.path("warning_threshold_mb").asDouble(defaults.warningThresholdMb()),
                node.path("critical_threshold_mb").asDouble(defaults.criticalThresholdMb()),
                node.path("history_retention_days").asInt(defaults.historyRetentionDays()),
                node.path("include_trends").asBoolean(defaults.includeTrends()));
    }
}
