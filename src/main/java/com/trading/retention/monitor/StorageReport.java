package com.trading.retention.monitor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Storage report combining current usage, health and, optionally, trend analysis.
 *
 * @param generatedAt     when the report was generated
 * @param current         current storage statistics
 * @param health          health classification of the total size
 * @param recommendations basic recommendations derived from the current size
 * @param trendAnalysis   trend analysis, null when not requested
 */
public record StorageReport(
        Instant generatedAt,
        StorageStats current,
        StorageHealth health,
        List<String> recommendations,
        TrendAnalysis trendAnalysis
) {
    public static final String REPORT_TYPE = "storage_analysis";

    public StorageReport {
        Objects.requireNonNull(generatedAt, "generatedAt is required");
        Objects.requireNonNull(current, "current is required");
        Objects.requireNonNull(health, "health is required");
        recommendations = List.copyOf(recommendations);
    }

    public double totalSizeMb() {
        return current.totalSizeMb();
    }

    public double totalSizeGb() {
        return current.totalSizeMb() / 1024.0;
    }

    /**
     * Nested map view: report_metadata, current_storage, storage_health and trend_analysis.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("generated_at", generatedAt.toString());
        metadata.put("report_type", REPORT_TYPE);

        Map<String, Object> storage = new LinkedHashMap<>();
        storage.put("total_size_bytes", current.totalSizeBytes());
        storage.put("total_size_mb", totalSizeMb());
        storage.put("total_size_gb", totalSizeGb());
        storage.put("data_type_breakdown", current.dataTypeBreakdownMb());
        storage.put("record_counts", current.recordCounts());
        storage.put("last_cleanup_date",
                current.lastCleanupDate() != null ? current.lastCleanupDate().toString() : null);

        Map<String, Object> healthSection = new LinkedHashMap<>();
        healthSection.put("status", health.getValue());
        healthSection.put("recommendations", recommendations);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("report_metadata", metadata);
        report.put("current_storage", storage);
        report.put("storage_health", healthSection);
        if (trendAnalysis != null) {
            report.put("trend_analysis", trendMap(trendAnalysis));
        }
        return report;
    }

    private static Map<String, Object> trendMap(TrendAnalysis analysis) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (!analysis.isDeterminate()) {
            map.put("error", analysis.message());
            return map;
        }
        map.put("analysis_period_days", analysis.analysisPeriodDays());
        map.put("data_points", analysis.dataPoints());
        map.put("current_size_mb", analysis.currentSizeMb());
        map.put("size_trend", analysis.sizeTrend().getValue());
        map.put("growth_rate_mb_per_day", analysis.growthRateMbPerDay());
        map.put("predicted_size_mb_7_days", analysis.predictedSizeMb7Days());
        Map<String, Object> types = new LinkedHashMap<>();
        analysis.dataTypeTrends().forEach((type, trend) -> {
            Map<String, Object> t = new LinkedHashMap<>();
            t.put("trend", trend.trend().getValue());
            t.put("growth_rate_bytes_per_day", trend.growthRateBytesPerDay());
            t.put("current_size_bytes", trend.currentSizeBytes());
            t.put("current_size_mb", trend.currentSizeMb());
            types.put(type, t);
        });
        map.put("data_type_trends", types);
        map.put("recommendations", analysis.recommendations());
        return map;
    }
}
