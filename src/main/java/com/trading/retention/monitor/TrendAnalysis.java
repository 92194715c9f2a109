package com.trading.retention.monitor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of analyzing the snapshot history over a window of days.
 *
 * <p>With fewer than two snapshots in the window the analysis is indeterminate:
 * {@link #sizeTrend()} is {@link Trend#INSUFFICIENT_DATA}, rates are zero and
 * {@link #message()} explains why.</p>
 */
public record TrendAnalysis(
        int analysisPeriodDays,
        int dataPoints,
        double currentSizeMb,
        Trend sizeTrend,
        double growthRateMbPerDay,
        double predictedSizeMb7Days,
        Map<String, DataTypeTrend> dataTypeTrends,
        List<String> recommendations,
        String message
) {
    public TrendAnalysis {
        dataTypeTrends = Collections.unmodifiableMap(new LinkedHashMap<>(dataTypeTrends));
        recommendations = List.copyOf(recommendations);
    }

    static TrendAnalysis insufficient(int days, int dataPoints, double currentSizeMb) {
        String message = dataPoints == 0 ? "No storage history available" : "Insufficient data for trend analysis";
        return new TrendAnalysis(days, dataPoints, currentSizeMb, Trend.INSUFFICIENT_DATA,
                0.0, currentSizeMb, Map.of(), List.of(), message);
    }

    public boolean isDeterminate() {
        return sizeTrend != Trend.INSUFFICIENT_DATA;
    }
}
