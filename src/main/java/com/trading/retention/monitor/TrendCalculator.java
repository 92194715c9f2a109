package com.trading.retention.monitor;

import java.util.List;

/**
 * Trend, growth-rate and forecast arithmetic over ordered measurement series.
 */
public final class TrendCalculator {

    /**
     * Relative change between first and last value below which a series is stable.
     */
    public static final double NOISE_THRESHOLD = 0.05;

    private TrendCalculator() {
    }

    /**
     * Classifies a series by comparing its last value with its first.
     */
    public static Trend trend(List<? extends Number> values) {
        if (values.size() < 2) {
            return Trend.INSUFFICIENT_DATA;
        }
        double first = values.get(0).doubleValue();
        double last = values.get(values.size() - 1).doubleValue();
        double band = Math.abs(first) * NOISE_THRESHOLD;
        if (last > first + band) {
            return Trend.INCREASING;
        } else if (last < first - band) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    /**
     * Average change per step: {@code (last - first) / (count - 1)}. Zero for fewer than two values.
     */
    public static double growthRate(List<? extends Number> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double first = values.get(0).doubleValue();
        double last = values.get(values.size() - 1).doubleValue();
        return (last - first) / (values.size() - 1);
    }

    /**
     * Extrapolates the series {@code steps} steps past its last value.
     */
    public static double predict(List<? extends Number> values, int steps) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double last = values.get(values.size() - 1).doubleValue();
        return last + growthRate(values) * steps;
    }
}
