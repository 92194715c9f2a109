package com.trading.retention.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrendCalculatorTest {

    private static final List<Integer> RISING = List.of(1000, 1100, 1200, 1300, 1400);
    private static final List<Integer> FALLING = List.of(1400, 1300, 1200, 1100, 1000);

    @Test
    @DisplayName("Growth rate should be the average per-step delta")
    void testGrowthRate() {
        assertEquals(100.0, TrendCalculator.growthRate(RISING));
        assertEquals(-100.0, TrendCalculator.growthRate(FALLING));
        assertEquals(0.0, TrendCalculator.growthRate(List.of(5)));
    }

    @Test
    @DisplayName("Prediction should extrapolate from the last value")
    void testPredict() {
        assertEquals(2100.0, TrendCalculator.predict(RISING, 7));
        assertEquals(42.0, TrendCalculator.predict(List.of(42), 7));
        assertEquals(0.0, TrendCalculator.predict(List.of(), 7));
    }

    @Test
    @DisplayName("Trend should classify by first versus last value")
    void testTrend() {
        assertEquals(Trend.INCREASING, TrendCalculator.trend(List.of(100, 110, 120, 130, 140)));
        assertEquals(Trend.DECREASING, TrendCalculator.trend(List.of(140, 130, 120, 110, 100)));
        assertEquals(Trend.STABLE, TrendCalculator.trend(List.of(100, 102, 98, 101, 99)));
        assertEquals(Trend.INSUFFICIENT_DATA, TrendCalculator.trend(List.of(100)));
    }

    @Test
    @DisplayName("Changes within the noise threshold should be stable")
    void testNoiseThreshold() {
        assertEquals(Trend.STABLE, TrendCalculator.trend(List.of(100, 105)));
        assertEquals(Trend.INCREASING, TrendCalculator.trend(List.of(100, 106)));
        assertEquals(Trend.STABLE, TrendCalculator.trend(List.of(100, 95)));
        assertEquals(Trend.DECREASING, TrendCalculator.trend(List.of(100, 94)));
    }

    @Test
    @DisplayName("Health bands should follow the megabyte thresholds")
    void testHealth() {
        assertEquals(StorageHealth.HEALTHY, StorageHealth.assess(100));
        assertEquals(StorageHealth.CAUTION, StorageHealth.assess(600));
        assertEquals(StorageHealth.WARNING, StorageHealth.assess(1500));
        assertEquals(StorageHealth.CRITICAL, StorageHealth.assess(6000));
        assertEquals(StorageHealth.CAUTION, StorageHealth.assess(500));
        assertEquals(StorageHealth.WARNING, StorageHealth.assess(1000));
        assertEquals(StorageHealth.CRITICAL, StorageHealth.assess(5000));
    }
}
