package com.trading.retention.cleanup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps data-type names to the cleanup strategy used for them. The policy's declared
 * priority plays no part in the lookup; unregistered names get the fallback strategy.
 */
public final class StrategyRegistry {

    private final Map<String, CleanupStrategy> strategies;
    private final CleanupStrategy fallback;

    public StrategyRegistry(Map<String, CleanupStrategy> strategies, CleanupStrategy fallback) {
        Objects.requireNonNull(strategies, "strategies is required");
        this.strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
        this.fallback = Objects.requireNonNull(fallback, "fallback is required");
    }

    /**
     * Conservative for trades, orders and positions; standard for equity_curve;
     * aggressive for market_data; standard for everything else.
     */
    public static StrategyRegistry defaults() {
        CleanupStrategy conservative = CleanupStrategy.conservative();
        Map<String, CleanupStrategy> strategies = new LinkedHashMap<>();
        strategies.put("trades", conservative);
        strategies.put("orders", conservative);
        strategies.put("positions", conservative);
        strategies.put("equity_curve", CleanupStrategy.standard());
        strategies.put("market_data", CleanupStrategy.aggressive());
        return new StrategyRegistry(strategies, CleanupStrategy.standard());
    }

    public CleanupStrategy strategyFor(String dataType) {
        return strategies.getOrDefault(dataType, fallback);
    }

    public boolean isRegistered(String dataType) {
        return strategies.containsKey(dataType);
    }

    public CleanupStrategy getFallback() {
        return fallback;
    }
}
