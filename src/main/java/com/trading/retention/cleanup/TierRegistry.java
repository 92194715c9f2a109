package com.trading.retention.cleanup;

import com.trading.retention.policy.DataPriority;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps data-type names to the tier that decides processing order.
 * Unregistered names sort after every registered tier.
 */
public final class TierRegistry {

    private final Map<String, DataPriority> tiers;

    public TierRegistry(Map<String, DataPriority> tiers) {
        Objects.requireNonNull(tiers, "tiers is required");
        this.tiers = Collections.unmodifiableMap(new LinkedHashMap<>(tiers));
    }

    /**
     * Trades, orders and positions are critical, equity_curve is important and
     * market_data is operational.
     */
    public static TierRegistry defaults() {
        Map<String, DataPriority> tiers = new LinkedHashMap<>();
        tiers.put("trades", DataPriority.CRITICAL);
        tiers.put("orders", DataPriority.CRITICAL);
        tiers.put("positions", DataPriority.CRITICAL);
        tiers.put("equity_curve", DataPriority.IMPORTANT);
        tiers.put("market_data", DataPriority.OPERATIONAL);
        return new TierRegistry(tiers);
    }

    public Optional<DataPriority> tierOf(String dataType) {
        return Optional.ofNullable(tiers.get(dataType));
    }

    /**
     * Sort rank of a data type: the tier ordinal, or one past the last tier when unregistered.
     */
    public int rank(String dataType) {
        DataPriority tier = tiers.get(dataType);
        return tier != null ? tier.ordinal() : DataPriority.values().length;
    }

    /**
     * Returns the data types sorted by tier. The sort is stable, so types of the same tier
     * keep their input order.
     */
    public List<String> order(List<String> dataTypes) {
        return dataTypes.stream()
                .sorted(Comparator.comparingInt(this::rank))
                .toList();
    }

    public Map<String, DataPriority> asMap() {
        return tiers;
    }
}
