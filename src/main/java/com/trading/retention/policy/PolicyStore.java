package com.trading.retention.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from data-type name to {@link RetentionPolicy}.
 * Iteration order is the order in which policies were configured.
 * Reloading configuration replaces the whole store.
 */
public final class PolicyStore {

    private final Map<String, RetentionPolicy> policies;

    public PolicyStore(Map<String, RetentionPolicy> policies) {
        Objects.requireNonNull(policies, "policies is required");
        Map<String, RetentionPolicy> copy = new LinkedHashMap<>();
        policies.forEach((dataType, policy) -> {
            if (dataType == null || dataType.isBlank()) {
                throw new IllegalArgumentException("data type name must not be blank");
            }
            copy.put(dataType, Objects.requireNonNull(policy, "policy for " + dataType));
        });
        this.policies = Collections.unmodifiableMap(copy);
    }

    /**
     * The five trading data types with their stock policies.
     */
    public static PolicyStore defaults() {
        Map<String, RetentionPolicy> policies = new LinkedHashMap<>();
        policies.put("trades", RetentionPolicy.critical("Trade records"));
        policies.put("orders", RetentionPolicy.critical("Order records"));
        policies.put("positions", RetentionPolicy.critical("Position records"));
        policies.put("equity_curve", RetentionPolicy.important("Equity curve data"));
        policies.put("market_data", RetentionPolicy.operational("Market data"));
        return new PolicyStore(policies);
    }

    public static PolicyStore empty() {
        return new PolicyStore(Map.of());
    }

    public Optional<RetentionPolicy> get(String dataType) {
        return Optional.ofNullable(policies.get(dataType));
    }

    public boolean contains(String dataType) {
        return policies.containsKey(dataType);
    }

    /**
     * Returns all policies keyed by data type (unmodifiable).
     */
    public Map<String, RetentionPolicy> asMap() {
        return policies;
    }

    /**
     * Returns the data types whose policy is enabled, in configuration order.
     */
    public List<String> enabledDataTypes() {
        return policies.entrySet().stream()
                .filter(e -> e.getValue().enabled())
                .map(Map.Entry::getKey)
                .toList();
    }

    public int size() {
        return policies.size();
    }

    public int activeCount() {
        return (int) policies.values().stream().filter(RetentionPolicy::enabled).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PolicyStore other)) return false;
        return policies.equals(other.policies);
    }

    @Override
    public int hashCode() {
        return policies.hashCode();
    }

    @Override
    public String toString() {
        return "PolicyStore{policies=" + policies.keySet() + ", active=" + activeCount() + '}';
    }
}
