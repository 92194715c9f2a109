package com.trading.retention.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the registered checks and folds them into one status.
 *
 * <p>The aggregate takes the worst individual status; its message names the check that
 * produced it. A check that throws is reported as DOWN.</p>
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus worst = HealthStatus.up("All components healthy");
        String worstName = null;
        Map<String, Object> results = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.getName(), result.toMap());
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        String message = worstName != null ? worstName + ": " + worst.message() : worst.message();
        HealthStatus aggregate = new HealthStatus(worst.status(), message, results);
        if (!aggregate.isUp()) {
            log.warn("health.notUp status={} message={}", aggregate.status(), message);
        }
        return aggregate;
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.error("health.checkFailed check={} error={}", check.getName(), e.getMessage(), e);
            return HealthStatus.down("Health check failed: " + e.getMessage());
        }
    }

    public int size() {
        return checks.size();
    }
}
