package com.trading.retention.health;

/**
 * One component of the retention system that can report its health.
 */
public interface HealthCheck {

    /**
     * Key under which the result appears in the aggregate status.
     */
    String getName();

    HealthStatus check();
}
