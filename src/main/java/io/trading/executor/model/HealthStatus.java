package io.trading.executor.model;

/**
 * Service health levels reported by the execution gateway.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
