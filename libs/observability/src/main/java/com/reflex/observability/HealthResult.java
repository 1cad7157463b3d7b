package com.reflex.observability;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate health result from all registered checks.
 *
 * @param status overall health, the worst of the component statuses
 * @param checks component results keyed by registration name
 * @param timestamp when the checks ran
 */
public record HealthResult(HealthStatus status, Map<String, ComponentHealth> checks, Instant timestamp) {

    public HealthResult {
        checks = Map.copyOf(checks);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
