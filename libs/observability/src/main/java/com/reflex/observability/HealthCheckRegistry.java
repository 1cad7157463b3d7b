package com.reflex.observability;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry that aggregates named {@link HealthCheck}s into one {@link HealthResult}.
 *
 * <p>A check that throws is reported as {@link HealthStatus#UNHEALTHY} instead of failing the whole
 * aggregation.
 */
public final class HealthCheckRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new ConcurrentHashMap<>();
    private final Clock clock;

    public HealthCheckRegistry() {
        this(Clock.systemUTC());
    }

    public HealthCheckRegistry(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    /**
     * Registers a check under the given name, replacing any existing check of that name.
     *
     * @param name component name (e.g. "backing-store")
     * @param check the health check to register
     */
    public void register(String name, HealthCheck check) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, check);
    }

    /** @return true if a check was removed */
    public boolean deregister(String name) {
        return checks.remove(name) != null;
    }

    /**
     * Runs every registered check and folds the results. With no checks registered the result is
     * {@link HealthStatus#HEALTHY}.
     */
    public HealthResult checkAll() {
        Map<String, ComponentHealth> results = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;

        for (Map.Entry<String, HealthCheck> entry : checks.entrySet()) {
            String name = entry.getKey();
            ComponentHealth result;
            try {
                result = entry.getValue().check();
                if (result == null) {
                    result = ComponentHealth.unhealthy(name, "check returned no result", Map.of());
                }
            } catch (RuntimeException e) {
                log.warn("Health check '{}' threw: {}", name, e.toString());
                result = ComponentHealth.unhealthy(name, "check failed: " + e.getMessage(), Map.of());
            }
            results.put(name, result);
            overall = overall.worst(result.status());
        }

        return new HealthResult(overall, results, Instant.now(clock));
    }

    public int size() {
        return checks.size();
    }
}
