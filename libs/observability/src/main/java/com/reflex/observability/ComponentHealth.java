package com.reflex.observability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health result for a single component.
 *
 * @param name component name (e.g. "backing-store")
 * @param status health status of this component
 * @param message optional human-readable explanation, {@code null} when healthy
 * @param details structured extras such as the session state or reconnect attempts
 */
public record ComponentHealth(
        String name, HealthStatus status, String message, Map<String, Object> details) {

    public ComponentHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        details =
                details == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ComponentHealth healthy(String name, Map<String, Object> details) {
        return new ComponentHealth(name, HealthStatus.HEALTHY, null, details);
    }

    public static ComponentHealth degraded(String name, String message, Map<String, Object> details) {
        return new ComponentHealth(name, HealthStatus.DEGRADED, message, details);
    }

    public static ComponentHealth unhealthy(String name, String message, Map<String, Object> details) {
        return new ComponentHealth(name, HealthStatus.UNHEALTHY, message, details);
    }
}
