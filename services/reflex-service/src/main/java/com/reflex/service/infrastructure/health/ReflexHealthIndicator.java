package com.reflex.service.infrastructure.health;

import com.reflex.observability.ComponentHealth;
import com.reflex.observability.HealthCheckRegistry;
import com.reflex.observability.HealthResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Publishes the {@link HealthCheckRegistry} under {@code /actuator/health/reflex}.
 *
 * <p>Degraded components map to a custom {@code DEGRADED} status, ordered between {@code DOWN} and
 * {@code UP} in {@code application.yml}.
 */
@Component("reflex")
public class ReflexHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");

    private final HealthCheckRegistry registry;

    public ReflexHealthIndicator(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        HealthResult result = registry.checkAll();
        Health.Builder builder =
                switch (result.status()) {
                    case HEALTHY -> Health.up();
                    case DEGRADED -> Health.status(DEGRADED);
                    case UNHEALTHY -> Health.down();
                };
        result.checks().forEach((name, component) -> builder.withDetail(name, describe(component)));
        return builder.withDetail("checkedAt", result.timestamp().toString()).build();
    }

    private static String describe(ComponentHealth component) {
        StringBuilder text = new StringBuilder(component.status().name());
        if (component.message() != null) {
            text.append(": ").append(component.message());
        }
        component.details().forEach((key, value) -> {
            if (value != null) {
                text.append(", ").append(key).append('=').append(value);
            }
        });
        return text.toString();
    }
}
