package com.reflex.service.infrastructure.health;

import static org.assertj.core.api.Assertions.assertThat;

import com.reflex.observability.ComponentHealth;
import com.reflex.observability.HealthCheckRegistry;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

@DisplayName("ReflexHealthIndicator")
class ReflexHealthIndicatorTest {

    private final HealthCheckRegistry registry = new HealthCheckRegistry();
    private final ReflexHealthIndicator indicator = new ReflexHealthIndicator(registry);

    @Test
    @DisplayName("reports UP when every component is healthy")
    void up() {
        registry.register("store", () -> ComponentHealth.healthy("store", Map.of("state", "CONNECTED")));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails().get("store")).isEqualTo("HEALTHY, state=CONNECTED");
    }

    @Test
    @DisplayName("reports DEGRADED and skips empty detail values")
    void degraded() {
        Map<String, Object> details = new HashMap<>();
        details.put("state", "DEGRADED");
        details.put("last_error", null);
        registry.register("store", () -> ComponentHealth.degraded("store", "probe failed", details));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(ReflexHealthIndicator.DEGRADED);
        assertThat(health.getDetails().get("store")).isEqualTo("DEGRADED: probe failed, state=DEGRADED");
    }

    @Test
    @DisplayName("reports DOWN when a component is unhealthy")
    void down() {
        registry.register("store", () -> ComponentHealth.healthy("store", Map.of()));
        registry.register("other", () -> ComponentHealth.unhealthy("other", "FAILED", Map.of()));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }
}
