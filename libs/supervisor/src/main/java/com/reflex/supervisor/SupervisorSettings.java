package com.reflex.supervisor;

import java.time.Duration;

/**
 * Tuning of the connection supervisor. Non-positive values fall back to the defaults.
 *
 * @param maxReconnectAttempts failed reconnects tolerated before {@link SessionState#FAILED}
 *     (default 5)
 * @param baseReconnectDelay nominal delay before the first reconnect (default 2s)
 * @param maxReconnectDelay ceiling for any reconnect delay (default 60s)
 * @param healthCheckInterval fixed interval between health probes (default 30s)
 */
public record SupervisorSettings(
        int maxReconnectAttempts,
        Duration baseReconnectDelay,
        Duration maxReconnectDelay,
        Duration healthCheckInterval) {

    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;
    public static final Duration DEFAULT_BASE_RECONNECT_DELAY = Duration.ofMillis(2000);
    public static final Duration DEFAULT_MAX_RECONNECT_DELAY = Duration.ofSeconds(60);
    public static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(30);

    public SupervisorSettings {
        if (maxReconnectAttempts <= 0) {
            maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;
        }
        baseReconnectDelay = positiveOr(baseReconnectDelay, DEFAULT_BASE_RECONNECT_DELAY);
        maxReconnectDelay = positiveOr(maxReconnectDelay, DEFAULT_MAX_RECONNECT_DELAY);
        healthCheckInterval = positiveOr(healthCheckInterval, DEFAULT_HEALTH_CHECK_INTERVAL);
        if (maxReconnectDelay.compareTo(baseReconnectDelay) < 0) {
            maxReconnectDelay = baseReconnectDelay;
        }
    }

    public static SupervisorSettings defaults() {
        return new SupervisorSettings(0, null, null, null);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
