package com.reflex.observability;

/**
 * A lightweight, non-blocking look at one component's health.
 *
 * <p>Checks report already-known state (the supervisor's last probe, a view's status); they must not
 * perform network round-trips, so the registry can call them from a health endpoint at any rate.
 */
@FunctionalInterface
public interface HealthCheck {

    ComponentHealth check();
}
