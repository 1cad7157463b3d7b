package com.reflex.supervisor;

/**
 * Callback for session state changes.
 *
 * <p>Delivery is at-least-once and happens on whichever thread made the change (a caller thread or
 * the supervisor's scheduler). Implementations must be idempotent and fast; exceptions are logged
 * and otherwise ignored.
 */
@FunctionalInterface
public interface StateChangeListener {

    void onStateChange(StateTransition transition);
}
