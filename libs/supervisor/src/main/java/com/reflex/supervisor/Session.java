package com.reflex.supervisor;

import java.time.Instant;
import java.util.Optional;

/**
 * Immutable snapshot of the supervised session, published after every change.
 *
 * @param state current lifecycle state
 * @param establishedAt when the current (or last) session was opened, {@code null} before the first
 * @param reconnectAttempts failed reconnect attempts since the last successful connect
 * @param lastHealthCheckAt when the last probe completed, {@code null} before the first
 * @param lastError description of the last connect or probe failure, {@code null} if none
 * @param consecutiveProbeFailures probes failed in a row on the current session
 */
public record Session(
        SessionState state,
        Instant establishedAt,
        int reconnectAttempts,
        Instant lastHealthCheckAt,
        String lastError,
        int consecutiveProbeFailures) {

    static Session initial() {
        return new Session(SessionState.DISCONNECTED, null, 0, null, null, 0);
    }

    public Optional<String> lastErrorMessage() {
        return Optional.ofNullable(lastError);
    }
}
