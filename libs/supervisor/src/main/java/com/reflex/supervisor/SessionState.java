package com.reflex.supervisor;

/** Lifecycle states of the supervised store session. */
public enum SessionState {

    /** No session yet, or the supervisor was shut down. */
    DISCONNECTED,

    /** First connection attempt in progress. */
    CONNECTING,

    /** Session open and the last probe succeeded. */
    CONNECTED,

    /** Session open but the last probe failed once; still usable. */
    DEGRADED,

    /** Session lost; attempts are scheduled with exponential backoff. */
    RECONNECTING,

    /** Reconnect attempts exhausted. Terminal until {@link ConnectionSupervisor#reset()}. */
    FAILED;

    /** Whether a session handle can be handed out in this state. */
    public boolean isUsable() {
        return this == CONNECTED || this == DEGRADED;
    }
}
