package com.reflex.observability;

/** Health of a single component or of the process as a whole. */
public enum HealthStatus {

    /** Fully operational. */
    HEALTHY,

    /** Impaired but still serving, or recovering on its own. */
    DEGRADED,

    /** Not serving; needs intervention or is still waiting for its first connection. */
    UNHEALTHY;

    /** The worse of two statuses, used to fold component results into an overall status. */
    public HealthStatus worst(HealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
