package com.reflex.mesh;

import java.time.Duration;

/**
 * Tuning of the event mesh.
 *
 * @param connectTimeout how long a publish waits for a usable session (default 10s)
 * @param sequenceMode who assigns sequences (default {@link SequenceMode#AUTO})
 */
public record MeshSettings(Duration connectTimeout, SequenceMode sequenceMode) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public MeshSettings {
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        }
        if (sequenceMode == null) {
            sequenceMode = SequenceMode.AUTO;
        }
    }

    public static MeshSettings defaults() {
        return new MeshSettings(null, null);
    }
}
