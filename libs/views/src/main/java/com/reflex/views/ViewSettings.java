package com.reflex.views;

import java.time.Duration;

/**
 * Tuning of the view manager. Non-positive values fall back to the defaults.
 *
 * @param sequenceGapTimeout how long a source may stay out of order before the view goes stale
 *     (default 30s)
 * @param bufferCapacity out-of-order events held per source and view (default 1000)
 */
public record ViewSettings(Duration sequenceGapTimeout, int bufferCapacity) {

    public static final Duration DEFAULT_SEQUENCE_GAP_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_BUFFER_CAPACITY = 1000;

    public ViewSettings {
        if (sequenceGapTimeout == null || sequenceGapTimeout.isNegative() || sequenceGapTimeout.isZero()) {
            sequenceGapTimeout = DEFAULT_SEQUENCE_GAP_TIMEOUT;
        }
        if (bufferCapacity <= 0) {
            bufferCapacity = DEFAULT_BUFFER_CAPACITY;
        }
    }

    public static ViewSettings defaults() {
        return new ViewSettings(null, 0);
    }
}
