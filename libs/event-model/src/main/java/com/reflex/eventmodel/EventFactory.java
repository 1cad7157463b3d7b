package com.reflex.eventmodel;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Factory methods for creating {@link Event} instances.
 *
 * <p>Encapsulates id generation and timestamping so the mesh only decides type, source, sequence
 * and payload.
 */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /** Creates an event with a random UUID, stamped with the current system time. */
    public static Event create(String type, String source, long sequence, Map<String, Object> payload) {
        return create(type, source, sequence, payload, Clock.systemUTC());
    }

    /** Creates an event with a random UUID, stamped from the given clock. */
    public static Event create(
            String type, String source, long sequence, Map<String, Object> payload, Clock clock) {
        return new Event(
                UUID.randomUUID().toString(), type, source, sequence, payload, Instant.now(clock));
    }
}
