package com.reflex.eventmodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable domain event as it travels through the mesh.
 *
 * <p>{@code (source, sequence)} identifies the event's position in its source's stream and is never
 * reused once assigned. The payload keeps the producer's field order and cannot be modified.
 *
 * @param id globally unique identifier (UUID), assigned at creation
 * @param type event type, selects the validation schema (e.g. "user.action")
 * @param source producing module or partition; sequences are monotonic per source
 * @param sequence 1-based position in the source's stream
 * @param payload schema-validated field values
 * @param createdAt when the event was created
 */
public record Event(
        String id,
        String type,
        String source,
        long sequence,
        Map<String, Object> payload,
        Instant createdAt) {

    public Event {
        requireText(id, "id");
        requireText(type, "type");
        requireText(source, "source");
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1, was " + sequence);
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt must not be null");
        }
        payload =
                payload == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
