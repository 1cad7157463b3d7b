package com.reflex.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts {@link Event} instances to and from the document form stored in the backing store, and
 * renders canonical JSON.
 *
 * <p>Documents hold {@code createdAt} as an ISO-8601 string. Canonical JSON sorts map keys so two
 * equal states always render to the same bytes, whatever order they were built in.
 */
public final class EventSerializer {

    /** Collection that holds the persisted event log. */
    public static final String EVENTS_COLLECTION = "events";

    private static final ObjectMapper MAPPER = createMapper();
    private static final ObjectMapper CANONICAL =
            createMapper().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT =
            new TypeReference<>() {};

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Key of an event in {@link #EVENTS_COLLECTION}. The sequence is zero-padded so lexical key
     * order matches numeric order within a source.
     */
    public static String storeKey(String source, long sequence) {
        return "%s:%020d".formatted(source, sequence);
    }

    /** Converts an event to its store document. */
    public static Map<String, Object> toDocument(Event event) {
        try {
            return MAPPER.convertValue(event, DOCUMENT);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException("Failed to convert event: " + event.id(), e);
        }
    }

    /**
     * Converts a store document back to an event.
     *
     * @throws EventSerializationException if the document is not a well-formed event
     */
    public static Event fromDocument(Map<String, Object> document) {
        try {
            return MAPPER.convertValue(document, Event.class);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException("Malformed event document: " + document.get("id"), e);
        }
    }

    /** Renders any value as JSON with map keys sorted. */
    public static String toCanonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to render canonical JSON", e);
        }
    }

    /** Thrown when an event cannot be converted to or from its stored form. */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
