package com.reflex.common;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An event payload failed its schema, or no schema exists for its type.
 *
 * <p>Carries the complete list of violations found, never just the first one, plus the offending
 * field names split into missing and mistyped fields. Not retryable without correcting the payload.
 */
public class EventValidationException extends ReflexException {

    private final String eventType;
    private final List<String> violations;
    private final List<String> missingFields;
    private final List<String> mismatchedFields;

    public EventValidationException(
            String component, String eventType, List<String> violations, Map<String, ?> context) {
        this(component, eventType, violations, List.of(), List.of(), context);
    }

    /**
     * @param violations human-readable violation messages
     * @param missingFields required fields that were absent or null
     * @param mismatchedFields fields whose value had the wrong type
     */
    public EventValidationException(
            String component,
            String eventType,
            List<String> violations,
            List<String> missingFields,
            List<String> mismatchedFields,
            Map<String, ?> context) {
        super(
                component,
                "Event of type '%s' failed validation with %d violation(s): %s"
                        .formatted(eventType, violations.size(), String.join("; ", violations)),
                withViolations(eventType, violations, missingFields, mismatchedFields, context));
        this.eventType = eventType;
        this.violations = List.copyOf(violations);
        this.missingFields = List.copyOf(missingFields);
        this.mismatchedFields = List.copyOf(mismatchedFields);
    }

    private static Map<String, Object> withViolations(
            String eventType,
            List<String> violations,
            List<String> missingFields,
            List<String> mismatchedFields,
            Map<String, ?> context) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (context != null) {
            merged.putAll(context);
        }
        merged.put("event_type", eventType);
        merged.put("violations", List.copyOf(violations));
        merged.put("missing_fields", List.copyOf(missingFields));
        merged.put("mismatched_fields", List.copyOf(mismatchedFields));
        return merged;
    }

    public String eventType() {
        return eventType;
    }

    /** Human-readable violation messages, one per problem found. */
    public List<String> violations() {
        return violations;
    }

    /** Required fields that were absent or null, in schema order. */
    public List<String> missingFields() {
        return missingFields;
    }

    /** Fields present with a value of the wrong type. */
    public List<String> mismatchedFields() {
        return mismatchedFields;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
