package com.reflex.eventmodel;

/**
 * One problem found while validating a payload.
 *
 * @param field the offending field, or {@code null} for a problem with the event type itself
 * @param kind category of the problem
 * @param message human-readable description
 */
public record Violation(String field, Kind kind, String message) {

    /** Category of a validation problem. */
    public enum Kind {
        MISSING_FIELD,
        TYPE_MISMATCH,
        UNKNOWN_TYPE
    }

    static Violation missing(String field) {
        return new Violation(field, Kind.MISSING_FIELD, field + ": missing required field");
    }

    static Violation mismatch(String field, FieldType expected, Object actual) {
        return new Violation(
                field,
                Kind.TYPE_MISMATCH,
                "%s: expected %s but was %s".formatted(field, expected, actual.getClass().getSimpleName()));
    }

    static Violation unknownType(String type) {
        return new Violation(null, Kind.UNKNOWN_TYPE, "no schema registered for type '" + type + "'");
    }

    @Override
    public String toString() {
        return message;
    }
}
