package com.reflex.eventmodel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Validates event payloads against a {@link ValidationSchema}.
 *
 * <p>Reports every violation at once: each missing required field and each type mismatch, never
 * only the first.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    /**
     * Validates a payload.
     *
     * <p>A required field is missing when the key is absent or maps to {@code null}. Type constraints
     * apply to every non-null field present in the payload.
     *
     * @param schema the schema for the payload's event type
     * @param payload the payload to check, {@code null} is treated as empty
     * @return a {@link ValidationResult} with every violation found
     */
    public static ValidationResult validate(ValidationSchema schema, Map<String, Object> payload) {
        Map<String, Object> fields = payload == null ? Map.of() : payload;
        List<Violation> violations = new ArrayList<>();

        for (String required : schema.requiredFields()) {
            if (fields.get(required) == null) {
                violations.add(Violation.missing(required));
            }
        }
        for (Map.Entry<String, FieldType> constraint : schema.fieldTypes().entrySet()) {
            Object value = fields.get(constraint.getKey());
            if (value != null && !constraint.getValue().matches(value)) {
                violations.add(Violation.mismatch(constraint.getKey(), constraint.getValue(), value));
            }
        }

        return violations.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(violations);
    }

    /** Result for an event type that has no schema. */
    static ValidationResult unknownType(String type) {
        return ValidationResult.fail(List.of(Violation.unknownType(type)));
    }
}
