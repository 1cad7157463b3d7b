package com.reflex.eventmodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validation rules for one event type.
 *
 * @param type the event type this schema applies to
 * @param requiredFields fields that must be present with a non-null value, in declaration order
 * @param fieldTypes optional type constraints, checked for every field present in the payload
 *     (required or not)
 */
public record ValidationSchema(
        String type, List<String> requiredFields, Map<String, FieldType> fieldTypes) {

    public ValidationSchema {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        fieldTypes =
                fieldTypes == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
    }

    /** Schema with required fields only and no type constraints. */
    public static ValidationSchema requiring(String type, String... requiredFields) {
        return new ValidationSchema(type, List.of(requiredFields), Map.of());
    }

    /** Returns a copy of this schema with one more type constraint. */
    public ValidationSchema withFieldType(String field, FieldType fieldType) {
        Map<String, FieldType> types = new LinkedHashMap<>(fieldTypes);
        types.put(field, fieldType);
        return new ValidationSchema(type, requiredFields, types);
    }
}
