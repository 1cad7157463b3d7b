package com.reflex.eventmodel;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of validating a payload against its schema.
 *
 * @param valid true if validation passed with no violations
 * @param violations every violation found (empty when valid)
 */
public record ValidationResult(boolean valid, List<Violation> violations) {

    /** Convenience factory for a successful validation. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Convenience factory for a failed validation. */
    public static ValidationResult fail(List<Violation> violations) {
        return new ValidationResult(false, List.copyOf(violations));
    }

    /** Fields reported as missing, in schema order. */
    public Set<String> missingFields() {
        return fieldsOf(Violation.Kind.MISSING_FIELD);
    }

    /** Fields whose value had the wrong type. */
    public Set<String> mismatchedFields() {
        return fieldsOf(Violation.Kind.TYPE_MISMATCH);
    }

    /** Violation messages, for exceptions and logs. */
    public List<String> messages() {
        return violations.stream().map(Violation::message).toList();
    }

    private Set<String> fieldsOf(Violation.Kind kind) {
        Set<String> fields = new LinkedHashSet<>();
        for (Violation v : violations) {
            if (v.kind() == kind) {
                fields.add(v.field());
            }
        }
        return fields;
    }
}
