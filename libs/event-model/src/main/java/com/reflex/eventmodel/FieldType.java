package com.reflex.eventmodel;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/** Value type constraint a schema can place on a payload field. */
public enum FieldType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY;

    /** Whether a non-null payload value satisfies this type. */
    public boolean matches(Object value) {
        return switch (this) {
            case STRING -> value instanceof CharSequence;
            case INTEGER -> value instanceof Integer
                    || value instanceof Long
                    || value instanceof Short
                    || value instanceof Byte
                    || value instanceof BigInteger;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case OBJECT -> value instanceof Map;
            case ARRAY -> value instanceof Collection || value.getClass().isArray();
        };
    }
}
