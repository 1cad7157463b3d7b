package com.reflex.views;

import java.util.LinkedHashMap;
import java.util.Map;

/** Folds that views can be declared with from configuration. */
public final class Folds {

    private Folds() {
        // utility class
    }

    /** Counts events per event type: {@code {"user.action": 3, ...}}. */
    public static FoldFunction countByType() {
        return (state, event) -> {
            Map<String, Object> next = new LinkedHashMap<>(state);
            next.merge(event.type(), 1L, (a, b) -> ((Number) a).longValue() + ((Number) b).longValue());
            return next;
        };
    }

    /**
     * Keeps the latest payload per value of {@code keyField}. Events without the field leave the
     * state unchanged.
     */
    public static FoldFunction latestBy(String keyField) {
        if (keyField == null || keyField.isBlank()) {
            throw new IllegalArgumentException("keyField must not be null or blank");
        }
        return (state, event) -> {
            Object key = event.payload().get(keyField);
            if (key == null) {
                return state;
            }
            Map<String, Object> next = new LinkedHashMap<>(state);
            next.put(String.valueOf(key), event.payload());
            return next;
        };
    }

    /**
     * Resolves a fold by its configuration name.
     *
     * @param name {@code count-by-type} or {@code latest-by}
     * @param keyField key field for {@code latest-by}, ignored otherwise
     */
    public static FoldFunction named(String name, String keyField) {
        if (name == null) {
            throw new IllegalArgumentException("fold name must not be null");
        }
        return switch (name) {
            case "count-by-type" -> countByType();
            case "latest-by" -> latestBy(keyField);
            default -> throw new IllegalArgumentException(
                    "unknown fold '%s', expected count-by-type or latest-by".formatted(name));
        };
    }
}
