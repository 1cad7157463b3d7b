package com.reflex.common;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of the Reflex failure taxonomy.
 *
 * <p>Every failure carries the name of the component that raised it, a human-readable message and a
 * structured context map for programmatic inspection. Constructing an exception has no side
 * effects: logging happens once, where the failure is surfaced or handled.
 *
 * <p>Unchecked on purpose: callers decide on retry policy from the concrete subtype, not from a
 * {@code throws} clause.
 */
public abstract class ReflexException extends RuntimeException {

    private final String component;
    private final Map<String, Object> context;

    protected ReflexException(String component, String message, Map<String, ?> context) {
        this(component, message, context, null);
    }

    protected ReflexException(
            String component, String message, Map<String, ?> context, Throwable cause) {
        super("[%s] %s".formatted(component, message), cause);
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component must not be null or blank");
        }
        this.component = component;
        // LinkedHashMap keeps insertion order and tolerates null values (e.g. an absent error)
        this.context =
                context == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /** Name of the component that raised the failure (e.g. "event-mesh"). */
    public String component() {
        return component;
    }

    /** Structured diagnostic context. Never null, never modifiable. */
    public Map<String, Object> context() {
        return context;
    }

    /** Whether a caller may reasonably retry the same operation unchanged. */
    public abstract boolean retryable();
}
