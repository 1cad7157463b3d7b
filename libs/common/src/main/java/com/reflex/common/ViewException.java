package com.reflex.common;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A materialized view could not be kept up to date. Except for {@link Kind#UNKNOWN_VIEW}, the view
 * has been marked stale and needs a rebuild. Never fatal to the process.
 */
public class ViewException extends ReflexException {

    /** What went wrong with the view. */
    public enum Kind {
        /** A sequence gap was not closed within the configured timeout. */
        SEQUENCE_GAP,
        /** Too many out-of-order events were waiting for a missing predecessor. */
        BUFFER_OVERFLOW,
        /** The view's fold function threw. */
        FOLD_FAILED,
        /** Replaying the event log failed. */
        REBUILD_FAILED,
        /** Replaying the event log did not finish in time. */
        REBUILD_TIMEOUT,
        /** No view is registered under the requested name. */
        UNKNOWN_VIEW
    }

    private final Kind kind;
    private final String viewName;

    public ViewException(Kind kind, String viewName, String message, Map<String, ?> context) {
        this(kind, viewName, message, context, null);
    }

    public ViewException(
            Kind kind, String viewName, String message, Map<String, ?> context, Throwable cause) {
        super("view-manager", message, withView(kind, viewName, context), cause);
        this.kind = kind;
        this.viewName = viewName;
    }

    private static Map<String, Object> withView(Kind kind, String viewName, Map<String, ?> context) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("view_name", viewName);
        merged.put("kind", kind.name());
        if (context != null) {
            merged.putAll(context);
        }
        return merged;
    }

    public Kind kind() {
        return kind;
    }

    public String viewName() {
        return viewName;
    }

    /** Rebuilding can clear every kind except an unknown view. */
    @Override
    public boolean retryable() {
        return kind != Kind.UNKNOWN_VIEW;
    }
}
