package com.reflex.common;

import java.util.Map;

/**
 * The backing store could not be reached: no usable session, a read or write failed, or a wait
 * for a session timed out. Generally retryable by the caller.
 */
public class ConnectionException extends ReflexException {

    public ConnectionException(String component, String message, Map<String, ?> context) {
        super(component, message, context);
    }

    public ConnectionException(
            String component, String message, Map<String, ?> context, Throwable cause) {
        super(component, message, context, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
