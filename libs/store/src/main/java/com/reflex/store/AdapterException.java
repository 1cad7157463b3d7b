package com.reflex.store;

/** Failure reported by a {@link BackingStoreAdapter}. */
public abstract class AdapterException extends RuntimeException {

    protected AdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}
