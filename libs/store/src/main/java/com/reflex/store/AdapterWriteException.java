package com.reflex.store;

/** A document write was not acknowledged by the store. */
public class AdapterWriteException extends AdapterException {

    public AdapterWriteException(String message) {
        super(message, null);
    }

    public AdapterWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
