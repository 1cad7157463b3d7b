package com.reflex.store;

/** A read or listing failed (as opposed to finding nothing). */
public class AdapterReadException extends AdapterException {

    public AdapterReadException(String message) {
        super(message, null);
    }

    public AdapterReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
