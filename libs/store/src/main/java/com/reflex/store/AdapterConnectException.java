package com.reflex.store;

/** The store could not be reached or refused the credentials. */
public class AdapterConnectException extends AdapterException {

    public AdapterConnectException(String message) {
        super(message, null);
    }

    public AdapterConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
