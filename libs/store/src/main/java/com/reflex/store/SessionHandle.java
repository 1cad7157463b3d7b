package com.reflex.store;

/** Opaque token for an open store session, issued by {@link BackingStoreAdapter#connect}. */
public interface SessionHandle {

    /** Identifier of the session, for logs. */
    String id();
}
