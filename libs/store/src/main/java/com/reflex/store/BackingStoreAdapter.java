package com.reflex.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Primitives of the remote document + publish/subscribe store the mesh runs on.
 *
 * <p>Implementations wrap a concrete store client. They are not expected to retry: the connection
 * supervisor owns reconnection and the mesh reports failures to its callers. Documents are plain
 * string-keyed maps of JSON-compatible values.
 */
public interface BackingStoreAdapter {

    /**
     * Authenticates and opens a session.
     *
     * @throws AdapterConnectException if the store cannot be reached or rejects the credentials
     */
    SessionHandle connect(Credentials credentials);

    /** Cheap liveness check of an open session. Returns false rather than throwing when unhealthy. */
    boolean probe(SessionHandle session);

    /**
     * Writes (creates or replaces) a document. Writing to a collection notifies subscribers of the
     * topic of the same name.
     *
     * @throws AdapterWriteException if the write was not acknowledged
     */
    void write(SessionHandle session, String collection, String key, Map<String, Object> document);

    /**
     * Reads one document.
     *
     * @return the document, or empty if no document exists under the key
     * @throws AdapterReadException if the read itself failed
     */
    Optional<Map<String, Object>> read(SessionHandle session, String collection, String key);

    /**
     * Lists every document of a collection in ascending key order.
     *
     * @throws AdapterReadException if the listing failed
     */
    List<Map<String, Object>> list(SessionHandle session, String collection);

    /**
     * Subscribes to documents written to a topic. The callback may run on a store-owned thread.
     *
     * @return a handle that cancels the subscription when closed
     */
    TopicSubscription subscribeTopic(
            SessionHandle session, String topic, Consumer<Map<String, Object>> callback);

    /** Releases a session. Must tolerate sessions that are already dead. */
    default void disconnect(SessionHandle session) {
        // nothing to release by default
    }
}
