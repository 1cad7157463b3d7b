package com.reflex.mesh;

/**
 * A handler registered for one topic.
 *
 * @param topic an event type, or {@link EventMesh#WILDCARD} for every type
 * @param handler the receiving handler
 */
public record Subscription(String topic, EventHandler handler) {

    public Subscription {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
    }

    /** Whether this subscription receives events of the given type. */
    public boolean matches(String eventType) {
        return topic.equals(EventMesh.WILDCARD) || topic.equals(eventType);
    }
}
