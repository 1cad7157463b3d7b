package com.reflex.mesh;

import com.reflex.eventmodel.Event;

/**
 * Receives events delivered by the {@link EventMesh}.
 *
 * <p>Called synchronously on the publishing thread. Events of one source arrive in sequence order.
 * A handler that throws is logged and skipped; delivery to other handlers continues.
 */
@FunctionalInterface
public interface EventHandler {

    void handle(Event event);
}
