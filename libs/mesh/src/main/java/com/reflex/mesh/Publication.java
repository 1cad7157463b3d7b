package com.reflex.mesh;

import com.reflex.eventmodel.Event;

/**
 * Outcome of a caller-sequenced publish.
 *
 * @param event the stored event
 * @param duplicate true if the event was already stored at its position and was not delivered again
 */
public record Publication(Event event, boolean duplicate) {}
