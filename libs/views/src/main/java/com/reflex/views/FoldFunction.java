package com.reflex.views;

import com.reflex.eventmodel.Event;
import java.util.Map;

/**
 * Folds one event into a view's state.
 *
 * <p>Must be pure: the given state is read-only, and the result is a new map. Replaying the same
 * events in the same order must produce an equal state.
 */
@FunctionalInterface
public interface FoldFunction {

    Map<String, Object> fold(Map<String, Object> state, Event event);
}
