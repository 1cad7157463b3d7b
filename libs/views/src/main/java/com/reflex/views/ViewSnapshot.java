package com.reflex.views;

import com.reflex.eventmodel.EventSerializer;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Consistent, immutable picture of a view between two applied events.
 *
 * @param name view name
 * @param schemaVersion version of the state layout
 * @param status lifecycle status at the time of the snapshot
 * @param staleReason why the view went stale, {@code null} unless {@link ViewStatus#STALE}
 * @param state the folded state
 * @param appliedThrough highest applied sequence per source
 * @param pending buffered out-of-order events per source
 * @param updatedAt when the state last changed, {@code null} if never
 */
public record ViewSnapshot(
        String name,
        int schemaVersion,
        ViewStatus status,
        String staleReason,
        Map<String, Object> state,
        Map<String, Long> appliedThrough,
        Map<String, Integer> pending,
        Instant updatedAt) {

    public ViewSnapshot {
        state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
        appliedThrough = Collections.unmodifiableMap(new TreeMap<>(appliedThrough));
        pending = Collections.unmodifiableMap(new TreeMap<>(pending));
    }

    public boolean isStale() {
        return status == ViewStatus.STALE;
    }

    /** The state as JSON with sorted keys; equal states render to identical strings. */
    public String canonicalState() {
        return EventSerializer.toCanonicalJson(state);
    }
}
