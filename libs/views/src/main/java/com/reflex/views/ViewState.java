package com.reflex.views;

import com.reflex.common.ViewException;
import com.reflex.eventmodel.Event;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Mutable fold state of one view: the folded map, the per-source watermark and the gap buffers.
 *
 * <p>The watermark follows each source's whole stream. Events whose type the view does not fold
 * still advance it, so a view over a subset of types sees no gaps where other types were published.
 *
 * <p>Not thread-safe; the manager only touches it under the view's lock. A failed apply leaves the
 * folded state untouched.
 */
final class ViewState {

    private Map<String, Object> state = Map.of();
    private final Map<String, Long> appliedThrough = new HashMap<>();
    private final Map<String, TreeMap<Long, Event>> pending = new HashMap<>();
    private final Map<String, Instant> gapOpenedAt = new HashMap<>();
    private Instant updatedAt;

    ApplyOutcome apply(ViewDefinition view, int bufferCapacity, Event event, Instant now) {
        String source = event.source();
        long through = appliedThrough.getOrDefault(source, 0L);
        if (event.sequence() <= through) {
            return ApplyOutcome.DUPLICATE;
        }
        if (event.sequence() > through + 1) {
            return buffer(view, bufferCapacity, event, now);
        }

        fold(view, event);
        TreeMap<Long, Event> waiting = pending.get(source);
        while (waiting != null && !waiting.isEmpty()
                && waiting.firstKey() == appliedThrough.get(source) + 1) {
            fold(view, waiting.pollFirstEntry().getValue());
        }
        if (waiting == null || waiting.isEmpty()) {
            pending.remove(source);
            gapOpenedAt.remove(source);
        } else {
            // a further gap remains behind the drained run
            gapOpenedAt.put(source, now);
        }
        updatedAt = now;
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome buffer(ViewDefinition view, int bufferCapacity, Event event, Instant now) {
        TreeMap<Long, Event> waiting = pending.computeIfAbsent(event.source(), s -> new TreeMap<>());
        if (waiting.containsKey(event.sequence())) {
            return ApplyOutcome.DUPLICATE;
        }
        if (waiting.size() >= bufferCapacity) {
            throw new ViewException(ViewException.Kind.BUFFER_OVERFLOW, view.name(),
                    "more than %d events from '%s' waiting for sequence %d"
                            .formatted(bufferCapacity, event.source(), appliedThrough.getOrDefault(event.source(), 0L) + 1),
                    Map.of("source", event.source(), "buffer_capacity", bufferCapacity));
        }
        waiting.put(event.sequence(), event);
        gapOpenedAt.putIfAbsent(event.source(), now);
        return ApplyOutcome.BUFFERED;
    }

    private void fold(ViewDefinition view, Event event) {
        if (!view.appliesTo(event.type())) {
            appliedThrough.put(event.source(), event.sequence());
            return;
        }
        Map<String, Object> next;
        try {
            next = view.fold().fold(Collections.unmodifiableMap(state), event);
        } catch (RuntimeException e) {
            throw new ViewException(ViewException.Kind.FOLD_FAILED, view.name(),
                    "fold failed on %s %s:%d".formatted(event.type(), event.source(), event.sequence()),
                    Map.of("event_id", event.id(), "source", event.source(), "sequence", event.sequence()), e);
        }
        if (next == null) {
            throw new ViewException(ViewException.Kind.FOLD_FAILED, view.name(),
                    "fold returned no state for %s:%d".formatted(event.source(), event.sequence()),
                    Map.of("event_id", event.id()));
        }
        state = next;
        appliedThrough.put(event.source(), event.sequence());
    }

    /** A source whose gap has been open for at least {@code timeout}, if any. */
    Optional<String> overdueSource(Instant now, Duration timeout) {
        return gapOpenedAt.entrySet().stream()
                .filter(e -> !e.getValue().plus(timeout).isAfter(now))
                .map(Map.Entry::getKey)
                .sorted()
                .findFirst();
    }

    /** Restarts every open gap's clock, used when a rebuilt state goes live. */
    void restartGapClocks(Instant now) {
        gapOpenedAt.replaceAll((source, opened) -> now);
    }

    void clearPending() {
        pending.clear();
        gapOpenedAt.clear();
    }

    long waitingFor(String source) {
        return appliedThrough.getOrDefault(source, 0L) + 1;
    }

    ViewSnapshot snapshot(ViewDefinition view, ViewStatus status, String staleReason) {
        Map<String, Integer> pendingCounts = new HashMap<>();
        pending.forEach((source, events) -> pendingCounts.put(source, events.size()));
        return new ViewSnapshot(view.name(), view.schemaVersion(), status, staleReason, state,
                appliedThrough, pendingCounts, updatedAt);
    }
}
