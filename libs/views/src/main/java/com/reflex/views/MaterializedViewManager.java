package com.reflex.views;

import com.reflex.common.ConnectionException;
import com.reflex.common.ViewException;
import com.reflex.eventmodel.Event;
import com.reflex.eventmodel.EventSerializer;
import com.reflex.mesh.EventMesh;
import com.reflex.mesh.Subscription;
import com.reflex.observability.FailureReporter;
import com.reflex.observability.MetricFactory;
import com.reflex.observability.SpanHelper;
import com.reflex.store.AdapterException;
import com.reflex.store.SessionHandle;
import com.reflex.supervisor.ConnectionSupervisor;
import io.micrometer.core.instrument.Timer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps named views folded over the event stream and rebuilds them from the persisted log.
 *
 * <p>Each view has its own lock: applies to one view are serialized and a rebuild holds the lock
 * for its whole run. Readers never lock; they get the volatile snapshot published after every
 * change, so a half-applied event is never visible. A failure in one view marks that view stale and
 * leaves the others alone.
 */
public final class MaterializedViewManager implements AutoCloseable {

    /** Component name used in failures, logs and metrics. */
    public static final String COMPONENT = "view-manager";

    static final Comparator<Event> REPLAY_ORDER =
            Comparator.comparing(Event::createdAt)
                    .thenComparing(Event::source)
                    .thenComparingLong(Event::sequence);

    private static final Logger log = LoggerFactory.getLogger(MaterializedViewManager.class);

    private final ConnectionSupervisor supervisor;
    private final ViewSettings settings;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final FailureReporter failures;
    private final Clock clock;
    private final Map<String, ViewSlot> views = new ConcurrentHashMap<>();
    private final ScheduledExecutorService sweeper;
    private volatile boolean sweeping;

    /** One registered view and everything guarded by its lock. */
    private static final class ViewSlot {
        final ViewDefinition definition;
        final ReentrantLock lock = new ReentrantLock();
        // guarded by lock
        ViewState current = new ViewState();
        ViewStatus status = ViewStatus.ACTIVE;
        String staleReason;
        volatile ViewSnapshot snapshot;

        ViewSlot(ViewDefinition definition) {
            this.definition = definition;
            publish();
        }

        // caller holds lock
        void publish() {
            snapshot = current.snapshot(definition, status, staleReason);
        }
    }

    public MaterializedViewManager(
            ConnectionSupervisor supervisor, ViewSettings settings, MetricFactory metrics, SpanHelper spans) {
        this(supervisor, settings, metrics, spans, Clock.systemUTC());
    }

    public MaterializedViewManager(
            ConnectionSupervisor supervisor,
            ViewSettings settings,
            MetricFactory metrics,
            SpanHelper spans,
            Clock clock) {
        if (supervisor == null || settings == null) {
            throw new IllegalArgumentException("supervisor and settings are required");
        }
        if (metrics == null || spans == null || clock == null) {
            throw new IllegalArgumentException("metrics, spans and clock are required");
        }
        this.supervisor = supervisor;
        this.settings = settings;
        this.metrics = metrics.forComponent(COMPONENT);
        this.spans = spans;
        this.failures = new FailureReporter(this.metrics);
        this.clock = clock;
        this.sweeper =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "reflex-view-sweeper");
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    /** Registers a view. It starts empty and active. */
    public void register(ViewDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition must not be null");
        }
        if (views.putIfAbsent(definition.name(), new ViewSlot(definition)) != null) {
            throw new IllegalArgumentException("view '" + definition.name() + "' is already registered");
        }
        log.info("Registered view '{}' v{} on topics {}",
                definition.name(), definition.schemaVersion(), definition.topics());
    }

    /** Names of the registered views. */
    public Set<String> viewNames() {
        return Set.copyOf(views.keySet());
    }

    /**
     * Folds one event into a view, in per-source sequence order.
     *
     * @return what happened to the event
     * @throws ViewException if the view is unknown, or the event made the view stale (gap timeout,
     *     buffer overflow, failing fold)
     */
    public ApplyOutcome apply(String viewName, Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        ViewSlot slot = require(viewName);
        slot.lock.lock();
        try {
            if (slot.status == ViewStatus.STALE) {
                count(slot, ApplyOutcome.IGNORED_STALE);
                return ApplyOutcome.IGNORED_STALE;
            }
            Instant now = Instant.now(clock);
            Optional<String> overdue = slot.current.overdueSource(now, settings.sequenceGapTimeout());
            if (overdue.isPresent()) {
                throw failures.report("apply", gapExpired(slot, overdue.get()));
            }
            ApplyOutcome outcome;
            try {
                outcome = slot.current.apply(slot.definition, settings.bufferCapacity(), event, now);
            } catch (ViewException e) {
                markStale(slot, e);
                throw failures.report("apply", e);
            }
            if (outcome != ApplyOutcome.DUPLICATE) {
                slot.publish();
            }
            count(slot, outcome);
            return outcome;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Current state of a view. Never blocks, never shows a partially applied event.
     *
     * @throws ViewException of kind {@code UNKNOWN_VIEW} if no such view is registered
     */
    public ViewSnapshot getViewState(String viewName) {
        return require(viewName).snapshot;
    }

    /**
     * Rebuilds a view from the persisted event log and makes the result live atomically. Applies to
     * the view wait until the rebuild ends; readers see the previous state until then.
     *
     * @return the rebuilt snapshot
     * @throws ViewException of kind {@code REBUILD_TIMEOUT} or {@code REBUILD_FAILED}; the view is
     *     then stale
     */
    public ViewSnapshot rebuild(String viewName, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        ViewSlot slot = require(viewName);
        return spans.inSpan("views.rebuild", Map.of("reflex.view.name", viewName), () -> {
            Timer.Sample sample = Timer.start(metrics.registry());
            try {
                return rebuildLocked(slot, timeout);
            } finally {
                sample.stop(metrics.timer("reflex.views.rebuild.duration", "Time to replay a view",
                        "view", viewName));
            }
        });
    }

    /**
     * Feeds every event delivered by the mesh to every view. Views fold the types in their topics and
     * only advance their watermark for the others.
     *
     * @return the mesh subscription, to detach with {@link EventMesh#unsubscribe(Subscription)}
     */
    public Subscription attach(EventMesh mesh) {
        Subscription subscription = mesh.subscribe(EventMesh.WILDCARD, this::route);
        log.info("Attached {} view(s) to the event mesh", views.size());
        return subscription;
    }

    /**
     * Marks stale every view with a sequence gap open longer than the timeout. Runs on the sweeper;
     * views busy rebuilding are checked on the next sweep.
     *
     * @return names of the views that went stale
     */
    public List<String> expireOverdueGaps() {
        List<String> expired = new ArrayList<>();
        Instant now = Instant.now(clock);
        for (ViewSlot slot : views.values()) {
            if (!slot.lock.tryLock()) {
                continue;
            }
            try {
                if (slot.status != ViewStatus.ACTIVE) {
                    continue;
                }
                Optional<String> overdue = slot.current.overdueSource(now, settings.sequenceGapTimeout());
                if (overdue.isPresent()) {
                    failures.report("gap timeout", gapExpired(slot, overdue.get()));
                    expired.add(slot.definition.name());
                }
            } finally {
                slot.lock.unlock();
            }
        }
        return expired;
    }

    /** Starts the background gap sweeper. Idempotent. */
    public synchronized void start() {
        if (sweeping) {
            return;
        }
        long period = Math.max(10, Math.min(1000, settings.sequenceGapTimeout().toMillis() / 4));
        sweeper.scheduleAtFixedRate(this::sweepSafely, period, period, TimeUnit.MILLISECONDS);
        sweeping = true;
        log.info("Sequence gap sweeper running every {} ms", period);
    }

    @Override
    public void close() {
        sweeper.shutdownNow();
    }

    // ---- internals ----

    private void route(Event event) {
        for (ViewSlot slot : views.values()) {
            try {
                apply(slot.definition.name(), event);
            } catch (ViewException e) {
                log.debug("View '{}' skipped {} {}:{}: {}", slot.definition.name(),
                        event.type(), event.source(), event.sequence(), e.kind());
            } catch (RuntimeException e) {
                failures.reportIsolated(COMPONENT, "routing to view " + slot.definition.name(), e);
            }
        }
    }

    private ViewSnapshot rebuildLocked(ViewSlot slot, Duration timeout) {
        String name = slot.definition.name();
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            if (!slot.lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                ViewException timedOut = rebuildTimeout(slot, timeout, "waiting for the view lock");
                throw failures.report("rebuild", timedOut);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failures.report("rebuild", new ViewException(ViewException.Kind.REBUILD_FAILED, name,
                    "interrupted waiting for the view lock", Map.of(), e));
        }
        try {
            slot.status = ViewStatus.REBUILDING;
            slot.publish();
            log.info("Rebuilding view '{}'", name);

            List<Event> events = loadEvents(slot, remaining(deadline));
            ViewState working = new ViewState();
            for (Event event : events) {
                if (System.nanoTime() - deadline > 0) {
                    throw rebuildTimeout(slot, timeout, "replaying %d events".formatted(events.size()));
                }
                working.apply(slot.definition, settings.bufferCapacity(), event, Instant.now(clock));
            }

            working.restartGapClocks(Instant.now(clock));
            slot.current = working;
            slot.status = ViewStatus.ACTIVE;
            slot.staleReason = null;
            slot.publish();
            log.info("Rebuilt view '{}' from {} events", name, events.size());
            return slot.snapshot;
        } catch (ViewException e) {
            ViewException failure = e.kind() == ViewException.Kind.REBUILD_TIMEOUT
                            || e.kind() == ViewException.Kind.REBUILD_FAILED
                    ? e
                    : new ViewException(ViewException.Kind.REBUILD_FAILED, name,
                            "replay failed: " + e.getMessage(), e.context(), e);
            markStale(slot, failure);
            throw failures.report("rebuild", failure);
        } catch (RuntimeException e) {
            ViewException failure = new ViewException(ViewException.Kind.REBUILD_FAILED, name,
                    "rebuild failed: " + e.getMessage(), Map.of(), e);
            markStale(slot, failure);
            throw failures.report("rebuild", failure);
        } finally {
            slot.lock.unlock();
        }
    }

    private List<Event> loadEvents(ViewSlot slot, Duration budget) {
        String name = slot.definition.name();
        List<Map<String, Object>> documents;
        try {
            SessionHandle session = supervisor.acquireSession(budget);
            documents = supervisor.adapter().list(session, EventSerializer.EVENTS_COLLECTION);
        } catch (ConnectionException | AdapterException e) {
            throw new ViewException(ViewException.Kind.REBUILD_FAILED, name,
                    "event log unavailable: " + e.getMessage(), Map.of(), e);
        }
        List<Event> events = new ArrayList<>(documents.size());
        for (Map<String, Object> document : documents) {
            events.add(EventSerializer.fromDocument(document));
        }
        events.sort(REPLAY_ORDER);
        return events;
    }

    private ViewException gapExpired(ViewSlot slot, String source) {
        long missing = slot.current.waitingFor(source);
        ViewException failure = new ViewException(ViewException.Kind.SEQUENCE_GAP, slot.definition.name(),
                "sequence %d of '%s' did not arrive within %d ms"
                        .formatted(missing, source, settings.sequenceGapTimeout().toMillis()),
                Map.of("source", source, "missing_sequence", missing));
        markStale(slot, failure);
        return failure;
    }

    private ViewException rebuildTimeout(ViewSlot slot, Duration timeout, String phase) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("timeout_ms", timeout.toMillis());
        context.put("phase", phase);
        return new ViewException(ViewException.Kind.REBUILD_TIMEOUT, slot.definition.name(),
                "rebuild did not finish within %d ms".formatted(timeout.toMillis()), context);
    }

    // caller holds lock, except for a rebuild that timed out waiting for it
    private void markStale(ViewSlot slot, ViewException cause) {
        slot.status = ViewStatus.STALE;
        slot.staleReason = cause.kind() + ": " + cause.getMessage();
        slot.current.clearPending();
        slot.publish();
        metrics.counter("reflex.views.stale", "Views marked stale", "view", slot.definition.name(),
                "kind", cause.kind().name()).increment();
    }

    private void count(ViewSlot slot, ApplyOutcome outcome) {
        metrics.counter("reflex.views.applies", "Events offered to views", "view", slot.definition.name(),
                "outcome", outcome.name()).increment();
    }

    private ViewSlot require(String viewName) {
        ViewSlot slot = viewName == null ? null : views.get(viewName);
        if (slot == null) {
            throw new ViewException(ViewException.Kind.UNKNOWN_VIEW, String.valueOf(viewName),
                    "no view named '%s'".formatted(viewName), Map.of("known_views", views.keySet().toString()));
        }
        return slot;
    }

    private void sweepSafely() {
        try {
            expireOverdueGaps();
        } catch (RuntimeException e) {
            failures.reportIsolated(COMPONENT, "gap sweep", e);
        }
    }

    private static Duration remaining(long deadline) {
        long nanos = deadline - System.nanoTime();
        return Duration.ofNanos(Math.max(1, nanos));
    }
}
