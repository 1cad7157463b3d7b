package com.reflex.mesh;

import com.reflex.common.ConnectionException;
import com.reflex.common.EventValidationException;
import com.reflex.eventmodel.Event;
import com.reflex.eventmodel.EventFactory;
import com.reflex.eventmodel.EventSerializer;
import com.reflex.eventmodel.EventSerializer.EventSerializationException;
import com.reflex.eventmodel.SchemaRegistry;
import com.reflex.eventmodel.ValidationResult;
import com.reflex.observability.FailureReporter;
import com.reflex.observability.MetricFactory;
import com.reflex.observability.SpanHelper;
import com.reflex.store.AdapterException;
import com.reflex.store.BackingStoreAdapter;
import com.reflex.store.SessionHandle;
import com.reflex.store.TopicSubscription;
import com.reflex.supervisor.ConnectionSupervisor;
import io.opentelemetry.api.trace.SpanKind;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for every event: validates, sequences, persists, then fans out to local subscribers.
 *
 * <p>Publishes for one source are serialized end to end under a per-source lock, so subscribers see
 * each source's events in sequence order. Different sources publish concurrently. A sequence number
 * is consumed only when the store acknowledged the write.
 *
 * <p>The mesh never retries: a missing session or failed write surfaces as {@link
 * ConnectionException}, a bad payload as {@link EventValidationException}.
 */
public final class EventMesh {

    /** Component name used in failures, logs and metrics. */
    public static final String COMPONENT = "event-mesh";

    /** Topic that matches every event type. */
    public static final String WILDCARD = "*";

    static final int OWN_EVENT_MEMORY = 10_000;

    private static final Logger log = LoggerFactory.getLogger(EventMesh.class);

    private final ConnectionSupervisor supervisor;
    private final BackingStoreAdapter adapter;
    private final SchemaRegistry schemas;
    private final MeshSettings settings;
    private final Clock clock;
    private final MetricFactory metrics;
    private final SpanHelper spans;
    private final FailureReporter failures;

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final Map<String, SourceStream> sources = new ConcurrentHashMap<>();
    private final Set<String> ownEventIds =
            Collections.newSetFromMap(
                    Collections.synchronizedMap(
                            new LinkedHashMap<String, Boolean>() {
                                @Override
                                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                                    return size() > OWN_EVENT_MEMORY;
                                }
                            }));

    /** Per-source publish lock and highest issued sequence. */
    private static final class SourceStream {
        final ReentrantLock lock = new ReentrantLock();
        // written under lock, read without it
        volatile long highest;
        // guarded by lock
        boolean seeded;
    }

    public EventMesh(
            ConnectionSupervisor supervisor,
            SchemaRegistry schemas,
            MeshSettings settings,
            MetricFactory metrics,
            SpanHelper spans) {
        this(supervisor, schemas, settings, metrics, spans, Clock.systemUTC());
    }

    public EventMesh(
            ConnectionSupervisor supervisor,
            SchemaRegistry schemas,
            MeshSettings settings,
            MetricFactory metrics,
            SpanHelper spans,
            Clock clock) {
        if (supervisor == null || schemas == null || settings == null) {
            throw new IllegalArgumentException("supervisor, schemas and settings are required");
        }
        if (metrics == null || spans == null || clock == null) {
            throw new IllegalArgumentException("metrics, spans and clock are required");
        }
        this.supervisor = supervisor;
        this.adapter = supervisor.adapter();
        this.schemas = schemas;
        this.settings = settings;
        this.clock = clock;
        this.metrics = metrics.forComponent(COMPONENT);
        this.spans = spans;
        this.failures = new FailureReporter(this.metrics);
        log.info("Event mesh ready: mode={}, schemas={}", settings.sequenceMode(), schemas.types());
    }

    /**
     * Publishes with a mesh-assigned sequence ({@link SequenceMode#AUTO}).
     *
     * @return the stored event, carrying its id, sequence and creation time
     * @throws EventValidationException if the payload violates its schema or the type is unknown
     * @throws ConnectionException if no session is available or the write failed
     * @throws IllegalStateException if this mesh runs in {@link SequenceMode#CALLER}
     */
    public Event publish(String type, String source, Map<String, Object> payload) {
        requireMode(SequenceMode.AUTO);
        return traced(type, source, () -> publishAuto(type, source, payload));
    }

    /**
     * Publishes with a caller-supplied sequence ({@link SequenceMode#CALLER}). If an event is already
     * stored at {@code (source, sequence)} it is returned unchanged and not delivered again. A new
     * sequence must be above the highest one published or persisted for the source.
     *
     * @throws EventValidationException if the payload violates its schema or the type is unknown
     * @throws IllegalArgumentException if the sequence is below 1, or not stored and not above the
     *     source's highest sequence
     * @throws ConnectionException if no session is available, or the read or write failed
     * @throws IllegalStateException if this mesh runs in {@link SequenceMode#AUTO}
     */
    public Event publish(String type, String source, long sequence, Map<String, Object> payload) {
        return publishSequenced(type, source, sequence, payload).event();
    }

    /**
     * Same as {@link #publish(String, String, long, Map)}, but also tells whether the event was newly
     * stored or answered from the store.
     */
    public Publication publishSequenced(String type, String source, long sequence, Map<String, Object> payload) {
        requireMode(SequenceMode.CALLER);
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1, was " + sequence);
        }
        return traced(type, source, () -> publishWithSequence(type, source, sequence, payload));
    }

    /**
     * Registers a handler for an event type or {@link #WILDCARD}. Registering the same handler for the
     * same topic twice has no effect.
     */
    public synchronized Subscription subscribe(String topic, EventHandler handler) {
        Subscription subscription = new Subscription(topic, handler);
        for (Subscription existing : subscriptions) {
            if (existing.equals(subscription)) {
                return existing;
            }
        }
        subscriptions.add(subscription);
        log.debug("Subscribed {} to topic '{}'", handler, topic);
        return subscription;
    }

    /** Removes a handler. Returns false if it was not registered for the topic. */
    public synchronized boolean unsubscribe(String topic, EventHandler handler) {
        return subscriptions.remove(new Subscription(topic, handler));
    }

    /** Removes a subscription returned by {@link #subscribe(String, EventHandler)}. */
    public boolean unsubscribe(Subscription subscription) {
        return unsubscribe(subscription.topic(), subscription.handler());
    }

    /** Highest sequence issued for a source by this mesh, 0 if none yet. */
    public long highestSequence(String source) {
        SourceStream stream = sources.get(source);
        return stream == null ? 0 : stream.highest;
    }

    /**
     * Delivers events written to the store by other processes to local subscribers. Events published
     * through this mesh are recognized and not delivered a second time.
     *
     * @return the store subscription; closing it stops the bridge
     * @throws ConnectionException if no session is available
     */
    public TopicSubscription bridgeRemoteEvents() {
        SessionHandle session = acquireSession("bridge remote events", Map.of());
        try {
            TopicSubscription subscription =
                    adapter.subscribeTopic(session, EventSerializer.EVENTS_COLLECTION, this::onRemoteDocument);
            log.info("Bridging remote events from topic '{}'", EventSerializer.EVENTS_COLLECTION);
            return subscription;
        } catch (AdapterException e) {
            throw failures.report("bridge remote events",
                    new ConnectionException(COMPONENT, "subscribing to remote events failed",
                            Map.of("topic", EventSerializer.EVENTS_COLLECTION), e));
        }
    }

    public SequenceMode sequenceMode() {
        return settings.sequenceMode();
    }

    public SchemaRegistry schemas() {
        return schemas;
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    // ---- publish ----

    private Event publishAuto(String type, String source, Map<String, Object> payload) {
        validate(type, source, payload);
        SourceStream stream = sources.computeIfAbsent(source, s -> new SourceStream());
        stream.lock.lock();
        try {
            SessionHandle session = acquireSession("publish", Map.of("event_type", type, "source", source));
            seed(stream, session, source);
            Event event = EventFactory.create(type, source, stream.highest + 1, payload, clock);
            SpanHelper.annotate("reflex.event.sequence", event.sequence());
            write(session, event);
            stream.highest = event.sequence();
            metrics.counter("reflex.events.published", "Events persisted and delivered", "type", type)
                    .increment();
            deliver(event);
            return event;
        } finally {
            stream.lock.unlock();
        }
    }

    private Publication publishWithSequence(String type, String source, long sequence, Map<String, Object> payload) {
        validate(type, source, payload);
        SourceStream stream = sources.computeIfAbsent(source, s -> new SourceStream());
        stream.lock.lock();
        try {
            SpanHelper.annotate("reflex.event.sequence", sequence);
            Map<String, Object> context = Map.of("event_type", type, "source", source, "sequence", sequence);
            SessionHandle session = acquireSession("publish", context);
            Optional<Event> existing = readExisting(session, source, sequence, context);
            if (existing.isPresent()) {
                metrics.counter("reflex.events.deduplicated", "Republished events answered from the store",
                        "type", type).increment();
                log.debug("Event {}:{} already stored as {}, not delivered again",
                        source, sequence, existing.get().id());
                return new Publication(existing.get(), true);
            }
            seed(stream, session, source);
            if (sequence <= stream.highest) {
                metrics.counter("reflex.events.out_of_order", "Caller sequences at or below the source's highest",
                        "type", type).increment();
                throw new IllegalArgumentException(
                        "sequence %d of source '%s' is not above its highest published sequence %d"
                                .formatted(sequence, source, stream.highest));
            }
            Event event = EventFactory.create(type, source, sequence, payload, clock);
            write(session, event);
            stream.highest = sequence;
            metrics.counter("reflex.events.published", "Events persisted and delivered", "type", type)
                    .increment();
            deliver(event);
            return new Publication(event, false);
        } finally {
            stream.lock.unlock();
        }
    }

    private <T> T traced(String type, String source, Supplier<T> publish) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("reflex.event.type", String.valueOf(type));
        attributes.put("reflex.event.source", String.valueOf(source));
        return spans.inSpan("mesh.publish", SpanKind.PRODUCER, attributes,
                () -> metrics.timer("reflex.publish.duration", "Time to validate, persist and deliver an event")
                        .record(publish));
    }

    private void requireMode(SequenceMode expected) {
        if (settings.sequenceMode() != expected) {
            throw new IllegalStateException(
                    "mesh assigns sequences in %s mode; this publish requires %s mode"
                            .formatted(settings.sequenceMode(), expected));
        }
    }

    private void validate(String type, String source, Map<String, Object> payload) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be null or blank");
        }
        ValidationResult result = schemas.validate(type, payload == null ? Map.of() : payload);
        if (!result.valid()) {
            metrics.counter("reflex.events.rejected", "Events refused by schema validation").increment();
            throw failures.report("publish",
                    new EventValidationException(COMPONENT, type, result.messages(),
                            List.copyOf(result.missingFields()), List.copyOf(result.mismatchedFields()),
                            Map.of("source", source)));
        }
    }

    private SessionHandle acquireSession(String action, Map<String, Object> context) {
        try {
            return supervisor.acquireSession(settings.connectTimeout());
        } catch (ConnectionException e) {
            Map<String, Object> merged = new LinkedHashMap<>(e.context());
            merged.putAll(context);
            throw failures.report(action,
                    new ConnectionException(COMPONENT, "no session available: " + e.getMessage(), merged, e));
        }
    }

    private void seed(SourceStream stream, SessionHandle session, String source) {
        if (!stream.seeded) {
            stream.highest = Math.max(stream.highest, persistedHighest(session, source));
            stream.seeded = true;
        }
    }

    private long persistedHighest(SessionHandle session, String source) {
        try {
            long highest = 0;
            for (Map<String, Object> document : adapter.list(session, EventSerializer.EVENTS_COLLECTION)) {
                if (source.equals(document.get("source")) && document.get("sequence") instanceof Number n) {
                    highest = Math.max(highest, n.longValue());
                }
            }
            if (highest > 0) {
                log.info("Source '{}' resumes after persisted sequence {}", source, highest);
            }
            return highest;
        } catch (AdapterException e) {
            throw failures.report("publish",
                    new ConnectionException(COMPONENT, "reading the persisted sequence failed",
                            Map.of("source", source), e));
        }
    }

    private Optional<Event> readExisting(
            SessionHandle session, String source, long sequence, Map<String, Object> context) {
        try {
            return adapter.read(session, EventSerializer.EVENTS_COLLECTION, EventSerializer.storeKey(source, sequence))
                    .map(EventSerializer::fromDocument);
        } catch (AdapterException e) {
            throw failures.report("publish",
                    new ConnectionException(COMPONENT, "precondition read failed", context, e));
        }
    }

    private void write(SessionHandle session, Event event) {
        ownEventIds.add(event.id());
        try {
            adapter.write(session, EventSerializer.EVENTS_COLLECTION,
                    EventSerializer.storeKey(event.source(), event.sequence()), EventSerializer.toDocument(event));
        } catch (AdapterException e) {
            ownEventIds.remove(event.id());
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("event_id", event.id());
            context.put("event_type", event.type());
            context.put("source", event.source());
            context.put("sequence", event.sequence());
            throw failures.report("publish",
                    new ConnectionException(COMPONENT, "event write failed: " + e.getMessage(), context, e));
        }
    }

    // ---- delivery ----

    private void deliver(Event event) {
        for (Subscription subscription : subscriptions) {
            if (!subscription.matches(event.type())) {
                continue;
            }
            try {
                subscription.handler().handle(event);
            } catch (RuntimeException e) {
                metrics.counter("reflex.events.delivery.failures", "Subscriber handlers that threw",
                        "topic", subscription.topic()).increment();
                failures.reportIsolated(COMPONENT,
                        "delivering %s %s:%d".formatted(event.type(), event.source(), event.sequence()), e);
            }
        }
    }

    private void onRemoteDocument(Map<String, Object> document) {
        Event event;
        try {
            event = EventSerializer.fromDocument(document);
        } catch (EventSerializationException e) {
            failures.reportIsolated(COMPONENT, "decoding remote event", e);
            return;
        }
        if (ownEventIds.contains(event.id())) {
            return;
        }
        log.debug("Remote event {} {}:{}", event.type(), event.source(), event.sequence());
        deliver(event);
    }
}
