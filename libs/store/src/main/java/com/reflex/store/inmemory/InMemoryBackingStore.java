package com.reflex.store.inmemory;

import com.reflex.store.AdapterConnectException;
import com.reflex.store.AdapterReadException;
import com.reflex.store.AdapterWriteException;
import com.reflex.store.BackingStoreAdapter;
import com.reflex.store.Credentials;
import com.reflex.store.SessionHandle;
import com.reflex.store.TopicSubscription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link BackingStoreAdapter} that keeps everything in memory, with switchable faults.
 *
 * <p>Used by tests and by the service when no real store adapter is configured. Faults can be
 * injected per primitive: an unreachable store, a number of upcoming connect or write failures, and
 * failing probes. Sessions are invalidated when the store becomes unreachable.
 *
 * <p>Topic callbacks run synchronously on the writing thread, after the write is visible.
 */
public final class InMemoryBackingStore implements BackingStoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBackingStore.class);

    private final Map<String, TreeMap<String, Map<String, Object>>> collections = new LinkedHashMap<>();
    private final Map<String, List<Consumer<Map<String, Object>>>> topics = new ConcurrentHashMap<>();
    private final Set<String> liveSessions = ConcurrentHashMap.newKeySet();

    private volatile boolean reachable = true;
    private volatile boolean probesFail;
    private final AtomicInteger connectFailuresAhead = new AtomicInteger();
    private final AtomicInteger writeFailuresAhead = new AtomicInteger();
    private final AtomicInteger connectCalls = new AtomicInteger();
    private final AtomicInteger writeCalls = new AtomicInteger();
    private final AtomicInteger readCalls = new AtomicInteger();

    private record InMemorySession(String id) implements SessionHandle {}

    @Override
    public SessionHandle connect(Credentials credentials) {
        connectCalls.incrementAndGet();
        if (credentials == null || !credentials.isProvided()) {
            throw new AdapterConnectException("no credentials supplied");
        }
        if (!reachable) {
            throw new AdapterConnectException("store unreachable");
        }
        if (consume(connectFailuresAhead)) {
            throw new AdapterConnectException("injected connect failure");
        }
        var session = new InMemorySession(UUID.randomUUID().toString());
        liveSessions.add(session.id());
        log.debug("Opened in-memory session {}", session.id());
        return session;
    }

    @Override
    public boolean probe(SessionHandle session) {
        return reachable && !probesFail && isLive(session);
    }

    @Override
    public void write(SessionHandle session, String collection, String key, Map<String, Object> document) {
        writeCalls.incrementAndGet();
        if (!reachable || !isLive(session)) {
            throw new AdapterWriteException("session %s is not usable".formatted(idOf(session)));
        }
        if (consume(writeFailuresAhead)) {
            throw new AdapterWriteException("injected write failure for %s/%s".formatted(collection, key));
        }
        Map<String, Object> stored = new LinkedHashMap<>(document);
        synchronized (collections) {
            collections.computeIfAbsent(collection, c -> new TreeMap<>()).put(key, stored);
        }
        for (Consumer<Map<String, Object>> callback : topics.getOrDefault(collection, List.of())) {
            callback.accept(new LinkedHashMap<>(stored));
        }
    }

    @Override
    public Optional<Map<String, Object>> read(SessionHandle session, String collection, String key) {
        readCalls.incrementAndGet();
        requireUsable(session);
        synchronized (collections) {
            var docs = collections.get(collection);
            return docs == null || !docs.containsKey(key)
                    ? Optional.empty()
                    : Optional.of(new LinkedHashMap<>(docs.get(key)));
        }
    }

    @Override
    public List<Map<String, Object>> list(SessionHandle session, String collection) {
        readCalls.incrementAndGet();
        requireUsable(session);
        synchronized (collections) {
            var docs = collections.get(collection);
            List<Map<String, Object>> copies = new ArrayList<>();
            if (docs != null) {
                docs.values().forEach(doc -> copies.add(new LinkedHashMap<>(doc)));
            }
            return copies;
        }
    }

    @Override
    public TopicSubscription subscribeTopic(
            SessionHandle session, String topic, Consumer<Map<String, Object>> callback) {
        requireUsable(session);
        topics.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(callback);
        return () -> topics.getOrDefault(topic, List.of()).remove(callback);
    }

    @Override
    public void disconnect(SessionHandle session) {
        if (session != null) {
            liveSessions.remove(session.id());
        }
    }

    // ---- fault injection ----

    /** Makes the store (un)reachable. Going unreachable kills every open session. */
    public void setReachable(boolean reachable) {
        this.reachable = reachable;
        if (!reachable) {
            liveSessions.clear();
        }
    }

    /** Makes probes report unhealthy while sessions stay usable. */
    public void setProbesFail(boolean probesFail) {
        this.probesFail = probesFail;
    }

    /** The next {@code count} connect calls fail. */
    public void failNextConnects(int count) {
        connectFailuresAhead.set(count);
    }

    /** The next {@code count} write calls fail. */
    public void failNextWrites(int count) {
        writeFailuresAhead.set(count);
    }

    // ---- inspection ----

    public int connectCalls() {
        return connectCalls.get();
    }

    public int writeCalls() {
        return writeCalls.get();
    }

    public int readCalls() {
        return readCalls.get();
    }

    /** Number of documents in a collection. */
    public int size(String collection) {
        synchronized (collections) {
            var docs = collections.get(collection);
            return docs == null ? 0 : docs.size();
        }
    }

    /** Writes a document directly, bypassing sessions, faults and topic callbacks. */
    public void seed(String collection, String key, Map<String, Object> document) {
        synchronized (collections) {
            collections.computeIfAbsent(collection, c -> new TreeMap<>()).put(key, new LinkedHashMap<>(document));
        }
    }

    private void requireUsable(SessionHandle session) {
        if (!reachable || !isLive(session)) {
            throw new AdapterReadException("session %s is not usable".formatted(idOf(session)));
        }
    }

    private boolean isLive(SessionHandle session) {
        return session != null && liveSessions.contains(session.id());
    }

    private static String idOf(SessionHandle session) {
        return session == null ? "null" : session.id();
    }

    private static boolean consume(AtomicInteger remaining) {
        return remaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0;
    }
}
