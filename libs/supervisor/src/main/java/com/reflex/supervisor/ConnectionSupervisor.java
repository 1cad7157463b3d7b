package com.reflex.supervisor;

import com.reflex.common.ConnectionException;
import com.reflex.observability.ComponentHealth;
import com.reflex.observability.FailureReporter;
import com.reflex.observability.HealthCheck;
import com.reflex.observability.MetricFactory;
import com.reflex.store.BackingStoreAdapter;
import com.reflex.store.Credentials;
import com.reflex.store.SessionHandle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single logical session to the backing store.
 *
 * <p>Connects lazily on the first {@link #acquireSession(Duration)}, probes the session on a fixed
 * interval once {@link #start() started}, and reconnects with {@link BackoffPolicy exponential
 * backoff} after the connection is lost. After {@code maxReconnectAttempts} failed reconnects the
 * supervisor parks in {@link SessionState#FAILED} until {@link #reset()}.
 *
 * <p>All session fields are mutated under one lock. Connect attempts and probes run on the
 * supervisor's own scheduler thread and never hold the lock during store round-trips, so callers
 * observing state or failing fast in {@code FAILED} never wait behind the network. Listeners are
 * notified after the lock is released.
 */
public final class ConnectionSupervisor implements AutoCloseable {

    /** Component name used in failures, logs and metrics. */
    public static final String COMPONENT = "connection-supervisor";

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final BackingStoreAdapter adapter;
    private final Credentials credentials;
    private final SupervisorSettings settings;
    private final BackoffPolicy backoff;
    private final Clock clock;
    private final MetricFactory metrics;
    private final FailureReporter failures;
    private final ScheduledExecutorService scheduler;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private final List<StateChangeListener> listeners = new CopyOnWriteArrayList<>();

    // guarded by lock
    private SessionState state = SessionState.DISCONNECTED;
    private SessionHandle handle;
    private Instant establishedAt;
    private Instant lastHealthCheckAt;
    private int reconnectAttempts;
    private int consecutiveProbeFailures;
    private String lastError;
    private boolean shutdown;
    private ScheduledFuture<?> probeTask;

    private volatile Session snapshot = Session.initial();

    public ConnectionSupervisor(
            BackingStoreAdapter adapter,
            Credentials credentials,
            SupervisorSettings settings,
            MetricFactory metrics) {
        this(
                adapter,
                credentials,
                settings,
                new BackoffPolicy(settings.baseReconnectDelay(), settings.maxReconnectDelay()),
                Clock.systemUTC(),
                metrics);
    }

    public ConnectionSupervisor(
            BackingStoreAdapter adapter,
            Credentials credentials,
            SupervisorSettings settings,
            BackoffPolicy backoff,
            Clock clock,
            MetricFactory metrics) {
        if (adapter == null) {
            throw new IllegalArgumentException("adapter must not be null");
        }
        if (credentials == null || !credentials.isProvided()) {
            throw new IllegalArgumentException(
                    "credentials must provide a credentials path or inline properties");
        }
        if (settings == null || backoff == null || clock == null || metrics == null) {
            throw new IllegalArgumentException("settings, backoff, clock and metrics are required");
        }
        this.adapter = adapter;
        this.credentials = credentials;
        this.settings = settings;
        this.backoff = backoff;
        this.clock = clock;
        this.metrics = metrics.forComponent(COMPONENT);
        this.failures = new FailureReporter(this.metrics);
        this.scheduler =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "reflex-supervisor");
                            thread.setDaemon(true);
                            return thread;
                        });
        this.metrics.gauge(
                "reflex.supervisor.reconnect.attempts",
                "Failed reconnect attempts since the last successful connect",
                () -> snapshot.reconnectAttempts());
    }

    /** Starts the periodic health probe. Idempotent. */
    public void start() {
        lock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("supervisor has been shut down");
            }
            if (probeTask == null) {
                long interval = settings.healthCheckInterval().toMillis();
                probeTask =
                        scheduler.scheduleAtFixedRate(
                                this::probeSafely, interval, interval, TimeUnit.MILLISECONDS);
                log.info("Health probing every {} ms", interval);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a usable session, connecting first if no session was ever requested.
     *
     * <p>Fails immediately in {@link SessionState#FAILED}. Otherwise waits up to {@code timeout} for
     * the session to become usable; expiry leaves the supervisor's state untouched.
     *
     * @throws ConnectionException if the session is failed, the supervisor is shut down, or the
     *     timeout elapses
     */
    public SessionHandle acquireSession(Duration timeout) {
        List<StateTransition> fired = new ArrayList<>(1);
        lock.lock();
        try {
            if (state == SessionState.DISCONNECTED && !shutdown) {
                fired.add(transition(SessionState.CONNECTING, "first session request"));
                scheduleConnect(Duration.ZERO);
            }
            long remaining = timeout.toNanos();
            while (!state.isUsable()) {
                if (shutdown) {
                    throw unavailable("supervisor has been shut down", timeout);
                }
                if (state == SessionState.FAILED) {
                    throw unavailable("session failed; reset required", timeout);
                }
                if (remaining <= 0) {
                    throw unavailable("timed out waiting for a session", timeout);
                }
                remaining = stateChanged.awaitNanos(remaining);
            }
            return handle;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable("interrupted while waiting for a session", timeout);
        } finally {
            lock.unlock();
            notifyListeners(fired);
        }
    }

    /** Non-blocking view of the current state. */
    public SessionState currentState() {
        return snapshot.state();
    }

    /** Non-blocking view of the whole session. */
    public Session session() {
        return snapshot;
    }

    /** Registers a listener for every subsequent state change. */
    public void onStateChange(StateChangeListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        listeners.add(listener);
    }

    /**
     * Leaves {@link SessionState#FAILED} and starts connecting again with a fresh attempt budget.
     *
     * @return true if the supervisor was failed and is now connecting, false if there was nothing to
     *     reset
     */
    public boolean reset() {
        List<StateTransition> fired = new ArrayList<>(1);
        lock.lock();
        try {
            if (shutdown) {
                throw new IllegalStateException("supervisor has been shut down");
            }
            if (state != SessionState.FAILED) {
                return false;
            }
            reconnectAttempts = 0;
            fired.add(transition(SessionState.CONNECTING, "explicit reset"));
            scheduleConnect(Duration.ZERO);
            return true;
        } finally {
            lock.unlock();
            notifyListeners(fired);
        }
    }

    /** The adapter sessions handed out by this supervisor belong to. */
    public BackingStoreAdapter adapter() {
        return adapter;
    }

    /** Exposes the session state as a health check for the observability registry. */
    public HealthCheck asHealthCheck() {
        return () -> {
            Session s = snapshot;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("state", s.state().name());
            details.put("reconnect_attempts", s.reconnectAttempts());
            details.put("last_health_check_at",
                    s.lastHealthCheckAt() == null ? null : s.lastHealthCheckAt().toString());
            details.put("last_error", s.lastError());
            return switch (s.state()) {
                case CONNECTED -> ComponentHealth.healthy(COMPONENT, details);
                case CONNECTING, DEGRADED, RECONNECTING ->
                        ComponentHealth.degraded(COMPONENT, s.lastError(), details);
                case DISCONNECTED, FAILED ->
                        ComponentHealth.unhealthy(
                                COMPONENT, s.lastError() == null ? s.state().name() : s.lastError(), details);
            };
        };
    }

    /** Stops probing and reconnecting and releases the session. Idempotent. */
    public void shutdown() {
        List<StateTransition> fired = new ArrayList<>(1);
        SessionHandle released;
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            released = handle;
            handle = null;
            if (state != SessionState.DISCONNECTED) {
                fired.add(transition(SessionState.DISCONNECTED, "shutdown"));
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        scheduler.shutdownNow();
        release(released);
        notifyListeners(fired);
        log.info("Connection supervisor shut down");
    }

    @Override
    public void close() {
        shutdown();
    }

    // ---- scheduler side ----

    private void attemptConnect() {
        SessionState phase;
        lock.lock();
        try {
            if (shutdown || (state != SessionState.CONNECTING && state != SessionState.RECONNECTING)) {
                return;
            }
            phase = state;
        } finally {
            lock.unlock();
        }

        SessionHandle opened = null;
        RuntimeException error = null;
        try {
            opened = adapter.connect(credentials);
        } catch (RuntimeException e) {
            error = e;
        }

        List<StateTransition> fired = new ArrayList<>(1);
        SessionHandle orphan = null;
        lock.lock();
        try {
            if (shutdown) {
                orphan = opened;
                return;
            }
            if (opened != null) {
                handle = opened;
                establishedAt = Instant.now(clock);
                reconnectAttempts = 0;
                consecutiveProbeFailures = 0;
                lastError = null;
                fired.add(transition(SessionState.CONNECTED,
                        phase == SessionState.CONNECTING ? "connected" : "reconnected"));
            } else {
                lastError = describe(error);
                fired.add(afterConnectFailure(phase));
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
            release(orphan);
            notifyListeners(fired);
        }
    }

    // caller holds lock
    private StateTransition afterConnectFailure(SessionState phase) {
        int max = settings.maxReconnectAttempts();
        if (phase == SessionState.RECONNECTING) {
            reconnectAttempts++;
        }
        if (reconnectAttempts >= max) {
            return transition(SessionState.FAILED,
                    "gave up after %d reconnect attempts: %s".formatted(reconnectAttempts, lastError));
        }
        Duration delay = backoff.delay(reconnectAttempts);
        scheduleConnect(delay);
        String cause = phase == SessionState.CONNECTING
                ? "connect failed: %s; retrying in %d ms".formatted(lastError, delay.toMillis())
                : "reconnect attempt %d failed: %s; retrying in %d ms"
                        .formatted(reconnectAttempts, lastError, delay.toMillis());
        return transition(SessionState.RECONNECTING, cause);
    }

    private void probeSafely() {
        try {
            probe();
        } catch (RuntimeException e) {
            // keeps the fixed-rate task alive
            failures.reportIsolated(COMPONENT, "health probe", e);
        }
    }

    private void probe() {
        SessionHandle probed;
        lock.lock();
        try {
            if (shutdown || !state.isUsable()) {
                return;
            }
            probed = handle;
        } finally {
            lock.unlock();
        }

        boolean healthy;
        String error = null;
        try {
            healthy = adapter.probe(probed);
        } catch (RuntimeException e) {
            healthy = false;
            error = describe(e);
        }

        List<StateTransition> fired = new ArrayList<>(1);
        SessionHandle lost = null;
        lock.lock();
        try {
            if (shutdown || handle != probed || !state.isUsable()) {
                return;
            }
            lastHealthCheckAt = Instant.now(clock);
            if (healthy) {
                consecutiveProbeFailures = 0;
                if (state == SessionState.DEGRADED) {
                    fired.add(transition(SessionState.CONNECTED, "health probe recovered"));
                } else {
                    publishSnapshot();
                }
            } else {
                consecutiveProbeFailures++;
                lastError = error != null ? error : "health probe reported unhealthy";
                if (state == SessionState.CONNECTED) {
                    fired.add(transition(SessionState.DEGRADED, "health probe failed: " + lastError));
                } else {
                    lost = handle;
                    handle = null;
                    reconnectAttempts = 0;
                    Duration delay = backoff.delay(0);
                    scheduleConnect(delay);
                    fired.add(transition(SessionState.RECONNECTING,
                            "health probe failed %d times in a row; retrying in %d ms"
                                    .formatted(consecutiveProbeFailures, delay.toMillis())));
                }
            }
            stateChanged.signalAll();
        } finally {
            lock.unlock();
            release(lost);
            notifyListeners(fired);
        }
    }

    // ---- helpers ----

    // caller holds lock
    private void scheduleConnect(Duration delay) {
        try {
            scheduler.schedule(this::attemptConnect, delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Connect attempt not scheduled, supervisor is shutting down");
        }
    }

    // caller holds lock
    private StateTransition transition(SessionState to, String cause) {
        SessionState from = state;
        state = to;
        publishSnapshot();
        log.info("Session state {} -> {} ({})", from, to, cause);
        metrics.counter("reflex.supervisor.transitions", "Session state transitions", "to", to.name())
                .increment();
        return new StateTransition(from, to, cause, Instant.now(clock));
    }

    // caller holds lock
    private void publishSnapshot() {
        snapshot = new Session(state, establishedAt, reconnectAttempts, lastHealthCheckAt, lastError,
                consecutiveProbeFailures);
    }

    private void notifyListeners(List<StateTransition> transitions) {
        for (StateTransition t : transitions) {
            for (StateChangeListener listener : listeners) {
                try {
                    listener.onStateChange(t);
                } catch (RuntimeException e) {
                    failures.reportIsolated(COMPONENT, "state change notification", e);
                }
            }
        }
    }

    private void release(SessionHandle session) {
        if (session == null) {
            return;
        }
        try {
            adapter.disconnect(session);
        } catch (RuntimeException e) {
            log.warn("Releasing session {} failed: {}", session.id(), e.toString());
        }
    }

    // caller holds lock
    private ConnectionException unavailable(String reason, Duration timeout) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("state", state.name());
        context.put("timeout_ms", timeout.toMillis());
        context.put("reconnect_attempts", reconnectAttempts);
        context.put("last_error", lastError);
        context.put("credentials_path", credentials.credentialsPath());
        context.put("project_id", credentials.projectId());
        return new ConnectionException(COMPONENT, reason, context);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
