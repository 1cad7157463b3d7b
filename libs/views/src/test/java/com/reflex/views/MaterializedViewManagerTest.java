package com.reflex.views;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.reflex.common.ViewException;
import com.reflex.eventmodel.Event;
import com.reflex.eventmodel.SchemaRegistry;
import com.reflex.eventmodel.ValidationSchema;
import com.reflex.mesh.EventMesh;
import com.reflex.mesh.MeshSettings;
import com.reflex.observability.MetricFactory;
import com.reflex.observability.SpanHelper;
import com.reflex.store.Credentials;
import com.reflex.store.inmemory.InMemoryBackingStore;
import com.reflex.supervisor.ConnectionSupervisor;
import com.reflex.supervisor.SupervisorSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MaterializedViewManager")
class MaterializedViewManagerTest {

    private static final Credentials CREDENTIALS = Credentials.fromPath("/etc/reflex/sa.json", "demo");
    private static final Duration GAP_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration REBUILD_TIMEOUT = Duration.ofSeconds(30);

    private static final SchemaRegistry SCHEMAS =
            SchemaRegistry.builder()
                    .register(ValidationSchema.requiring("user.action", "user_id", "action"))
                    .register(ValidationSchema.requiring("order.placed", "order_id"))
                    .build();

    private InMemoryBackingStore store;
    private SimpleMeterRegistry registry;
    private ConnectionSupervisor supervisor;
    private MutableClock clock;
    private MaterializedViewManager manager;
    private EventMesh mesh;

    @BeforeEach
    void setUp() {
        store = new InMemoryBackingStore();
        registry = new SimpleMeterRegistry();
        MetricFactory metrics = new MetricFactory(registry, "test");
        supervisor =
                new ConnectionSupervisor(
                        store,
                        CREDENTIALS,
                        new SupervisorSettings(1, Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofHours(1)),
                        metrics);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        manager = new MaterializedViewManager(
                supervisor, new ViewSettings(GAP_TIMEOUT, 3), metrics, SpanHelper.noop(), clock);
        mesh = new EventMesh(supervisor, SCHEMAS, MeshSettings.defaults(), metrics, SpanHelper.noop());
        manager.register(new ViewDefinition("counts", 1, Set.of("*"), Folds.countByType()));
    }

    @AfterEach
    void tearDown() {
        manager.close();
        supervisor.shutdown();
    }

    private Event event(String source, long sequence) {
        return event("user.action", source, sequence);
    }

    private Event event(String type, String source, long sequence) {
        return new Event(UUID.randomUUID().toString(), type, source, sequence,
                Map.of("user_id", source + "-" + sequence, "action", "login"), clock.instant());
    }

    private Map<String, Object> action(String userId) {
        return Map.of("user_id", userId, "action", "login");
    }

    @Nested
    @DisplayName("Applying")
    class Applying {

        @Test
        @DisplayName("applying the same event twice equals applying it once")
        void idempotent() {
            Event first = event("s1", 1);

            assertThat(manager.apply("counts", first)).isEqualTo(ApplyOutcome.APPLIED);
            ViewSnapshot once = manager.getViewState("counts");
            assertThat(manager.apply("counts", first)).isEqualTo(ApplyOutcome.DUPLICATE);

            ViewSnapshot twice = manager.getViewState("counts");
            assertThat(twice.canonicalState()).isEqualTo(once.canonicalState());
            assertThat(twice.state()).containsEntry("user.action", 1L);
            assertThat(twice.appliedThrough()).containsEntry("s1", 1L);
        }

        @Test
        @DisplayName("keeps a watermark per source")
        void watermarkPerSource() {
            manager.apply("counts", event("s1", 1));
            manager.apply("counts", event("s2", 1));
            manager.apply("counts", event("s1", 2));

            ViewSnapshot view = manager.getViewState("counts");
            assertThat(view.appliedThrough()).containsEntry("s1", 2L).containsEntry("s2", 1L);
            assertThat(view.state()).containsEntry("user.action", 3L);
            assertThat(view.status()).isEqualTo(ViewStatus.ACTIVE);
            assertThat(view.updatedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("snapshots cannot be modified")
        void immutableSnapshot() {
            manager.apply("counts", event("s1", 1));
            ViewSnapshot view = manager.getViewState("counts");

            assertThatThrownBy(() -> view.state().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> view.appliedThrough().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("fails for an unknown view")
        void unknownView() {
            assertThatThrownBy(() -> manager.getViewState("nope"))
                    .isInstanceOfSatisfying(ViewException.class, e -> {
                        assertThat(e.kind()).isEqualTo(ViewException.Kind.UNKNOWN_VIEW);
                        assertThat(e.retryable()).isFalse();
                    });
            assertThatThrownBy(() -> manager.apply("nope", event("s1", 1))).isInstanceOf(ViewException.class);
            assertThatThrownBy(() -> manager.rebuild("nope", REBUILD_TIMEOUT)).isInstanceOf(ViewException.class);
        }

        @Test
        @DisplayName("rejects a second view with the same name")
        void duplicateRegistration() {
            assertThatThrownBy(() -> manager.register(
                            new ViewDefinition("counts", 2, Set.of("*"), Folds.countByType())))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("already registered");
        }
    }

    @Nested
    @DisplayName("Sequence gaps")
    class SequenceGaps {

        @Test
        @DisplayName("buffers an event that skips ahead and drains it when the gap closes")
        void buffersAndDrains() {
            manager.apply("counts", event("s1", 1));

            assertThat(manager.apply("counts", event("s1", 3))).isEqualTo(ApplyOutcome.BUFFERED);
            ViewSnapshot waiting = manager.getViewState("counts");
            assertThat(waiting.appliedThrough()).containsEntry("s1", 1L);
            assertThat(waiting.pending()).containsEntry("s1", 1);
            assertThat(waiting.state()).containsEntry("user.action", 1L);

            assertThat(manager.apply("counts", event("s1", 2))).isEqualTo(ApplyOutcome.APPLIED);
            ViewSnapshot drained = manager.getViewState("counts");
            assertThat(drained.appliedThrough()).containsEntry("s1", 3L);
            assertThat(drained.pending()).isEmpty();
            assertThat(drained.state()).containsEntry("user.action", 3L);
        }

        @Test
        @DisplayName("a buffered event offered again is a duplicate")
        void bufferedDuplicate() {
            manager.apply("counts", event("s1", 1));
            Event third = event("s1", 3);
            manager.apply("counts", third);

            assertThat(manager.apply("counts", third)).isEqualTo(ApplyOutcome.DUPLICATE);
            assertThat(manager.getViewState("counts").pending()).containsEntry("s1", 1);
        }

        @Test
        @DisplayName("marks the view stale when a gap outlives the timeout")
        void gapTimeout() {
            manager.apply("counts", event("s1", 1));
            manager.apply("counts", event("s1", 3));

            clock.advance(GAP_TIMEOUT.minusSeconds(1));
            assertThat(manager.expireOverdueGaps()).isEmpty();

            clock.advance(Duration.ofSeconds(1));
            assertThat(manager.expireOverdueGaps()).containsExactly("counts");

            ViewSnapshot view = manager.getViewState("counts");
            assertThat(view.isStale()).isTrue();
            assertThat(view.staleReason()).startsWith("SEQUENCE_GAP").contains("sequence 2 of 's1'");
            assertThat(view.pending()).isEmpty();
            assertThat(manager.apply("counts", event("s1", 2))).isEqualTo(ApplyOutcome.IGNORED_STALE);
            assertThat(registry.get("reflex.views.stale").tag("kind", "SEQUENCE_GAP").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("detects an overdue gap on the next apply")
        void gapTimeoutOnApply() {
            manager.apply("counts", event("s1", 1));
            manager.apply("counts", event("s1", 3));
            clock.advance(GAP_TIMEOUT.plusSeconds(1));

            assertThatThrownBy(() -> manager.apply("counts", event("s2", 1)))
                    .isInstanceOfSatisfying(ViewException.class, e -> {
                        assertThat(e.kind()).isEqualTo(ViewException.Kind.SEQUENCE_GAP);
                        assertThat(e.context()).containsEntry("source", "s1").containsEntry("missing_sequence", 2L);
                    });
            assertThat(manager.getViewState("counts").isStale()).isTrue();
        }

        @Test
        @DisplayName("the background sweeper expires gaps without further applies")
        void sweeper() {
            MaterializedViewManager fast = new MaterializedViewManager(
                    supervisor, new ViewSettings(Duration.ofMillis(50), 10),
                    MetricFactory.standalone("test"), SpanHelper.noop());
            try {
                fast.register(new ViewDefinition("counts", 1, Set.of("*"), Folds.countByType()));
                fast.apply("counts", event("s1", 2));
                fast.start();

                await().atMost(Duration.ofSeconds(5))
                        .untilAsserted(() -> assertThat(fast.getViewState("counts").isStale()).isTrue());
            } finally {
                fast.close();
            }
        }

        @Test
        @DisplayName("overflowing the per-source buffer makes the view stale")
        void bufferOverflow() {
            manager.apply("counts", event("s1", 1));
            manager.apply("counts", event("s1", 3));
            manager.apply("counts", event("s1", 4));
            manager.apply("counts", event("s1", 5));

            assertThatThrownBy(() -> manager.apply("counts", event("s1", 6)))
                    .isInstanceOfSatisfying(ViewException.class,
                            e -> assertThat(e.kind()).isEqualTo(ViewException.Kind.BUFFER_OVERFLOW));

            ViewSnapshot view = manager.getViewState("counts");
            assertThat(view.isStale()).isTrue();
            assertThat(view.state()).containsEntry("user.action", 1L);
        }
    }

    @Nested
    @DisplayName("Failures and routing")
    class FailuresAndRouting {

        @Test
        @DisplayName("a throwing fold leaves the state untouched and marks the view stale")
        void foldFailure() {
            manager.register(new ViewDefinition("fragile", 1, Set.of("user.action"), (state, event) -> {
                if (event.sequence() == 2) {
                    throw new IllegalStateException("cannot fold");
                }
                return Folds.countByType().fold(state, event);
            }));
            manager.apply("fragile", event("s1", 1));

            assertThatThrownBy(() -> manager.apply("fragile", event("s1", 2)))
                    .isInstanceOfSatisfying(ViewException.class, e -> {
                        assertThat(e.kind()).isEqualTo(ViewException.Kind.FOLD_FAILED);
                        assertThat(e.getCause()).hasMessage("cannot fold");
                    });

            ViewSnapshot view = manager.getViewState("fragile");
            assertThat(view.isStale()).isTrue();
            assertThat(view.appliedThrough()).containsEntry("s1", 1L);
            assertThat(view.state()).containsEntry("user.action", 1L);
        }

        @Test
        @DisplayName("routes mesh events by type and isolates a failing view")
        void routesAndIsolates() {
            manager.register(new ViewDefinition("orders", 1, Set.of("order.placed"), Folds.latestBy("order_id")));
            manager.register(new ViewDefinition("broken", 1, Set.of("user.action"), (state, event) -> {
                throw new IllegalStateException("always fails");
            }));
            manager.attach(mesh);

            mesh.publish("user.action", "web", action("u1"));
            mesh.publish("order.placed", "shop", Map.of("order_id", "o-1"));

            assertThat(manager.getViewState("counts").state())
                    .containsEntry("user.action", 1L)
                    .containsEntry("order.placed", 1L);
            assertThat(manager.getViewState("orders").state()).containsOnlyKeys("o-1");
            assertThat(manager.getViewState("broken").isStale()).isTrue();
        }
    }

    @Nested
    @DisplayName("Rebuilding")
    class Rebuilding {

        @Test
        @DisplayName("reproduces the incrementally built state over 1,000 events")
        void rebuildMatchesIncremental() {
            manager.register(new ViewDefinition("latest", 1, Set.of("user.action"), Folds.latestBy("user_id")));
            manager.attach(mesh);
            for (int i = 0; i < 1000; i++) {
                String source = "source-" + (i % 5);
                if (i % 4 == 0) {
                    mesh.publish("order.placed", source, Map.of("order_id", "o-" + i));
                } else {
                    mesh.publish("user.action", source, action(source + "-user-" + (i % 37)));
                }
            }
            ViewSnapshot countsBefore = manager.getViewState("counts");
            ViewSnapshot latestBefore = manager.getViewState("latest");

            ViewSnapshot counts = manager.rebuild("counts", REBUILD_TIMEOUT);
            ViewSnapshot latest = manager.rebuild("latest", REBUILD_TIMEOUT);

            assertThat(counts.canonicalState()).isEqualTo(countsBefore.canonicalState());
            assertThat(counts.appliedThrough()).isEqualTo(countsBefore.appliedThrough());
            assertThat(latest.canonicalState()).isEqualTo(latestBefore.canonicalState());
            // the filtered view replays the other types too, as watermark-only steps
            assertThat(latest.appliedThrough()).isEqualTo(countsBefore.appliedThrough());
            assertThat(latest.pending()).isEmpty();
            assertThat(latest.status()).isEqualTo(ViewStatus.ACTIVE);
            assertThat(counts.state()).containsEntry("order.placed", 250L).containsEntry("user.action", 750L);
            assertThat(counts.status()).isEqualTo(ViewStatus.ACTIVE);
        }

        @Test
        @DisplayName("brings a stale view back from the persisted log")
        void rebuildClearsStale() {
            manager.attach(mesh);
            mesh.publish("user.action", "web", action("u1"));
            mesh.publish("user.action", "web", action("u2"));
            manager.apply("counts", event("ghost", 4));
            clock.advance(GAP_TIMEOUT);
            manager.expireOverdueGaps();
            assertThat(manager.getViewState("counts").isStale()).isTrue();

            ViewSnapshot rebuilt = manager.rebuild("counts", REBUILD_TIMEOUT);

            assertThat(rebuilt.status()).isEqualTo(ViewStatus.ACTIVE);
            assertThat(rebuilt.staleReason()).isNull();
            assertThat(rebuilt.state()).containsExactly(Map.entry("user.action", 2L));
            assertThat(rebuilt.appliedThrough()).containsOnlyKeys("web");
            assertThat(manager.getViewState("counts")).isEqualTo(rebuilt);
        }

        @Test
        @DisplayName("readers keep the previous state while a rebuild runs")
        void readersSeePreviousState() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Map<String, Boolean> gate = new LinkedHashMap<>();
            gate.put("closed", false);
            manager.register(new ViewDefinition("gated", 1, Set.of("user.action"), (state, event) -> {
                if (gate.get("closed")) {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return Folds.countByType().fold(state, event);
            }));
            manager.attach(mesh);
            mesh.publish("user.action", "web", action("u1"));
            String before = manager.getViewState("gated").canonicalState();
            gate.put("closed", true);

            CompletableFuture<ViewSnapshot> rebuild =
                    CompletableFuture.supplyAsync(() -> manager.rebuild("gated", REBUILD_TIMEOUT));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            ViewSnapshot during = manager.getViewState("gated");
            assertThat(during.status()).isEqualTo(ViewStatus.REBUILDING);
            assertThat(during.canonicalState()).isEqualTo(before);

            release.countDown();
            ViewSnapshot after = rebuild.get(5, TimeUnit.SECONDS);
            assertThat(after.status()).isEqualTo(ViewStatus.ACTIVE);
            assertThat(after.canonicalState()).isEqualTo(before);
        }

        @Test
        @DisplayName("a rebuild that runs out of time leaves the view stale")
        void rebuildTimeout() {
            manager.register(new ViewDefinition("slow", 1, Set.of("user.action"), (state, event) -> {
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return state;
            }));
            for (int i = 0; i < 20; i++) {
                mesh.publish("user.action", "web", action("u" + i));
            }

            assertThatThrownBy(() -> manager.rebuild("slow", Duration.ofMillis(100)))
                    .isInstanceOfSatisfying(ViewException.class,
                            e -> assertThat(e.kind()).isEqualTo(ViewException.Kind.REBUILD_TIMEOUT));

            ViewSnapshot view = manager.getViewState("slow");
            assertThat(view.isStale()).isTrue();
            assertThat(view.staleReason()).startsWith("REBUILD_TIMEOUT");
        }

        @Test
        @DisplayName("a rebuild without a reachable store fails and leaves the view stale")
        void rebuildWithoutStore() {
            store.setReachable(false);

            assertThatThrownBy(() -> manager.rebuild("counts", Duration.ofSeconds(2)))
                    .isInstanceOfSatisfying(ViewException.class, e -> {
                        assertThat(e.kind()).isEqualTo(ViewException.Kind.REBUILD_FAILED);
                        assertThat(e.getCause()).isInstanceOf(com.reflex.common.ConnectionException.class);
                    });
            assertThat(manager.getViewState("counts").isStale()).isTrue();
        }
    }
}
