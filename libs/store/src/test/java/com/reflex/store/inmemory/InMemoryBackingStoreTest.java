package com.reflex.store.inmemory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.reflex.store.AdapterConnectException;
import com.reflex.store.AdapterReadException;
import com.reflex.store.AdapterWriteException;
import com.reflex.store.Credentials;
import com.reflex.store.SessionHandle;
import com.reflex.store.TopicSubscription;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryBackingStore")
class InMemoryBackingStoreTest {

    private static final Credentials CREDENTIALS = Credentials.fromPath("/etc/reflex/sa.json", "demo");

    private InMemoryBackingStore store;
    private SessionHandle session;

    @BeforeEach
    void setUp() {
        store = new InMemoryBackingStore();
        session = store.connect(CREDENTIALS);
    }

    @Nested
    @DisplayName("Sessions")
    class Sessions {

        @Test
        @DisplayName("refuses missing credentials")
        void refusesMissingCredentials() {
            assertThatThrownBy(() -> store.connect(Credentials.fromPath(null, "demo")))
                    .isInstanceOf(AdapterConnectException.class);
        }

        @Test
        @DisplayName("fails the injected number of connects, then recovers")
        void failsInjectedConnects() {
            store.failNextConnects(2);

            assertThatThrownBy(() -> store.connect(CREDENTIALS)).isInstanceOf(AdapterConnectException.class);
            assertThatThrownBy(() -> store.connect(CREDENTIALS)).isInstanceOf(AdapterConnectException.class);
            assertThat(store.connect(CREDENTIALS)).isNotNull();
        }

        @Test
        @DisplayName("going unreachable kills open sessions")
        void unreachableKillsSessions() {
            store.setReachable(false);
            store.setReachable(true);

            assertThat(store.probe(session)).isFalse();
            assertThatThrownBy(() -> store.write(session, "events", "k", Map.of()))
                    .isInstanceOf(AdapterWriteException.class);
        }

        @Test
        @DisplayName("failing probes leave the session usable")
        void failingProbes() {
            store.setProbesFail(true);

            assertThat(store.probe(session)).isFalse();
            store.write(session, "events", "k", Map.of("a", 1));
            assertThat(store.size("events")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Documents")
    class Documents {

        @Test
        @DisplayName("reads back written documents and reports absent keys as empty")
        void readsBack() {
            store.write(session, "events", "k1", Map.of("a", 1));

            assertThat(store.read(session, "events", "k1")).contains(Map.of("a", 1));
            assertThat(store.read(session, "events", "k2")).isEmpty();
            assertThat(store.read(session, "other", "k1")).isEmpty();
        }

        @Test
        @DisplayName("lists documents in key order")
        void listsInKeyOrder() {
            store.write(session, "events", "b", Map.of("n", 2));
            store.write(session, "events", "a", Map.of("n", 1));

            assertThat(store.list(session, "events")).containsExactly(Map.of("n", 1), Map.of("n", 2));
        }

        @Test
        @DisplayName("injected write failures do not persist")
        void injectedWriteFailures() {
            store.failNextWrites(1);

            assertThatThrownBy(() -> store.write(session, "events", "k", Map.of()))
                    .isInstanceOf(AdapterWriteException.class);
            assertThat(store.size("events")).isZero();
        }

        @Test
        @DisplayName("reads through a dead session fail")
        void deadSessionReadsFail() {
            store.disconnect(session);

            assertThatThrownBy(() -> store.list(session, "events")).isInstanceOf(AdapterReadException.class);
        }
    }

    @Nested
    @DisplayName("Topics")
    class Topics {

        @Test
        @DisplayName("notifies subscribers of writes to the collection until closed")
        void notifiesUntilClosed() {
            List<Map<String, Object>> received = new ArrayList<>();
            TopicSubscription subscription = store.subscribeTopic(session, "events", received::add);

            store.write(session, "events", "k1", Map.of("a", 1));
            store.write(session, "views", "v", Map.of("b", 2));
            subscription.close();
            store.write(session, "events", "k2", Map.of("a", 2));

            assertThat(received).containsExactly(Map.of("a", 1));
        }
    }
}
