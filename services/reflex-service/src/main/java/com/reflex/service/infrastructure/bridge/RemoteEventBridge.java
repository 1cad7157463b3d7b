package com.reflex.service.infrastructure.bridge;

import com.reflex.common.ReflexException;
import com.reflex.mesh.EventMesh;
import com.reflex.store.TopicSubscription;
import com.reflex.supervisor.ConnectionSupervisor;
import com.reflex.supervisor.SessionState;
import com.reflex.supervisor.StateTransition;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Keeps the mesh subscribed to events written by other processes.
 *
 * <p>Subscribes once the application is ready and again after every reconnect, since a topic
 * subscription does not survive the session it was opened on. A failed subscription is logged and
 * retried on the next reconnect; it never blocks startup.
 */
@Component
public class RemoteEventBridge {

    private static final Logger log = LoggerFactory.getLogger(RemoteEventBridge.class);

    private final EventMesh mesh;
    private final ConnectionSupervisor supervisor;
    private TopicSubscription subscription;
    private boolean closed;

    public RemoteEventBridge(EventMesh mesh, ConnectionSupervisor supervisor) {
        this.mesh = mesh;
        this.supervisor = supervisor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        supervisor.onStateChange(this::onStateChange);
        bridge();
    }

    void onStateChange(StateTransition transition) {
        if (transition.from() == SessionState.RECONNECTING && transition.to() == SessionState.CONNECTED) {
            bridge();
        }
    }

    synchronized boolean isBridged() {
        return subscription != null;
    }

    synchronized void bridge() {
        if (closed) {
            return;
        }
        closeSubscription();
        try {
            subscription = mesh.bridgeRemoteEvents();
        } catch (ReflexException e) {
            log.warn("Remote events are not bridged until the next reconnect: {}", e.getMessage());
        }
    }

    @PreDestroy
    public synchronized void close() {
        closed = true;
        closeSubscription();
    }

    private void closeSubscription() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }
}
