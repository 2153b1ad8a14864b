package com.example.telemetry.realtime.gateway;

import com.example.telemetry.realtime.auth.AuthenticatedPrincipal;
import com.example.telemetry.shared.util.Constants;
import lombok.Getter;
import lombok.Setter;
import org.springframework.web.reactive.socket.CloseStatus;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-side state of one WebSocket connection.
 */
@Getter
public class GatewayConnection {

    private final String id;
    private final Constants.Channel channel;
    private final ConnectionOutbox outbox;
    private final Instant openedAt;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final Sinks.One<CloseStatus> closeSignal = Sinks.one();

    private final Disposable.Swap authTimeout = Disposables.swap();
    private final Disposable.Swap eventStream = Disposables.swap();
    private final Disposable.Swap reconnect = Disposables.swap();

    private final AtomicReference<Instant> lastPresenceSnapshotAt = new AtomicReference<>(Instant.EPOCH);
    private final AtomicReference<Instant> lastGlobalSnapshotAt = new AtomicReference<>(Instant.EPOCH);

    @Setter
    private volatile AuthenticatedPrincipal principal;
    @Setter
    private volatile Subscription subscription;
    @Setter
    private volatile Instant lastHeartbeatAt;
    private volatile CloseReason closeReason;

    public GatewayConnection(String id, Constants.Channel channel, ConnectionOutbox outbox, Instant openedAt) {
        this.id = id;
        this.channel = channel;
        this.outbox = outbox;
        this.openedAt = openedAt;
        this.lastHeartbeatAt = openedAt;
    }

    public ConnectionState getState() {
        return state.get();
    }

    /**
     * Moves to {@code target} if the state machine allows it from the current state.
     */
    public boolean transitionTo(ConnectionState target) {
        while (true) {
            ConnectionState current = state.get();
            if (!current.canTransitionTo(target)) {
                return false;
            }
            if (state.compareAndSet(current, target)) {
                return true;
            }
        }
    }

    /**
     * Records {@code timestamp} as the newest organization snapshot sent on this connection.
     * Returns false, recording nothing, if a newer one was already sent.
     */
    boolean advancePresenceSnapshot(Instant timestamp) {
        return advance(lastPresenceSnapshotAt, timestamp);
    }

    boolean advanceGlobalSnapshot(Instant timestamp) {
        return advance(lastGlobalSnapshotAt, timestamp);
    }

    private static boolean advance(AtomicReference<Instant> last, Instant timestamp) {
        if (timestamp == null) {
            return true;
        }
        while (true) {
            Instant current = last.get();
            if (timestamp.isBefore(current)) {
                return false;
            }
            if (last.compareAndSet(current, timestamp)) {
                return true;
            }
        }
    }

    /**
     * Returns the state the connection was in, or null if it was already closed.
     */
    ConnectionState markClosed(CloseReason reason) {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous == ConnectionState.CLOSED) {
            return null;
        }
        this.closeReason = reason;
        return previous;
    }

    void disposeResources() {
        authTimeout.dispose();
        eventStream.dispose();
        reconnect.dispose();
    }

    void signalClose(CloseStatus status) {
        closeSignal.tryEmitValue(status);
    }

    /**
     * Emits the close status once the gateway decided to close the connection.
     */
    public Mono<CloseStatus> closeStatus() {
        return closeSignal.asMono();
    }
}
