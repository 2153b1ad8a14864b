package com.example.telemetry.realtime.gateway;

import com.example.telemetry.shared.exception.SlowConsumerException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded outbound queue of one connection, drained at the pace the socket requests.
 *
 * Presence snapshots are coalesced so that at most one {@code update} and one {@code global} are queued.
 * Once the queue holds {@code degradeThreshold} messages the oldest analytics events are dropped and the
 * connection is degraded; more than {@code terminateThreshold} drops while degraded fail the offer with
 * {@link SlowConsumerException}. Draining below half the degrade threshold clears the degraded flag.
 * <p>
 * Control messages ({@code error}, {@code status}, {@code subscribed}, {@code recent}, {@code init}) are never
 * dropped, but they count towards the same limits: past the degrade threshold they degrade the connection, and
 * no connection may hold more than {@code degradeThreshold + terminateThreshold} queued messages.
 */
public class ConnectionOutbox {

    public enum OfferResult {
        ACCEPTED,
        /** Accepted, but the connection just became degraded. */
        DEGRADED,
        CLOSED
    }

    private final String connectionId;
    private final int degradeThreshold;
    private final int terminateThreshold;
    private final int capacity;
    private final Clock clock;
    private final Deque<ServerMessage> queue = new ArrayDeque<>();

    private FluxSink<ServerMessage> sink;
    private boolean draining;
    private boolean completing;
    private boolean completed;
    private boolean degraded;
    private long droppedWhileDegraded;
    private long droppedTotal;

    public ConnectionOutbox(String connectionId, int degradeThreshold, int terminateThreshold, Clock clock) {
        this.connectionId = connectionId;
        this.degradeThreshold = degradeThreshold;
        this.terminateThreshold = terminateThreshold;
        this.capacity = degradeThreshold + terminateThreshold;
        this.clock = clock;
    }

    /**
     * @throws SlowConsumerException when the connection has dropped too many events while degraded,
     *                               or its queue is full
     */
    public synchronized OfferResult offer(ServerMessage message) {
        if (completing) {
            return OfferResult.CLOSED;
        }

        ServerMessage.Type type = message.getType();
        if (type.isCoalesced()) {
            queue.removeIf(queued -> queued.getType() == type);
            queue.addLast(message);
            drain();
            return OfferResult.ACCEPTED;
        }
        if (type != ServerMessage.Type.EVENT) {
            if (queue.size() >= capacity) {
                throw SlowConsumerException.queueFull(connectionId, queue.size());
            }
            queue.addLast(message);
            OfferResult result = queue.size() > degradeThreshold ? degrade() : OfferResult.ACCEPTED;
            drain();
            return result;
        }

        OfferResult result = OfferResult.ACCEPTED;
        boolean admitted = true;
        if (queue.size() >= degradeThreshold) {
            admitted = dropOldestEvent();
            droppedWhileDegraded++;
            droppedTotal++;
            result = degrade();
            if (droppedWhileDegraded > terminateThreshold) {
                throw new SlowConsumerException(connectionId, droppedWhileDegraded);
            }
        }
        if (admitted) {
            queue.addLast(message);
        }
        drain();
        return result;
    }

    /**
     * Single-subscriber stream of queued messages. Completes once {@link #complete()} was called
     * and everything queued before it has been emitted.
     */
    public Flux<ServerMessage> asFlux() {
        return Flux.create(emitter -> {
            synchronized (this) {
                if (sink != null) {
                    emitter.error(new IllegalStateException("Outbox of connection " + connectionId + " already has a subscriber"));
                    return;
                }
                sink = emitter;
            }
            emitter.onRequest(requested -> drain());
            emitter.onCancel(this::discard);
            drain();
        });
    }

    /**
     * Accepts no further messages; the stream completes after the already queued ones are flushed.
     */
    public synchronized void complete() {
        completing = true;
        drain();
    }

    public synchronized boolean isDegraded() {
        return degraded;
    }

    public synchronized long getDroppedTotal() {
        return droppedTotal;
    }

    public synchronized int size() {
        return queue.size();
    }

    /**
     * Messages queued but not yet taken by the socket, oldest first.
     */
    public synchronized List<ServerMessage> pending() {
        return List.copyOf(queue);
    }

    private synchronized void drain() {
        if (sink == null || draining || completed) {
            return;
        }
        draining = true;
        try {
            while (!queue.isEmpty() && sink.requestedFromDownstream() > 0) {
                sink.next(queue.pollFirst());
                if (degraded && queue.size() < degradeThreshold / 2) {
                    degraded = false;
                    droppedWhileDegraded = 0;
                }
            }
            if (completing && queue.isEmpty()) {
                completed = true;
                sink.complete();
            }
        } finally {
            draining = false;
        }
    }

    private OfferResult degrade() {
        if (degraded) {
            return OfferResult.ACCEPTED;
        }
        degraded = true;
        queue.addLast(ServerMessage.status("degraded", clock.instant()));
        return OfferResult.DEGRADED;
    }

    private boolean dropOldestEvent() {
        Iterator<ServerMessage> iterator = queue.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getType() == ServerMessage.Type.EVENT) {
                iterator.remove();
                return true;
            }
        }
        // Nothing droppable queued: the incoming event is the one that goes
        return false;
    }

    private synchronized void discard() {
        completing = true;
        completed = true;
        queue.clear();
    }
}
