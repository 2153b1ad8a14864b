package com.example.telemetry.shared.exception;

import lombok.Getter;

@Getter
public class SlowConsumerException extends TelemetryException {

    private final String connectionId;
    private final long droppedEvents;

    public SlowConsumerException(String connectionId, long droppedEvents) {
        this(connectionId, droppedEvents,
                "Connection " + connectionId + " fell behind; " + droppedEvents + " events dropped while degraded");
    }

    private SlowConsumerException(String connectionId, long droppedEvents, String message) {
        super(message);
        this.connectionId = connectionId;
        this.droppedEvents = droppedEvents;
    }

    /**
     * The connection's outbound queue is full of messages that cannot be dropped.
     */
    public static SlowConsumerException queueFull(String connectionId, int queued) {
        return new SlowConsumerException(connectionId, 0,
                "Connection " + connectionId + " fell behind; outbound queue full with " + queued + " messages");
    }
}
