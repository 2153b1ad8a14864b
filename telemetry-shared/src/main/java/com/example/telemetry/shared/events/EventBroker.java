package com.example.telemetry.shared.events;

import com.example.telemetry.shared.model.AnalyticsEvent;
import reactor.core.publisher.Flux;

/**
 * Channel-based fanout of analytics events. Delivery is at-most-once and best-effort;
 * events published by one producer on one channel arrive in publish order.
 */
public interface EventBroker {

    /**
     * @throws com.example.telemetry.shared.exception.TransientStoreException if the broker cannot be reached
     */
    void publish(String channel, AnalyticsEvent event);

    /**
     * Hot stream of events published on {@code channel} after subscription. Errors with
     * {@link com.example.telemetry.shared.exception.TransientStoreException} when the broker subscription fails.
     */
    Flux<AnalyticsEvent> subscribe(String channel);
}
