package com.example.telemetry.shared.events;

import com.example.telemetry.shared.model.AnalyticsEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process broker for single-instance deployments. Also used by {@link RedisEventBroker}
 * to fan messages received from Redis out to local subscribers.
 */
@Component
@Profile("!redis")
@Slf4j
public class LocalEventBroker implements EventBroker {

    private final Map<String, Sinks.Many<AnalyticsEvent>> sinks = new ConcurrentHashMap<>();

    @Override
    public void publish(String channel, AnalyticsEvent event) {
        Sinks.Many<AnalyticsEvent> sink = sinks.get(channel);
        if (sink == null) {
            return;
        }
        Sinks.EmitResult result;
        // Sinks reject concurrent emission; serializing here keeps per-producer order intact
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Event {} not delivered on channel {}: {}", event.getId(), channel, result);
        }
    }

    @Override
    public Flux<AnalyticsEvent> subscribe(String channel) {
        return sinkFor(channel).asFlux();
    }

    int channelCount() {
        return sinks.size();
    }

    private Sinks.Many<AnalyticsEvent> sinkFor(String channel) {
        return sinks.computeIfAbsent(channel, key -> Sinks.many().multicast().directBestEffort());
    }
}
