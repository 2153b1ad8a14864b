package com.example.telemetry.shared.events;

import com.example.telemetry.shared.config.MonitoringConfig;
import com.example.telemetry.shared.dto.PublishEventRequest;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.exception.TransientStoreException;
import com.example.telemetry.shared.model.AnalyticsEvent;
import com.example.telemetry.shared.model.AnalyticsEventType;
import com.example.telemetry.shared.model.EventMetadata;
import com.example.telemetry.shared.util.Constants;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes analytics events to their organization's channel and the global channel, and keeps the
 * replay buffers. Org-scoped subscriptions never see another organization's events.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsEventBus {

    private static final Logger securityLog = LoggerFactory.getLogger(Constants.SECURITY_LOGGER);

    private final EventBroker eventBroker;
    private final RecentEventBuffer recentEventBuffer;
    private final Clock clock;
    private final MonitoringConfig.TelemetryMetricsCollector metricsCollector;

    private final AtomicLong sequence = new AtomicLong();
    private Disposable bufferFeed;

    @PostConstruct
    public void start() {
        bufferFeed = eventBroker.subscribe(Constants.EventChannels.GLOBAL)
                .doOnNext(recentEventBuffer::add)
                .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofSeconds(30))
                        .doBeforeRetry(signal -> log.warn("Recent event feed lost, resubscribing (attempt {}): {}",
                                signal.totalRetries() + 1, signal.failure().getMessage())))
                .subscribe();
        log.info("Recent event buffer subscribed to {}", Constants.EventChannels.GLOBAL);
    }

    @PreDestroy
    public void stop() {
        if (bufferFeed != null && !bufferFeed.isDisposed()) {
            bufferFeed.dispose();
        }
    }

    /**
     * Stamps the event with an id and timestamp and publishes it. Best-effort: if the broker is unreachable
     * the event is logged and dropped rather than failing the producer.
     */
    public AnalyticsEvent publish(String organizationId, AnalyticsEventType type, Map<String, Object> payload, EventMetadata metadata) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new InvalidRequestException("organizationId must not be blank");
        }
        if (type == null) {
            throw new InvalidRequestException("event type is required");
        }

        Instant now = clock.instant();
        AnalyticsEvent event = AnalyticsEvent.builder()
                .id(nextEventId(now))
                .type(type)
                .organizationId(organizationId)
                .timestamp(now)
                .payload(payload == null ? Map.of() : payload)
                .metadata(metadata)
                .build();

        try {
            eventBroker.publish(Constants.EventChannels.forOrganization(organizationId), event);
            eventBroker.publish(Constants.EventChannels.GLOBAL, event);
            metricsCollector.incrementCounter("telemetry.events.published", "type", type.getWireName());
        } catch (TransientStoreException e) {
            log.warn("Dropping analytics event {} ({}) for org {}: {}", event.getId(), type.getWireName(), organizationId, e.getMessage());
            metricsCollector.incrementCounter("telemetry.events.dropped", "reason", "broker_unavailable");
        }
        return event;
    }

    public AnalyticsEvent publish(PublishEventRequest request) {
        AnalyticsEventType type = AnalyticsEventType.fromWireName(request.getType())
                .orElseThrow(() -> new InvalidRequestException("Unknown analytics event type: " + request.getType()));
        return publish(request.getOrganizationId(), type, request.getData(), request.getMetadata());
    }

    /**
     * Events of one organization. Anything else arriving on the channel is dropped and reported.
     */
    public Flux<AnalyticsEvent> subscribeOrganization(String organizationId) {
        return eventBroker.subscribe(Constants.EventChannels.forOrganization(organizationId))
                .filter(event -> {
                    if (organizationId.equals(event.getOrganizationId())) {
                        return true;
                    }
                    securityLog.warn("Dropped event {} of org {} on the channel of org {}",
                            event.getId(), event.getOrganizationId(), organizationId);
                    metricsCollector.incrementCounter("telemetry.events.isolation_drops");
                    return false;
                });
    }

    /**
     * Events of every organization. Only for super-admin consumers.
     */
    public Flux<AnalyticsEvent> subscribeGlobal() {
        return eventBroker.subscribe(Constants.EventChannels.GLOBAL);
    }

    public List<AnalyticsEvent> getRecent(String organizationId, int limit) {
        return recentEventBuffer.recent(organizationId, limit);
    }

    public List<AnalyticsEvent> getRecentGlobal(int limit) {
        return recentEventBuffer.recentGlobal(limit);
    }

    private String nextEventId(Instant now) {
        return "evt_" + Long.toString(now.toEpochMilli(), 36)
                + "_" + Long.toString(sequence.incrementAndGet(), 36)
                + "_" + Integer.toString(ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36), 36);
    }
}
