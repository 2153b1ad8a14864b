package com.example.telemetry.realtime.kafka;

import com.example.telemetry.shared.dto.PublishEventRequest;
import com.example.telemetry.shared.events.AnalyticsEventBus;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.exception.MessageProcessingException;
import com.example.telemetry.shared.model.AnalyticsEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Service;

/**
 * Publishes analytics events produced by other services onto the event bus.
 * Invalid records go straight to the dead-letter topic; other failures are retried first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsEventIngestConsumer {

    private final AnalyticsEventBus analyticsEventBus;

    @KafkaListener(
        topics = "${telemetry.kafka.topic.name-analytics-events:telemetry-analytics-events}",
        groupId = "${telemetry.kafka.consumer.group-analytics:telemetry-analytics-ingest}",
        containerFactory = "kafkaListenerContainerFactory",
        autoStartup = "${telemetry.kafka.consumer.enabled:true}"
    )
    public void ingest(@Payload PublishEventRequest request,
                       Acknowledgment acknowledgment,
                       @Header(KafkaHeaders.RECEIVED_TOPIC) String topic,
                       @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
                       @Header(KafkaHeaders.OFFSET) long offset) {

        log.debug("Ingest received event. [Topic: {}, Partition: {}, Offset: {}] Type: {}, org: {}",
                topic, partition, offset, request.getType(), request.getOrganizationId());

        try {
            AnalyticsEvent event = analyticsEventBus.publish(request);
            log.debug("Ingested {} as event {}", request.getType(), event.getId());
            acknowledgment.acknowledge();
        } catch (InvalidRequestException e) {
            log.warn("Rejecting invalid analytics event at offset {}: {}", offset, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Failed to ingest analytics event. Root cause: {}", e.getMessage(), e);
            throw new MessageProcessingException("Failed to ingest analytics event", e, request);
        }
    }
}
