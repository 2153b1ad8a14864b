package com.example.telemetry.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * An analytics event as fanned out to subscribers. Immutable once published.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalyticsEvent {
    String id;
    AnalyticsEventType type;
    String organizationId;
    Instant timestamp;
    Map<String, Object> payload;
    EventMetadata metadata;
}
