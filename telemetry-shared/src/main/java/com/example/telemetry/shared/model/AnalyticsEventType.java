package com.example.telemetry.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of analytics event types. Subscription filters are sets of these, never patterns.
 */
public enum AnalyticsEventType {
    MEETING_STARTED("meeting:started"),
    MEETING_ENDED("meeting:ended"),
    MEETING_PARTICIPANT_JOINED("meeting:participant_joined"),
    MEETING_PARTICIPANT_LEFT("meeting:participant_left"),
    TRANSCRIPTION_STARTED("transcription:started"),
    TRANSCRIPTION_PROGRESS("transcription:progress"),
    TRANSCRIPTION_COMPLETED("transcription:completed"),
    TRANSCRIPTION_FAILED("transcription:failed"),
    AI_PROCESSING_STARTED("ai:processing_started"),
    AI_PROCESSING_COMPLETED("ai:processing_completed"),
    AI_INSIGHT_GENERATED("ai:insight_generated"),
    USER_LOGIN("user:login"),
    USER_LOGOUT("user:logout"),
    USER_ACTIVITY("user:activity"),
    API_REQUEST("api:request"),
    API_ERROR("api:error"),
    INTEGRATION_SYNC_STARTED("integration:sync_started"),
    INTEGRATION_SYNC_COMPLETED("integration:sync_completed"),
    INTEGRATION_ERROR("integration:error"),
    BILLING_PAYMENT_RECEIVED("billing:payment_received"),
    BILLING_SUBSCRIPTION_CHANGED("billing:subscription_changed"),
    ALERT_TRIGGERED("alert:triggered"),
    SYSTEM_HEALTH_CHANGE("system:health_change");

    private static final Map<String, AnalyticsEventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(AnalyticsEventType::getWireName, Function.identity()));

    private final String wireName;

    AnalyticsEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<AnalyticsEventType> fromWireName(String wireName) {
        return Optional.ofNullable(wireName == null ? null : BY_WIRE_NAME.get(wireName));
    }

    @JsonCreator
    static AnalyticsEventType fromJson(String wireName) {
        return fromWireName(wireName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown analytics event type: " + wireName));
    }
}
