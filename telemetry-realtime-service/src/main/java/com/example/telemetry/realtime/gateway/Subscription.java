package com.example.telemetry.realtime.gateway;

import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.model.AnalyticsEvent;
import com.example.telemetry.shared.model.AnalyticsEventType;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * What an analytics connection listens to: one organization or all of them, optionally narrowed
 * to a set of event types. An empty filter set means every type.
 */
public final class Subscription {

    public enum Scope {
        ORGANIZATION,
        GLOBAL
    }

    private final Scope scope;
    private final String organizationId;
    private final EnumSet<AnalyticsEventType> eventTypes;

    private Subscription(Scope scope, String organizationId, EnumSet<AnalyticsEventType> eventTypes) {
        this.scope = scope;
        this.organizationId = organizationId;
        this.eventTypes = eventTypes;
    }

    public static Subscription organization(String organizationId, Collection<AnalyticsEventType> eventTypes) {
        return new Subscription(Scope.ORGANIZATION, organizationId, copyOf(eventTypes));
    }

    public static Subscription global(Collection<AnalyticsEventType> eventTypes) {
        return new Subscription(Scope.GLOBAL, null, copyOf(eventTypes));
    }

    /**
     * @throws InvalidRequestException for an unknown scope or event type
     */
    public static Scope parseScope(String scope) {
        if (scope == null || scope.isBlank()) {
            return Scope.ORGANIZATION;
        }
        try {
            return Scope.valueOf(scope.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown subscription scope: " + scope);
        }
    }

    public static Set<AnalyticsEventType> parseEventTypes(List<String> wireNames) {
        EnumSet<AnalyticsEventType> types = EnumSet.noneOf(AnalyticsEventType.class);
        if (wireNames == null) {
            return types;
        }
        for (String wireName : wireNames) {
            types.add(AnalyticsEventType.fromWireName(wireName)
                    .orElseThrow(() -> new InvalidRequestException("Unknown event type: " + wireName)));
        }
        return types;
    }

    public boolean matches(AnalyticsEvent event) {
        return eventTypes.isEmpty() || eventTypes.contains(event.getType());
    }

    /**
     * Whether both subscriptions read the same underlying stream, regardless of filters.
     */
    public boolean sameStreamAs(Subscription other) {
        return other != null && scope == other.scope
                && (scope == Scope.GLOBAL || organizationId.equals(other.organizationId));
    }

    public Scope getScope() {
        return scope;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public Set<AnalyticsEventType> getEventTypes() {
        return EnumSet.copyOf(eventTypes);
    }

    /**
     * Body of the {@code subscribed} acknowledgment.
     */
    public Map<String, Object> describe() {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("scope", scope.name().toLowerCase(Locale.ROOT));
        if (organizationId != null) {
            description.put("organizationId", organizationId);
        }
        description.put("eventTypes", eventTypes.stream().map(AnalyticsEventType::getWireName).toList());
        return description;
    }

    private static EnumSet<AnalyticsEventType> copyOf(Collection<AnalyticsEventType> eventTypes) {
        return eventTypes == null || eventTypes.isEmpty()
                ? EnumSet.noneOf(AnalyticsEventType.class)
                : EnumSet.copyOf(eventTypes);
    }
}
