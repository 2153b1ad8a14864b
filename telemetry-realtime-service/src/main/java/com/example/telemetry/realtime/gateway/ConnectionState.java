package com.example.telemetry.realtime.gateway;

/**
 * Lifecycle of a gateway connection. RECONNECTING re-enters through SUBSCRIBED; every state may close.
 */
public enum ConnectionState {
    CONNECTING,
    AUTHENTICATED,
    SUBSCRIBED,
    ACTIVE,
    RECONNECTING,
    CLOSED;

    public boolean canTransitionTo(ConnectionState target) {
        if (target == CLOSED) {
            return this != CLOSED;
        }
        return switch (this) {
            case CONNECTING -> target == AUTHENTICATED;
            case AUTHENTICATED -> target == SUBSCRIBED;
            case SUBSCRIBED -> target == ACTIVE || target == RECONNECTING;
            case ACTIVE -> target == RECONNECTING;
            case RECONNECTING -> target == SUBSCRIBED;
            case CLOSED -> false;
        };
    }

    /**
     * States in which the connection holds a presence entry.
     */
    public boolean isRegistered() {
        return this == SUBSCRIBED || this == ACTIVE || this == RECONNECTING;
    }
}
