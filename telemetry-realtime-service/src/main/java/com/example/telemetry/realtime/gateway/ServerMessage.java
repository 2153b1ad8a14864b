package com.example.telemetry.realtime.gateway;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Outbound frame: {@code {"type":..., "data":..., "timestamp":...}}.
 */
@Value
public class ServerMessage {

    Type type;
    Object data;
    Instant timestamp;

    public enum Type {
        INIT("init"),
        UPDATE("update"),
        GLOBAL("global"),
        SUBSCRIBED("subscribed"),
        EVENT("event"),
        RECENT("recent"),
        STATUS("status"),
        ERROR("error");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }

        /**
         * Presence snapshots supersede each other; only the newest one queued for a connection matters.
         */
        public boolean isCoalesced() {
            return this == UPDATE || this == GLOBAL;
        }
    }

    public static ServerMessage of(Type type, Object data, Instant timestamp) {
        return new ServerMessage(type, data, timestamp);
    }

    public static ServerMessage status(String state, Instant timestamp) {
        return new ServerMessage(Type.STATUS, Map.of("state", state), timestamp);
    }

    public static ServerMessage error(String message, Instant timestamp) {
        return new ServerMessage(Type.ERROR, Map.of("message", message), timestamp);
    }
}
