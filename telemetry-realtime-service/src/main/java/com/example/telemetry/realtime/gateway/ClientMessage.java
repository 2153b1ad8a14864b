package com.example.telemetry.realtime.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inbound frame. Which fields are meaningful depends on {@code type}:
 * {@code auth} (token), {@code subscribe} (eventTypes, scope, organizationId, recent),
 * {@code getRecent} (limit) and {@code heartbeat}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientMessage {

    public static final String AUTH = "auth";
    public static final String SUBSCRIBE = "subscribe";
    public static final String GET_RECENT = "getRecent";
    public static final String HEARTBEAT = "heartbeat";

    private String type;
    private String token;
    private List<String> eventTypes;
    private String scope;
    private String organizationId;
    private Integer recent;
    private Integer limit;
}
