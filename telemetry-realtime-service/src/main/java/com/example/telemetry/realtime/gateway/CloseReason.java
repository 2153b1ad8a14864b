package com.example.telemetry.realtime.gateway;

import org.springframework.web.reactive.socket.CloseStatus;

public enum CloseReason {
    NORMAL(1000, "normal closure"),
    SERVER_SHUTDOWN(1001, "server shutdown"),
    INTERNAL_ERROR(1011, "internal error"),
    AUTH_ERROR(4401, "authentication failed"),
    TENANT_ISOLATION(4403, "forbidden"),
    HEARTBEAT_TIMEOUT(4408, "heartbeat timeout"),
    SLOW_CONSUMER(4429, "slow consumer");

    private final int code;
    private final String reason;

    CloseReason(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int getCode() {
        return code;
    }

    public String getReason() {
        return reason;
    }

    public CloseStatus toCloseStatus() {
        return new CloseStatus(code, reason);
    }
}
