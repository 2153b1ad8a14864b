package com.example.telemetry.realtime.gateway;

import com.example.telemetry.shared.util.Constants;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

@Configuration
public class WebSocketConfig {

    public static final String PRESENCE_PATH = "/ws/presence";
    public static final String ANALYTICS_PATH = "/ws/analytics";

    @Bean
    public HandlerMapping webSocketHandlerMapping(RealtimeGateway realtimeGateway, ObjectMapper objectMapper) {
        Map<String, WebSocketHandler> handlers = Map.of(
                PRESENCE_PATH, new RealtimeWebSocketHandler(Constants.Channel.PRESENCE, realtimeGateway, objectMapper),
                ANALYTICS_PATH, new RealtimeWebSocketHandler(Constants.Channel.ANALYTICS, realtimeGateway, objectMapper));
        // Ahead of the annotated controllers
        return new SimpleUrlHandlerMapping(handlers, -1);
    }

    /**
     * Auth timeouts and reconnect backoff.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler gatewayTimerScheduler() {
        return Schedulers.newParallel("gateway-timer-", 2);
    }
}
