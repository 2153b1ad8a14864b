package com.example.telemetry.realtime.gateway;

import com.example.telemetry.realtime.auth.JwtBearerTokenVerifier;
import com.example.telemetry.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * Binds a WebSocket session to a gateway connection on one channel. Outbound frames come from the
 * connection's outbox; the close frame is sent only after the outbox has been flushed.
 */
@Slf4j
public class RealtimeWebSocketHandler implements WebSocketHandler {

    private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(5);

    private final Constants.Channel channel;
    private final RealtimeGateway gateway;
    private final ObjectMapper objectMapper;

    public RealtimeWebSocketHandler(Constants.Channel channel, RealtimeGateway gateway, ObjectMapper objectMapper) {
        this.channel = channel;
        this.gateway = gateway;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        GatewayConnection connection = gateway.open(channel, session.getId());
        String handshakeToken = handshakeToken(session.getHandshakeInfo());
        Sinks.Empty<Void> flushed = Sinks.empty();

        Mono<Void> output = session.send(connection.getOutbox().asFlux()
                        .map(message -> session.textMessage(encode(message))))
                .onErrorResume(e -> {
                    log.debug("Send on connection {} ended with error: {}", connection.getId(), e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> flushed.tryEmitEmpty());

        Mono<Void> authentication = handshakeToken == null
                ? Mono.empty()
                : gateway.authenticateAsync(connection, handshakeToken);

        Mono<Void> input = authentication
                .thenMany(session.receive()
                        .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                        .map(WebSocketMessage::getPayloadAsText)
                        .concatMap(text -> gateway.onMessage(connection, text)))
                .then()
                .doFinally(signal -> gateway.disconnect(connection));

        Mono<Void> closer = connection.closeStatus()
                .flatMap(status -> flushed.asMono()
                        .timeout(FLUSH_TIMEOUT, Mono.empty())
                        .then(session.close(status)));

        return Mono.when(output, input, closer);
    }

    private String encode(ServerMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unserializable " + message.getType().getWireName() + " message", e);
        }
    }

    /**
     * Bearer token from the {@code Authorization} header, else from the {@code token} query parameter.
     */
    static String handshakeToken(HandshakeInfo handshakeInfo) {
        String fromHeader = JwtBearerTokenVerifier.extractBearer(handshakeInfo.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        if (fromHeader != null) {
            return fromHeader;
        }
        String fromQuery = UriComponentsBuilder.fromUri(handshakeInfo.getUri()).build().getQueryParams().getFirst("token");
        return fromQuery == null || fromQuery.isBlank() ? null : fromQuery;
    }
}
