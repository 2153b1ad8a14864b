package com.example.telemetry.realtime.gateway;

import com.example.telemetry.realtime.auth.AuthenticatedPrincipal;
import com.example.telemetry.realtime.auth.JwtBearerTokenVerifier;
import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.config.MonitoringConfig;
import com.example.telemetry.shared.dto.GlobalPresenceSnapshot;
import com.example.telemetry.shared.dto.PresenceSnapshot;
import com.example.telemetry.shared.events.AnalyticsEventBus;
import com.example.telemetry.shared.exception.AuthException;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.exception.SlowConsumerException;
import com.example.telemetry.shared.exception.TenantIsolationViolationException;
import com.example.telemetry.shared.exception.TransientStoreException;
import com.example.telemetry.shared.model.AnalyticsEvent;
import com.example.telemetry.shared.model.AnalyticsEventType;
import com.example.telemetry.shared.presence.ConnectionRegistry;
import com.example.telemetry.shared.presence.PresenceSnapshotService;
import com.example.telemetry.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Owns every WebSocket connection of this instance and drives its state machine:
 * authentication, subscription, presence registration, event delivery, reconnection and close.
 *
 * Blocking store calls run on the presence I/O scheduler; timeouts and reconnect backoff run on the timer scheduler.
 */
@Service
@Slf4j
public class RealtimeGateway {

    private static final Logger securityLog = LoggerFactory.getLogger(Constants.SECURITY_LOGGER);
    private static final int DEFAULT_RECENT_LIMIT = 50;

    private final ConnectionRegistry connectionRegistry;
    private final PresenceSnapshotService presenceSnapshotService;
    private final AnalyticsEventBus analyticsEventBus;
    private final JwtBearerTokenVerifier tokenVerifier;
    private final AppProperties appProperties;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final MonitoringConfig.TelemetryMetricsCollector metricsCollector;
    private final Scheduler ioScheduler;
    private final Scheduler timerScheduler;

    private final Map<String, GatewayConnection> connections = new ConcurrentHashMap<>();

    public RealtimeGateway(ConnectionRegistry connectionRegistry,
                           PresenceSnapshotService presenceSnapshotService,
                           AnalyticsEventBus analyticsEventBus,
                           JwtBearerTokenVerifier tokenVerifier,
                           AppProperties appProperties,
                           Clock clock,
                           ObjectMapper objectMapper,
                           MonitoringConfig.TelemetryMetricsCollector metricsCollector,
                           @Qualifier("presenceIoScheduler") Scheduler ioScheduler,
                           @Qualifier("gatewayTimerScheduler") Scheduler timerScheduler) {
        this.connectionRegistry = connectionRegistry;
        this.presenceSnapshotService = presenceSnapshotService;
        this.analyticsEventBus = analyticsEventBus;
        this.tokenVerifier = tokenVerifier;
        this.appProperties = appProperties;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.metricsCollector = metricsCollector;
        this.ioScheduler = ioScheduler;
        this.timerScheduler = timerScheduler;
    }

    /**
     * Accepts a new connection in CONNECTING. It is closed with an auth error unless it authenticates
     * within the configured timeout.
     */
    public GatewayConnection open(Constants.Channel channel, String connectionId) {
        AppProperties.Gateway gateway = appProperties.getGateway();
        ConnectionOutbox outbox = new ConnectionOutbox(connectionId, gateway.getDegradeThreshold(), gateway.getTerminateThreshold(), clock);
        GatewayConnection connection = new GatewayConnection(connectionId, channel, outbox, clock.instant());
        connections.put(connectionId, connection);

        connection.getAuthTimeout().update(Mono.delay(gateway.getAuthTimeout(), timerScheduler)
                .subscribe(tick -> onAuthTimeout(connection)));

        metricsCollector.setGauge("telemetry.gateway.connections", connections.size());
        log.debug("Opened {} connection {}", channel, connectionId);
        return connection;
    }

    /**
     * Authenticates with a bearer token. A bad token closes the connection before anything is sent to it.
     */
    public void authenticate(GatewayConnection connection, String token) {
        if (connection.getState() != ConnectionState.CONNECTING) {
            deliver(connection, ServerMessage.error("Already authenticated", clock.instant()));
            return;
        }

        AuthenticatedPrincipal principal;
        try {
            principal = tokenVerifier.verify(token);
        } catch (AuthException e) {
            log.warn("Authentication failed for {} connection {}: {}", connection.getChannel(), connection.getId(), e.getMessage());
            close(connection, CloseReason.AUTH_ERROR);
            return;
        }

        connection.setPrincipal(principal);
        if (!connection.transitionTo(ConnectionState.AUTHENTICATED)) {
            // Closed in the meantime, typically by the auth timeout
            return;
        }
        connection.getAuthTimeout().dispose();
        log.info("Connection {} authenticated as user {} of org {} ({})",
                connection.getId(), principal.userId(), principal.organizationId(), principal.role());

        if (connection.getChannel() == Constants.Channel.PRESENCE) {
            subscribeOrReconnect(connection, 0);
        }
    }

    public Mono<Void> authenticateAsync(GatewayConnection connection, String token) {
        return Mono.fromRunnable(() -> authenticate(connection, token))
                .subscribeOn(ioScheduler)
                .then();
    }

    /**
     * Handles one client text frame. Protocol errors are reported to the client, isolation violations
     * and unauthenticated traffic close the connection.
     */
    public void handleMessage(GatewayConnection connection, String text) {
        if (connection.getState() == ConnectionState.CLOSED) {
            return;
        }

        ClientMessage message;
        try {
            message = objectMapper.readValue(text, ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.debug("Malformed frame on connection {}: {}", connection.getId(), e.getOriginalMessage());
            deliver(connection, ServerMessage.error("Malformed message", clock.instant()));
            return;
        }

        String type = message.getType() == null ? "" : message.getType();
        if (connection.getState() == ConnectionState.CONNECTING && !ClientMessage.AUTH.equals(type)) {
            log.warn("Connection {} sent '{}' before authenticating", connection.getId(), type);
            close(connection, CloseReason.AUTH_ERROR);
            return;
        }

        try {
            switch (type) {
                case ClientMessage.AUTH -> authenticate(connection, message.getToken());
                case ClientMessage.SUBSCRIBE -> subscribe(connection, message);
                case ClientMessage.GET_RECENT -> sendRecent(connection, message.getLimit());
                case ClientMessage.HEARTBEAT -> heartbeat(connection);
                default -> deliver(connection, ServerMessage.error("Unknown message type: " + type, clock.instant()));
            }
        } catch (TenantIsolationViolationException e) {
            securityLog.warn("Tenant isolation violation on connection {}: user={} org={} requested={}",
                    connection.getId(), e.getUserId(), e.getOwnOrganizationId(), e.getRequestedOrganizationId());
            metricsCollector.incrementCounter("telemetry.security.isolation_violations", "source", "gateway");
            close(connection, CloseReason.TENANT_ISOLATION);
        } catch (InvalidRequestException e) {
            deliver(connection, ServerMessage.error(e.getMessage(), clock.instant()));
        } catch (TransientStoreException e) {
            log.warn("Store unavailable while handling '{}' on connection {}: {}", type, connection.getId(), e.getMessage());
            deliver(connection, ServerMessage.error("Temporarily unavailable, retry shortly", clock.instant()));
        }
    }

    public Mono<Void> onMessage(GatewayConnection connection, String text) {
        return Mono.fromRunnable(() -> handleMessage(connection, text))
                .subscribeOn(ioScheduler)
                .onErrorResume(e -> {
                    log.error("Unexpected failure handling a frame on connection {}", connection.getId(), e);
                    close(connection, CloseReason.INTERNAL_ERROR);
                    return Mono.empty();
                })
                .then();
    }

    /**
     * The client went away.
     */
    public void disconnect(GatewayConnection connection) {
        close(connection, CloseReason.NORMAL);
    }

    /**
     * Moves the connection to CLOSED, releases its subscriptions and presence entry, and flushes its outbox
     * before the close frame with {@code reason} is sent. Closing twice is a no-op.
     */
    public void close(GatewayConnection connection, CloseReason reason) {
        ConnectionState previous = connection.markClosed(reason);
        if (previous == null) {
            return;
        }
        connection.disposeResources();
        connections.remove(connection.getId());

        if (previous.isRegistered()) {
            AuthenticatedPrincipal principal = connection.getPrincipal();
            Mono.fromRunnable(() -> connectionRegistry.unregister(principal.organizationId(), connection.getId()))
                    .subscribeOn(ioScheduler)
                    .subscribe(ignored -> { },
                            e -> log.warn("Failed to unregister presence of connection {}, leaving it to the stale sweep: {}",
                                    connection.getId(), e.getMessage()));
        }

        connection.getOutbox().complete();
        connection.signalClose(reason.toCloseStatus());
        releaseOrganizationIfUnwatched(connection);

        metricsCollector.incrementCounter("telemetry.gateway.closed", "reason", reason.name().toLowerCase(Locale.ROOT));
        metricsCollector.setGauge("telemetry.gateway.connections", connections.size());
        if (reason == CloseReason.NORMAL) {
            log.debug("Connection {} closed ({})", connection.getId(), previous);
        } else {
            log.info("Connection {} closed with {} {} (was {})", connection.getId(), reason.getCode(), reason, previous);
        }
    }

    private void releaseOrganizationIfUnwatched(GatewayConnection closed) {
        AuthenticatedPrincipal principal = closed.getPrincipal();
        if (closed.getChannel() != Constants.Channel.PRESENCE || principal == null) {
            return;
        }
        String organizationId = principal.organizationId();
        boolean watched = connections.values().stream()
                .anyMatch(connection -> connection.getChannel() == Constants.Channel.PRESENCE
                        && connection.getPrincipal() != null
                        && organizationId.equals(connection.getPrincipal().organizationId()));
        if (!watched) {
            presenceSnapshotService.releaseOrganization(organizationId);
        }
    }

    public Set<String> subscribedOrganizations() {
        return connections.values().stream()
                .filter(connection -> connection.getChannel() == Constants.Channel.PRESENCE)
                .filter(connection -> connection.getState() == ConnectionState.ACTIVE)
                .map(connection -> connection.getPrincipal().organizationId())
                .collect(Collectors.toSet());
    }

    public boolean hasGlobalPresenceSubscribers() {
        return connections.values().stream()
                .anyMatch(connection -> connection.getChannel() == Constants.Channel.PRESENCE
                        && connection.getState() == ConnectionState.ACTIVE
                        && connection.getPrincipal().isSuperAdmin());
    }

    public void deliverPresenceUpdate(PresenceSnapshot snapshot) {
        ServerMessage message = ServerMessage.of(ServerMessage.Type.UPDATE, snapshot, clock.instant());
        for (GatewayConnection connection : connections.values()) {
            if (connection.getChannel() == Constants.Channel.PRESENCE
                    && connection.getState() == ConnectionState.ACTIVE
                    && snapshot.getOrganizationId().equals(connection.getPrincipal().organizationId())) {
                deliverSnapshot(connection, message, connection.advancePresenceSnapshot(snapshot.getTimestamp()));
            }
        }
    }

    public void deliverGlobalBreakdown(GlobalPresenceSnapshot snapshot) {
        ServerMessage message = ServerMessage.of(ServerMessage.Type.GLOBAL, snapshot, clock.instant());
        for (GatewayConnection connection : connections.values()) {
            if (connection.getChannel() == Constants.Channel.PRESENCE
                    && connection.getState() == ConnectionState.ACTIVE
                    && connection.getPrincipal().isSuperAdmin()) {
                deliverSnapshot(connection, message, connection.advanceGlobalSnapshot(snapshot.getTimestamp()));
            }
        }
    }

    // A snapshot computed before the one the connection already holds is stale for it
    private void deliverSnapshot(GatewayConnection connection, ServerMessage message, boolean newest) {
        if (newest) {
            deliver(connection, message);
        } else {
            log.debug("Skipping stale {} snapshot for connection {}", message.getType().getWireName(), connection.getId());
        }
    }

    /**
     * Closes connections that have not sent a heartbeat within the heartbeat timeout.
     */
    @Scheduled(fixedDelayString = "${telemetry.gateway.idle-check-interval-ms:5000}")
    public int reapIdleConnections() {
        Instant cutoff = clock.instant().minus(appProperties.getPresence().getHeartbeatTimeout());
        int reaped = 0;
        for (GatewayConnection connection : List.copyOf(connections.values())) {
            if (connection.getLastHeartbeatAt().isBefore(cutoff)) {
                log.info("Connection {} idle since {}, closing", connection.getId(), connection.getLastHeartbeatAt());
                close(connection, CloseReason.HEARTBEAT_TIMEOUT);
                reaped++;
            }
        }
        return reaped;
    }

    @PreDestroy
    public void shutdown() {
        if (connections.isEmpty()) {
            return;
        }
        log.info("Sending shutdown notice to {} connections...", connections.size());
        Instant now = clock.instant();
        for (GatewayConnection connection : List.copyOf(connections.values())) {
            deliver(connection, ServerMessage.status("server_shutdown", now));
            close(connection, CloseReason.SERVER_SHUTDOWN);
        }
        log.info("Gateway shutdown complete.");
    }

    public Map<String, Object> stats() {
        Map<Constants.Channel, Long> byChannel = new EnumMap<>(Constants.Channel.class);
        Map<ConnectionState, Long> byState = new EnumMap<>(ConnectionState.class);
        long degraded = 0;
        for (GatewayConnection connection : connections.values()) {
            byChannel.merge(connection.getChannel(), 1L, Long::sum);
            byState.merge(connection.getState(), 1L, Long::sum);
            if (connection.getOutbox().isDegraded()) {
                degraded++;
            }
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("podName", appProperties.getPodName());
        stats.put("totalConnections", connections.size());
        stats.put("byChannel", byChannel);
        stats.put("byState", byState);
        stats.put("degradedConnections", degraded);
        stats.put("timestamp", clock.instant());
        return stats;
    }

    GatewayConnection connection(String connectionId) {
        return connections.get(connectionId);
    }

    private void onAuthTimeout(GatewayConnection connection) {
        if (connection.getState() == ConnectionState.CONNECTING) {
            log.warn("Connection {} did not authenticate within {}", connection.getId(), appProperties.getGateway().getAuthTimeout());
            close(connection, CloseReason.AUTH_ERROR);
        }
    }

    private void subscribe(GatewayConnection connection, ClientMessage message) {
        if (connection.getChannel() != Constants.Channel.ANALYTICS) {
            throw new InvalidRequestException("subscribe is only supported on the analytics channel");
        }
        Subscription requested = toSubscription(connection.getPrincipal(), message);
        int recent = message.getRecent() == null ? 0 : recentLimit(message.getRecent());

        switch (connection.getState()) {
            case AUTHENTICATED -> {
                connection.setSubscription(requested);
                subscribeOrReconnect(connection, recent);
            }
            case SUBSCRIBED, ACTIVE -> {
                // Filters change in place; the broker subscription is only replaced when the stream itself changes
                Subscription previous = connection.getSubscription();
                connection.setSubscription(requested);
                if (!requested.sameStreamAs(previous)) {
                    attachEventStream(connection, requested);
                }
                deliver(connection, ServerMessage.of(ServerMessage.Type.SUBSCRIBED, requested.describe(), clock.instant()));
                if (recent > 0) {
                    deliver(connection, ServerMessage.of(ServerMessage.Type.RECENT, recentEvents(requested, recent), clock.instant()));
                }
            }
            case RECONNECTING -> connection.setSubscription(requested);
            default -> log.debug("Ignoring subscribe on connection {} in state {}", connection.getId(), connection.getState());
        }
    }

    private Subscription toSubscription(AuthenticatedPrincipal principal, ClientMessage message) {
        Subscription.Scope scope = Subscription.parseScope(message.getScope());
        Set<AnalyticsEventType> eventTypes = Subscription.parseEventTypes(message.getEventTypes());

        if (scope == Subscription.Scope.GLOBAL) {
            if (!principal.isSuperAdmin()) {
                throw new TenantIsolationViolationException(principal.userId(), principal.organizationId(), "global");
            }
            return Subscription.global(eventTypes);
        }

        String organizationId = message.getOrganizationId() == null || message.getOrganizationId().isBlank()
                ? principal.organizationId()
                : message.getOrganizationId();
        if (!principal.canAccessOrganization(organizationId)) {
            throw new TenantIsolationViolationException(principal.userId(), principal.organizationId(), organizationId);
        }
        return Subscription.organization(organizationId, eventTypes);
    }

    private void subscribeOrReconnect(GatewayConnection connection, int recent) {
        try {
            activate(connection, recent);
        } catch (TransientStoreException e) {
            log.warn("Subscription of connection {} failed, reconnecting: {}", connection.getId(), e.getMessage());
            scheduleReconnect(connection);
        }
    }

    /**
     * SUBSCRIBED, then ACTIVE: registers presence and sends the initial messages of the channel.
     * On a store failure the connection is left in RECONNECTING and the exception is rethrown.
     */
    private void activate(GatewayConnection connection, int recent) {
        if (!connection.transitionTo(ConnectionState.SUBSCRIBED)) {
            return;
        }
        AuthenticatedPrincipal principal = connection.getPrincipal();
        try {
            connectionRegistry.register(principal.organizationId(), principal.userId(), connection.getId());
            connection.setLastHeartbeatAt(clock.instant());

            if (connection.getChannel() == Constants.Channel.PRESENCE) {
                PresenceSnapshot initial = presenceSnapshotService.organizationSnapshot(principal.organizationId());
                connection.advancePresenceSnapshot(initial.getTimestamp());
                deliver(connection, ServerMessage.of(ServerMessage.Type.INIT, initial, clock.instant()));
                if (principal.isSuperAdmin()) {
                    GlobalPresenceSnapshot global = presenceSnapshotService.globalSnapshot();
                    connection.advanceGlobalSnapshot(global.getTimestamp());
                    deliver(connection, ServerMessage.of(ServerMessage.Type.GLOBAL, global, clock.instant()));
                }
            } else {
                Subscription subscription = connection.getSubscription();
                deliver(connection, ServerMessage.of(ServerMessage.Type.SUBSCRIBED, subscription.describe(), clock.instant()));
                if (recent > 0) {
                    deliver(connection, ServerMessage.of(ServerMessage.Type.RECENT, recentEvents(subscription, recent), clock.instant()));
                }
                attachEventStream(connection, subscription);
            }
        } catch (TransientStoreException e) {
            connection.transitionTo(ConnectionState.RECONNECTING);
            throw e;
        }

        if (connection.transitionTo(ConnectionState.ACTIVE)) {
            log.debug("Connection {} active on {}", connection.getId(), connection.getChannel());
        }
    }

    private void attachEventStream(GatewayConnection connection, Subscription subscription) {
        Flux<AnalyticsEvent> source = subscription.getScope() == Subscription.Scope.GLOBAL
                ? analyticsEventBus.subscribeGlobal()
                : analyticsEventBus.subscribeOrganization(subscription.getOrganizationId());

        connection.getEventStream().update(source
                .filter(event -> connection.getSubscription().matches(event))
                .subscribe(event -> deliver(connection, ServerMessage.of(ServerMessage.Type.EVENT, event, clock.instant())),
                        error -> onEventStreamError(connection, error)));
    }

    private void onEventStreamError(GatewayConnection connection, Throwable error) {
        if (error instanceof TransientStoreException) {
            if (connection.transitionTo(ConnectionState.RECONNECTING)) {
                log.warn("Event stream of connection {} lost, reconnecting: {}", connection.getId(), error.getMessage());
                scheduleReconnect(connection);
            }
            return;
        }
        log.error("Event stream of connection {} failed", connection.getId(), error);
        close(connection, CloseReason.INTERNAL_ERROR);
    }

    /**
     * Retries activation with exponential backoff until it succeeds or the connection closes.
     */
    private void scheduleReconnect(GatewayConnection connection) {
        deliver(connection, ServerMessage.status("reconnecting", clock.instant()));
        metricsCollector.incrementCounter("telemetry.gateway.reconnects");

        AppProperties.Gateway gateway = appProperties.getGateway();
        connection.getReconnect().update(Mono.fromRunnable(() -> {
                    if (connection.getState() == ConnectionState.RECONNECTING) {
                        activate(connection, 0);
                    }
                })
                .subscribeOn(ioScheduler)
                .retryWhen(Retry.backoff(Long.MAX_VALUE, gateway.getReconnectMinBackoff())
                        .maxBackoff(gateway.getReconnectMaxBackoff())
                        .scheduler(timerScheduler)
                        .filter(TransientStoreException.class::isInstance)
                        .doBeforeRetry(signal -> log.debug("Reconnect attempt {} for connection {} failed: {}",
                                signal.totalRetries() + 1, connection.getId(), signal.failure().getMessage())))
                .subscribe(ignored -> { },
                        error -> {
                            log.error("Reconnect of connection {} failed", connection.getId(), error);
                            close(connection, CloseReason.INTERNAL_ERROR);
                        },
                        () -> log.info("Connection {} resubscribed", connection.getId())));
    }

    private void sendRecent(GatewayConnection connection, Integer limit) {
        if (connection.getChannel() != Constants.Channel.ANALYTICS) {
            throw new InvalidRequestException("getRecent is only supported on the analytics channel");
        }
        int effectiveLimit = recentLimit(limit == null ? DEFAULT_RECENT_LIMIT : limit);
        Subscription subscription = connection.getSubscription();
        if (subscription == null) {
            subscription = Subscription.organization(connection.getPrincipal().organizationId(), List.of());
        }
        deliver(connection, ServerMessage.of(ServerMessage.Type.RECENT, recentEvents(subscription, effectiveLimit), clock.instant()));
    }

    private List<AnalyticsEvent> recentEvents(Subscription subscription, int limit) {
        List<AnalyticsEvent> events = subscription.getScope() == Subscription.Scope.GLOBAL
                ? analyticsEventBus.getRecentGlobal(limit)
                : analyticsEventBus.getRecent(subscription.getOrganizationId(), limit);
        return events.stream().filter(subscription::matches).toList();
    }

    private int recentLimit(int requested) {
        if (requested < 0) {
            throw new InvalidRequestException("recent count must not be negative");
        }
        return Math.min(requested, appProperties.getEvents().getRecentCapacity());
    }

    private void heartbeat(GatewayConnection connection) {
        connection.setLastHeartbeatAt(clock.instant());
        ConnectionState state = connection.getState();
        if (state != ConnectionState.SUBSCRIBED && state != ConnectionState.ACTIVE) {
            return;
        }
        AuthenticatedPrincipal principal = connection.getPrincipal();
        if (!connectionRegistry.heartbeat(principal.organizationId(), connection.getId())) {
            log.debug("Presence entry of connection {} was reaped, registering again", connection.getId());
            connectionRegistry.register(principal.organizationId(), principal.userId(), connection.getId());
        }
    }

    private void deliver(GatewayConnection connection, ServerMessage message) {
        try {
            if (connection.getOutbox().offer(message) == ConnectionOutbox.OfferResult.DEGRADED) {
                log.warn("Connection {} is falling behind, dropping oldest events", connection.getId());
                metricsCollector.incrementCounter("telemetry.gateway.degraded");
            }
        } catch (SlowConsumerException e) {
            log.warn(e.getMessage());
            metricsCollector.incrementCounter("telemetry.gateway.slow_consumers");
            close(connection, CloseReason.SLOW_CONSUMER);
        }
    }
}
