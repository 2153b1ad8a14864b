package com.example.telemetry.realtime.controller;

import com.example.telemetry.realtime.auth.AuthenticatedPrincipal;
import com.example.telemetry.realtime.gateway.RealtimeGateway;
import com.example.telemetry.shared.dto.OrganizationPresence;
import com.example.telemetry.shared.dto.PublishEventRequest;
import com.example.telemetry.shared.events.AnalyticsEventBus;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.model.AnalyticsEvent;
import com.example.telemetry.shared.presence.ConnectionRegistry;
import com.example.telemetry.shared.presence.PresenceSnapshotService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/analytics/realtime")
@Slf4j
public class RealtimeAnalyticsController {

    private final PresenceSnapshotService presenceSnapshotService;
    private final ConnectionRegistry connectionRegistry;
    private final AnalyticsEventBus analyticsEventBus;
    private final RealtimeGateway realtimeGateway;
    private final RequestPrincipalResolver principalResolver;
    private final Scheduler presenceIoScheduler;

    public RealtimeAnalyticsController(PresenceSnapshotService presenceSnapshotService,
                                       ConnectionRegistry connectionRegistry,
                                       AnalyticsEventBus analyticsEventBus,
                                       RealtimeGateway realtimeGateway,
                                       RequestPrincipalResolver principalResolver,
                                       @Qualifier("presenceIoScheduler") Scheduler presenceIoScheduler) {
        this.presenceSnapshotService = presenceSnapshotService;
        this.connectionRegistry = connectionRegistry;
        this.analyticsEventBus = analyticsEventBus;
        this.realtimeGateway = realtimeGateway;
        this.principalResolver = principalResolver;
        this.presenceIoScheduler = presenceIoScheduler;
    }

    /**
     * Own organization's count, or the cross-organization breakdown for super-admins.
     */
    @GetMapping("/concurrent-users")
    public Mono<ResponseEntity<Object>> getConcurrentUsers(ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        return Mono.fromCallable(() -> principal.isSuperAdmin()
                        ? (Object) presenceSnapshotService.globalSnapshot()
                        : presenceSnapshotService.organizationSnapshot(principal.organizationId()))
                .subscribeOn(presenceIoScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/concurrent-users/organization/{organizationId}")
    public Mono<ResponseEntity<OrganizationPresence>> getOrganizationPresence(
            @PathVariable String organizationId,
            ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        String targetOrganization = principalResolver.targetOrganization(principal, organizationId);
        return Mono.fromCallable(() -> presenceSnapshotService.organizationPresence(targetOrganization))
                .subscribeOn(presenceIoScheduler)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/concurrent-users/user/{userId}")
    public Mono<ResponseEntity<Map<String, Object>>> isUserOnline(
            @PathVariable String userId,
            @RequestParam(required = false) String organizationId,
            ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        String targetOrganization = principalResolver.targetOrganization(principal, organizationId);
        return Mono.fromCallable(() -> connectionRegistry.isUserOnline(targetOrganization, userId, connectionRegistry.heartbeatTimeoutSeconds()))
                .subscribeOn(presenceIoScheduler)
                .map(online -> ResponseEntity.ok(Map.<String, Object>of("userId", userId, "organizationId", targetOrganization, "online", online)));
    }

    @PostMapping("/events/publish")
    public Mono<ResponseEntity<Map<String, Object>>> publishEvent(
            @Valid @RequestBody PublishEventRequest request,
            ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        request.setOrganizationId(principalResolver.targetOrganization(principal, request.getOrganizationId()));
        return Mono.fromCallable(() -> analyticsEventBus.publish(request))
                .subscribeOn(presenceIoScheduler)
                .map(event -> {
                    log.debug("Published {} event {} for org {}", event.getType().getWireName(), event.getId(), event.getOrganizationId());
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.<String, Object>of("eventId", event.getId()));
                });
    }

    @GetMapping("/events/recent")
    public ResponseEntity<List<AnalyticsEvent>> getRecentEvents(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "organization") String scope,
            @RequestParam(required = false) String organizationId,
            ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        switch (scope) {
            case "global":
                principalResolver.requireSuperAdmin(principal, "global");
                return ResponseEntity.ok(analyticsEventBus.getRecentGlobal(limit));
            case "organization":
                String targetOrganization = principalResolver.targetOrganization(principal, organizationId);
                return ResponseEntity.ok(analyticsEventBus.getRecent(targetOrganization, limit));
            default:
                throw new InvalidRequestException("scope must be 'organization' or 'global'");
        }
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats(ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        principalResolver.requireSuperAdmin(principal, "stats");
        return ResponseEntity.ok(realtimeGateway.stats());
    }
}
