package com.example.telemetry.realtime.controller;

import com.example.telemetry.realtime.auth.AuthenticatedPrincipal;
import com.example.telemetry.shared.dto.GeoDatabaseStatus;
import com.example.telemetry.shared.dto.GeoDistributionEntry;
import com.example.telemetry.shared.dto.HeatmapPoint;
import com.example.telemetry.shared.dto.SessionLocationView;
import com.example.telemetry.shared.dto.TrackLocationRequest;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.geo.GeoAggregator;
import com.example.telemetry.shared.geo.GeoDatabase;
import com.example.telemetry.shared.geo.IpAddresses;
import com.example.telemetry.shared.geo.SessionGeoTracker;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@RestController
@RequestMapping("/api/admin/analytics/geo")
@RequiredArgsConstructor
@Slf4j
public class GeoAnalyticsController {

    private final GeoAggregator geoAggregator;
    private final SessionGeoTracker sessionGeoTracker;
    private final GeoDatabase geoDatabase;
    private final RequestPrincipalResolver principalResolver;
    private final Scheduler jdbcScheduler;

    @GetMapping("/distribution")
    public Mono<ResponseEntity<List<GeoDistributionEntry>>> getDistribution(
            @RequestParam(defaultValue = "30") int days,
            @RequestParam(defaultValue = "country") String type,
            @RequestParam(required = false) String countryCode,
            @RequestParam(required = false) String organizationId,
            ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        String targetOrganization = principalResolver.targetOrganization(principal, organizationId);
        log.debug("Geo distribution by {} for org {} over {} days", type, targetOrganization, days);

        return blocking(() -> switch (type.toLowerCase(Locale.ROOT)) {
            case "country" -> geoAggregator.aggregateByCountry(targetOrganization, days);
            case "region" -> geoAggregator.aggregateByRegion(targetOrganization, countryCode, days);
            default -> throw new InvalidRequestException("type must be 'country' or 'region'");
        });
    }

    @GetMapping("/heatmap")
    public Mono<ResponseEntity<List<HeatmapPoint>>> getHeatmap(
            @RequestParam(defaultValue = "30") int days,
            @RequestParam(required = false) String organizationId,
            ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        String targetOrganization = principalResolver.targetOrganization(principal, organizationId);
        return blocking(() -> geoAggregator.getHeatmapPoints(targetOrganization, days));
    }

    @GetMapping("/global")
    public Mono<ResponseEntity<List<GeoDistributionEntry>>> getGlobalDistribution(
            @RequestParam(defaultValue = "30") int days,
            ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        principalResolver.requireSuperAdmin(principal, "global");
        return blocking(() -> geoAggregator.aggregateGlobal(days));
    }

    @GetMapping("/sessions")
    public Mono<ResponseEntity<List<SessionLocationView>>> getRecentSessions(
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) String organizationId,
            ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        String targetOrganization = principalResolver.targetOrganization(principal, organizationId);
        return blocking(() -> geoAggregator.recentSessions(targetOrganization, limit));
    }

    /**
     * Acknowledged immediately; resolution and persistence happen in the background.
     */
    @PostMapping("/track")
    @RateLimiter(name = "trackLocation", fallbackMethod = "trackFallback")
    public Mono<ResponseEntity<Map<String, Object>>> trackLocation(
            @Valid @RequestBody TrackLocationRequest request,
            ServerWebExchange exchange) {
        AuthenticatedPrincipal principal = principalResolver.resolve(exchange);
        String targetOrganization = principalResolver.targetOrganization(principal, request.getOrganizationId());

        sessionGeoTracker.trackAsync(request.getSessionId(), request.getUserId(), targetOrganization, request.getIp())
                .subscribe(
                        result -> log.debug("Session {} location {}", request.getSessionId(), result),
                        error -> log.error("Tracking session {} ({}) failed: {}",
                                request.getSessionId(), IpAddresses.mask(request.getIp()), error.getMessage()));

        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("accepted", true)));
    }

    public Mono<ResponseEntity<Map<String, Object>>> trackFallback(TrackLocationRequest request, ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Track rate limit exceeded for session {}: {}", request.getSessionId(), ex.getMessage());
        return Mono.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Tracking rate limit exceeded. Please try again later."));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<GeoDatabaseStatus>> getStatus(ServerWebExchange exchange) {
        principalResolver.resolve(exchange);
        return Mono.fromCallable(() -> ResponseEntity.ok(geoDatabase.status()));
    }

    private <T> Mono<ResponseEntity<T>> blocking(Callable<T> query) {
        return Mono.fromCallable(query)
                .subscribeOn(jdbcScheduler)
                .map(ResponseEntity::ok);
    }
}
