package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.config.MonitoringConfig;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.model.GeoLocation;
import com.example.telemetry.shared.model.SessionGeoRecord;
import com.example.telemetry.shared.repository.SessionGeoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Persists where sessions come from. Historical counterpart of the presence registry:
 * records outlive connections and feed the geo aggregations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionGeoTracker {

    private final GeoResolver geoResolver;
    private final SessionGeoRepository sessionGeoRepository;
    private final Clock clock;
    private final MonitoringConfig.TelemetryMetricsCollector metricsCollector;
    private final Scheduler jdbcScheduler;

    /**
     * Resolves the address and upserts the session's row. Calling it again for the same session
     * updates that row instead of adding one.
     */
    public TrackResult track(String sessionId, String userId, String organizationId, String ip) {
        requireText(sessionId, "sessionId");
        requireText(userId, "userId");
        requireText(organizationId, "organizationId");

        GeoLocation location = geoResolver.resolve(ip);
        if (location.isUnknown()) {
            log.debug("Location unknown for session {} ({}), not persisted", sessionId, IpAddresses.mask(ip));
            metricsCollector.incrementCounter("telemetry.geo.tracked", "result", "skipped");
            return TrackResult.SKIPPED_UNKNOWN;
        }

        SessionGeoRecord record = SessionGeoRecord.builder()
                .sessionId(sessionId)
                .userId(userId)
                .organizationId(organizationId)
                .countryCode(location.getCountryCode())
                .country(location.getCountry())
                .region(location.getRegion())
                .city(location.getCity())
                .latitude(location.getLat())
                .longitude(location.getLng())
                .ipHash(location.getIpKey())
                .build();

        try {
            upsert(record);
            metricsCollector.incrementCounter("telemetry.geo.tracked", "result", "tracked");
            log.debug("Tracked session {} in {} ({})", sessionId, location.getCountryCode(), organizationId);
            return TrackResult.TRACKED;
        } catch (DataAccessException e) {
            log.error("Failed to persist location for session {} in org {}: {}", sessionId, organizationId, e.getMessage());
            metricsCollector.incrementCounter("telemetry.geo.tracked", "result", "failed");
            return TrackResult.FAILED;
        }
    }

    /**
     * {@link #track} off the caller's thread, for fire-and-forget acknowledgment.
     */
    public Mono<TrackResult> trackAsync(String sessionId, String userId, String organizationId, String ip) {
        return Mono.fromCallable(() -> track(sessionId, userId, organizationId, ip)).subscribeOn(jdbcScheduler);
    }

    private void upsert(SessionGeoRecord record) {
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        try {
            sessionGeoRepository.upsert(record, now);
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent first insert for the same session; the row exists now
            sessionGeoRepository.upsert(record, now);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(name + " must not be blank");
        }
    }
}
