package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.config.MonitoringConfig;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.model.GeoLocation;
import com.example.telemetry.shared.model.SessionGeoRecord;
import com.example.telemetry.shared.repository.SessionGeoRepository;
import com.example.telemetry.shared.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionGeoTrackerTest {

    private EmbeddedDatabase database;
    private SessionGeoRepository repository;
    private GeoResolver geoResolver;
    private MutableClock clock;
    private MonitoringConfig.TelemetryMetricsCollector metrics;
    private SessionGeoTracker tracker;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("db/telemetry-schema.sql")
                .build();
        repository = new SessionGeoRepository(new JdbcTemplate(database));
        geoResolver = mock(GeoResolver.class);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        metrics = new MonitoringConfig.TelemetryMetricsCollector(new SimpleMeterRegistry());
        tracker = new SessionGeoTracker(geoResolver, repository, clock, metrics, Schedulers.immediate());
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void tracksResolvedSession() {
        when(geoResolver.resolve("8.8.8.8")).thenReturn(location("US", "California", "hash-1"));

        assertThat(tracker.track("sess-1", "alice", "org-a", "8.8.8.8")).isEqualTo(TrackResult.TRACKED);

        SessionGeoRecord stored = repository.findBySessionId("sess-1").orElseThrow();
        assertThat(stored.getOrganizationId()).isEqualTo("org-a");
        assertThat(stored.getCountryCode()).isEqualTo("US");
        assertThat(stored.getRegion()).isEqualTo("California");
        assertThat(stored.getIpHash()).isEqualTo("hash-1");
        assertThat(stored.getCreatedAt().toInstant()).isEqualTo(clock.instant());
        assertThat(metrics.getCounterValue("telemetry.geo.tracked", "result", "tracked")).isEqualTo(1);
    }

    @Test
    void trackingTheSameSessionAgainUpdatesTheRow() {
        when(geoResolver.resolve("8.8.8.8")).thenReturn(location("US", "California", "hash-1"));
        when(geoResolver.resolve("81.2.69.142")).thenReturn(location("GB", "England", "hash-2"));

        tracker.track("sess-1", "alice", "org-a", "8.8.8.8");
        clock.advance(Duration.ofMinutes(5));
        tracker.track("sess-1", "alice", "org-a", "81.2.69.142");

        assertThat(repository.countBySessionId("sess-1")).isEqualTo(1);
        SessionGeoRecord stored = repository.findBySessionId("sess-1").orElseThrow();
        assertThat(stored.getCountryCode()).isEqualTo("GB");
        assertThat(stored.getCreatedAt().toInstant()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(stored.getUpdatedAt().toInstant()).isEqualTo(Instant.parse("2024-05-01T10:05:00Z"));
    }

    @Test
    void unknownLocationIsNotPersisted() {
        when(geoResolver.resolve("10.0.0.1")).thenReturn(GeoLocation.unknown("hash-x", clock.instant()));

        assertThat(tracker.track("sess-2", "bob", "org-a", "10.0.0.1")).isEqualTo(TrackResult.SKIPPED_UNKNOWN);
        assertThat(repository.countBySessionId("sess-2")).isZero();
    }

    @Test
    void storageFailureIsReportedNotThrown() {
        SessionGeoRepository failing = mock(SessionGeoRepository.class);
        doThrow(new DataAccessResourceFailureException("connection refused")).when(failing).upsert(any(), any());
        when(geoResolver.resolve(anyString())).thenReturn(location("US", "Texas", "hash-3"));
        SessionGeoTracker failingTracker = new SessionGeoTracker(geoResolver, failing, clock, metrics, Schedulers.immediate());

        assertThat(failingTracker.track("sess-3", "carol", "org-a", "8.8.8.8")).isEqualTo(TrackResult.FAILED);
        assertThat(metrics.getCounterValue("telemetry.geo.tracked", "result", "failed")).isEqualTo(1);
    }

    @Test
    void rejectsMissingIdentifiers() {
        assertThatThrownBy(() -> tracker.track("", "alice", "org-a", "8.8.8.8")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> tracker.track("sess-1", "alice", null, "8.8.8.8")).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void trackAsyncEmitsTheResult() {
        when(geoResolver.resolve("8.8.8.8")).thenReturn(location("US", "California", "hash-1"));

        StepVerifier.create(tracker.trackAsync("sess-4", "dave", "org-b", "8.8.8.8"))
                .expectNext(TrackResult.TRACKED)
                .verifyComplete();
    }

    private GeoLocation location(String countryCode, String region, String ipKey) {
        return GeoLocation.builder()
                .ipKey(ipKey)
                .countryCode(countryCode)
                .country(countryCode)
                .region(region)
                .lat(37.386)
                .lng(-122.0838)
                .resolvedAt(clock.instant())
                .build();
    }
}
