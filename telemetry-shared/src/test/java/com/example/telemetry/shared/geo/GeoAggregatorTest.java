package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.dto.GeoDistributionEntry;
import com.example.telemetry.shared.dto.HeatmapPoint;
import com.example.telemetry.shared.dto.SessionLocationView;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.model.SessionGeoRecord;
import com.example.telemetry.shared.repository.SessionGeoRepository;
import com.example.telemetry.shared.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeoAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private EmbeddedDatabase database;
    private SessionGeoRepository repository;
    private AppProperties appProperties;
    private GeoAggregator aggregator;
    private final AtomicInteger sessions = new AtomicInteger();

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("db/telemetry-schema.sql")
                .build();
        repository = new SessionGeoRepository(new JdbcTemplate(database));
        appProperties = new AppProperties();
        aggregator = new GeoAggregator(repository, appProperties, new MutableClock(NOW));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void ranksCountriesByCountThenCode() {
        store("org-a", "US", "California", 37.38, -122.08, 1);
        store("org-a", "US", "Texas", 30.26, -97.74, 2);
        store("org-a", "US", "California", 37.38, -122.08, 3);
        store("org-a", "GB", "England", 51.50, -0.12, 4);
        store("org-a", "GB", "England", 51.50, -0.12, 5);
        store("org-a", "DE", "Berlin", 52.52, 13.40, 6);
        store("org-a", "DE", "Berlin", 52.52, 13.40, 7);

        List<GeoDistributionEntry> distribution = aggregator.aggregateByCountry("org-a", 30);

        assertThat(distribution).extracting(GeoDistributionEntry::getCode).containsExactly("US", "DE", "GB");
        assertThat(distribution).extracting(GeoDistributionEntry::getCount).containsExactly(3L, 2L, 2L);
        assertThat(distribution).extracting(GeoDistributionEntry::getPercentage).containsExactly(42.86, 28.57, 28.57);
    }

    @Test
    void respectsTheWindowAndTheOrganization() {
        store("org-a", "US", "California", 37.38, -122.08, 1);
        store("org-a", "FR", "Paris", 48.85, 2.35, 40 * 24);
        store("org-b", "JP", "Tokyo", 35.68, 139.69, 1);

        assertThat(aggregator.aggregateByCountry("org-a", 30))
                .extracting(GeoDistributionEntry::getCode).containsExactly("US");
        assertThat(aggregator.aggregateByCountry("org-a", 60))
                .extracting(GeoDistributionEntry::getCode).containsExactlyInAnyOrder("US", "FR");
        assertThat(aggregator.aggregateGlobal(30))
                .extracting(GeoDistributionEntry::getCode).containsExactlyInAnyOrder("US", "JP");
    }

    @Test
    void emptyWindowYieldsEmptyDistribution() {
        assertThat(aggregator.aggregateByCountry("org-a", 7)).isEmpty();
        assertThat(aggregator.getHeatmapPoints("org-a", 7)).isEmpty();
    }

    @Test
    void regionsCanBeFilteredByCountry() {
        store("org-a", "US", "California", 37.38, -122.08, 1);
        store("org-a", "US", "California", 37.38, -122.08, 2);
        store("org-a", "US", "Texas", 30.26, -97.74, 3);
        store("org-a", "GB", "England", 51.50, -0.12, 4);
        store("org-a", "GB", null, 51.50, -0.12, 5);

        List<GeoDistributionEntry> us = aggregator.aggregateByRegion("org-a", " us ", 30);
        assertThat(us).extracting(GeoDistributionEntry::getName).containsExactly("California", "Texas");
        assertThat(us).extracting(GeoDistributionEntry::getCountryCode).containsOnly("US");
        assertThat(us).extracting(GeoDistributionEntry::getPercentage).containsExactly(66.67, 33.33);

        assertThat(aggregator.aggregateByRegion("org-a", null, 30))
                .extracting(GeoDistributionEntry::getName).containsExactly("California", "England", "Texas");
    }

    @Test
    void rejectsMalformedCountryCodeAndWindow() {
        assertThatThrownBy(() -> aggregator.aggregateByRegion("org-a", "USA", 30)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> aggregator.aggregateByCountry("org-a", 0)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> aggregator.aggregateByCountry("org-a", 366)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> aggregator.aggregateByCountry(" ", 30)).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void heatmapIsCappedAndNormalized() {
        appProperties.getGeo().setHeatmapCap(2);
        store("org-a", "US", "California", 37.38, -122.08, 1);
        store("org-a", "US", "California", 37.41, -122.11, 2);
        store("org-a", "US", "California", 37.39, -122.09, 3);
        store("org-a", "GB", "England", 51.50, -0.12, 4);
        store("org-a", "DE", "Berlin", 52.52, 13.40, 5);

        List<HeatmapPoint> points = aggregator.getHeatmapPoints("org-a", 30);

        assertThat(points).hasSize(2);
        assertThat(points.get(0).getLat()).isEqualTo(37.4);
        assertThat(points.get(0).getLng()).isEqualTo(-122.1);
        assertThat(points.get(0).getWeight()).isEqualTo(3);
        assertThat(points.get(0).getNormalizedWeight()).isEqualTo(1.0);
        assertThat(points.get(1).getNormalizedWeight()).isEqualTo(1.0 / 3);
    }

    @Test
    void recentSessionsAreCoarsenedAndNewestFirst() {
        store("org-a", "US", "California", 37.386, -122.0838, 2);
        store("org-a", "GB", "England", 51.5072, -0.1276, 1);
        store("org-b", "JP", "Tokyo", 35.68, 139.69, 1);

        List<SessionLocationView> recent = aggregator.recentSessions("org-a", 10);

        assertThat(recent).extracting(SessionLocationView::getCountryCode).containsExactly("GB", "US");
        assertThat(recent.get(1).getLat()).isEqualTo(37.4);
        assertThat(recent.get(1).getLng()).isEqualTo(-122.1);
        assertThat(aggregator.recentSessions("org-a", 1)).hasSize(1);
        assertThatThrownBy(() -> aggregator.recentSessions("org-a", 1001)).isInstanceOf(InvalidRequestException.class);
    }

    private void store(String organizationId, String countryCode, String region, double lat, double lng, long hoursAgo) {
        int n = sessions.incrementAndGet();
        SessionGeoRecord record = SessionGeoRecord.builder()
                .sessionId("sess-" + n)
                .userId("user-" + n)
                .organizationId(organizationId)
                .countryCode(countryCode)
                .country(countryCode)
                .region(region)
                .latitude(lat)
                .longitude(lng)
                .ipHash("hash-" + n)
                .build();
        repository.upsert(record, OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusHours(hoursAgo));
    }
}
