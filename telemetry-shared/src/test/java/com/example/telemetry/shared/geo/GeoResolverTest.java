package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.config.MonitoringConfig;
import com.example.telemetry.shared.model.GeoLocation;
import com.example.telemetry.shared.support.MutableClock;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.net.InetAddress;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeoResolverTest {

    private GeoDatabase geoDatabase;
    private MonitoringConfig.TelemetryMetricsCollector metrics;
    private AppProperties appProperties;
    private GeoResolver resolver;

    @BeforeEach
    void setUp() {
        geoDatabase = mock(GeoDatabase.class);
        metrics = new MonitoringConfig.TelemetryMetricsCollector(new SimpleMeterRegistry());
        appProperties = new AppProperties();
        GeoLocationCache cache = new CaffeineGeoLocationCache(Caffeine.newBuilder().maximumSize(100).<String, GeoLocation>build());
        resolver = new GeoResolver(geoDatabase, cache, appProperties,
                new MutableClock(Instant.parse("2024-05-01T10:00:00Z")), metrics, Schedulers.immediate());
    }

    @Test
    void publicAddressIsLookedUpOnceThenServedFromCache() throws IOException {
        when(geoDatabase.isAvailable()).thenReturn(true);
        when(geoDatabase.lookup(any(InetAddress.class))).thenReturn(Optional.of(mountainView()));

        GeoLocation first = resolver.resolve("8.8.8.8");
        GeoLocation second = resolver.resolve("8.8.8.8");

        assertThat(first.getCountryCode()).isEqualTo("US");
        assertThat(first.getIpKey()).isEqualTo(IpAddresses.hash("8.8.8.8", appProperties.getGeo().getHashSalt()));
        assertThat(second).isEqualTo(first);
        verify(geoDatabase, times(1)).lookup(any(InetAddress.class));
        assertThat(metrics.getCounterValue("telemetry.geo.lookups", "result", "miss")).isEqualTo(1);
        assertThat(metrics.getCounterValue("telemetry.geo.lookups", "result", "hit")).isEqualTo(1);
    }

    @Test
    void privateAndLoopbackAddressesResolveToUnknownWithoutLookup() throws IOException {
        when(geoDatabase.isAvailable()).thenReturn(true);

        assertThat(resolver.resolve("192.168.1.10").isUnknown()).isTrue();
        assertThat(resolver.resolve("127.0.0.1").isUnknown()).isTrue();
        assertThat(resolver.resolve("::1").isUnknown()).isTrue();
        verify(geoDatabase, never()).lookup(any(InetAddress.class));
    }

    @Test
    void hostnamesAreNeverResolved() throws IOException {
        GeoLocation location = resolver.resolve("example.com");

        assertThat(location.isUnknown()).isTrue();
        assertThat(location.getIpKey()).isNull();
        verify(geoDatabase, never()).lookup(any(InetAddress.class));
    }

    @Test
    void missingDatabaseDoesNotPoisonTheCache() throws IOException {
        when(geoDatabase.isAvailable()).thenReturn(false);
        assertThat(resolver.resolve("8.8.8.8").isUnknown()).isTrue();

        when(geoDatabase.isAvailable()).thenReturn(true);
        when(geoDatabase.lookup(any(InetAddress.class))).thenReturn(Optional.of(mountainView()));

        assertThat(resolver.resolve("8.8.8.8").getCountryCode()).isEqualTo("US");
    }

    @Test
    void lookupFailureYieldsUnknown() throws IOException {
        when(geoDatabase.isAvailable()).thenReturn(true);
        when(geoDatabase.lookup(any(InetAddress.class))).thenThrow(new IOException("corrupt record"));

        GeoLocation location = resolver.resolve("8.8.4.4");

        assertThat(location.isUnknown()).isTrue();
        assertThat(location.getIpKey()).isNotNull();
    }

    @Test
    void addressNotInDatabaseIsCachedAsUnknown() throws IOException {
        when(geoDatabase.isAvailable()).thenReturn(true);
        when(geoDatabase.lookup(any(InetAddress.class))).thenReturn(Optional.empty());

        assertThat(resolver.resolve("1.1.1.1").isUnknown()).isTrue();
        assertThat(resolver.resolve("1.1.1.1").isUnknown()).isTrue();
        verify(geoDatabase, times(1)).lookup(any(InetAddress.class));
    }

    @Test
    void truncationSharesTheCacheEntryWithinTheSubnet() throws IOException {
        appProperties.getGeo().setTruncateForPrivacy(true);
        when(geoDatabase.isAvailable()).thenReturn(true);
        when(geoDatabase.lookup(any(InetAddress.class))).thenReturn(Optional.of(mountainView()));

        GeoLocation first = resolver.resolve("8.8.8.8");
        GeoLocation second = resolver.resolve("8.8.8.9");

        assertThat(second.getIpKey()).isEqualTo(first.getIpKey());
        verify(geoDatabase, times(1)).lookup(any(InetAddress.class));
    }

    @Test
    void resolveAsyncRunsOnTheLookupScheduler() {
        StepVerifier.create(resolver.resolveAsync("10.0.0.1"))
                .assertNext(location -> assertThat(location.isUnknown()).isTrue())
                .verifyComplete();
    }

    private static GeoLocation mountainView() {
        return GeoLocation.builder()
                .countryCode("US")
                .country("United States")
                .region("California")
                .city("Mountain View")
                .lat(37.386)
                .lng(-122.0838)
                .build();
    }
}
