package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.config.MonitoringConfig;
import com.example.telemetry.shared.model.GeoLocation;
import com.example.telemetry.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.io.IOException;
import java.net.InetAddress;
import java.time.Instant;
import java.time.Clock;
import java.util.Optional;

/**
 * Resolves IP addresses to locations. Never throws for a resolution failure: every such path
 * ends in {@link GeoLocation#unknown}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeoResolver {

    private final GeoDatabase geoDatabase;
    private final GeoLocationCache geoLocationCache;
    private final AppProperties appProperties;
    private final Clock clock;
    private final MonitoringConfig.TelemetryMetricsCollector metricsCollector;
    private final Scheduler geoLookupScheduler;

    public GeoLocation resolve(String ip) {
        Instant now = clock.instant();
        Optional<InetAddress> parsed = IpAddresses.parseLiteral(ip);
        if (parsed.isEmpty()) {
            log.debug("Not an IP literal, resolving to Unknown");
            metricsCollector.incrementCounter("telemetry.geo.lookups", "result", "unknown");
            return GeoLocation.unknown(null, now);
        }

        AppProperties.Geo geo = appProperties.getGeo();
        InetAddress address = geo.isTruncateForPrivacy() ? IpAddresses.truncate(parsed.get()) : parsed.get();
        String ipKey = IpAddresses.hash(address.getHostAddress(), geo.getHashSalt());

        if (IpAddresses.isNonPublic(address)) {
            metricsCollector.incrementCounter("telemetry.geo.lookups", "result", "unknown");
            return GeoLocation.unknown(ipKey, now);
        }

        String cacheKey = Constants.CacheKeys.GEOIP_PREFIX + ipKey;
        Optional<GeoLocation> cached = geoLocationCache.get(cacheKey);
        if (cached.isPresent()) {
            metricsCollector.incrementCounter("telemetry.geo.lookups", "result", "hit");
            return cached.get();
        }

        // Not cached: a later lookup with the database present must not be shadowed by this miss
        if (!geoDatabase.isAvailable()) {
            metricsCollector.incrementCounter("telemetry.geo.lookups", "result", "unknown");
            return GeoLocation.unknown(ipKey, now);
        }

        metricsCollector.incrementCounter("telemetry.geo.lookups", "result", "miss");
        try {
            GeoLocation location = geoDatabase.lookup(address)
                    .map(found -> found.toBuilder().ipKey(ipKey).resolvedAt(now).build())
                    .orElseGet(() -> GeoLocation.unknown(ipKey, now));
            geoLocationCache.put(cacheKey, location);
            return location;
        } catch (IOException | RuntimeException e) {
            log.warn("GeoIP lookup failed for {}: {}", IpAddresses.mask(ip), e.getMessage());
            return GeoLocation.unknown(ipKey, now);
        }
    }

    /**
     * {@link #resolve} on the bounded geo lookup pool, for callers on non-blocking threads.
     */
    public Mono<GeoLocation> resolveAsync(String ip) {
        return Mono.fromCallable(() -> resolve(ip)).subscribeOn(geoLookupScheduler);
    }
}
