package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.dto.GeoDatabaseStatus;
import com.example.telemetry.shared.model.GeoLocation;
import com.maxmind.db.CHMCache;
import com.maxmind.geoip2.DatabaseReader;
import com.maxmind.geoip2.exception.GeoIp2Exception;
import com.maxmind.geoip2.model.CityResponse;
import com.maxmind.geoip2.record.Country;
import com.maxmind.geoip2.record.Location;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * GeoLite2-City database reader. A missing file is not fatal: the service runs and every lookup
 * resolves to Unknown until the file appears and the weekly reload picks it up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MaxMindGeoDatabase implements GeoDatabase {

    private final AppProperties appProperties;
    private final Clock clock;

    private final AtomicReference<DatabaseReader> reader = new AtomicReference<>();
    private volatile Instant loadedFileTimestamp;

    @PostConstruct
    public void init() {
        load();
    }

    @PreDestroy
    public void close() {
        closeReader(reader.getAndSet(null));
    }

    @Scheduled(cron = "${telemetry.geo.reload-cron:0 0 3 * * SUN}")
    public void reloadIfChanged() {
        Path path = databasePath();
        try {
            if (!Files.isRegularFile(path)) {
                log.warn("GeoIP database missing at {} during scheduled reload", path);
                return;
            }
            Instant fileTimestamp = Files.getLastModifiedTime(path).toInstant();
            if (reader.get() == null || !fileTimestamp.equals(loadedFileTimestamp)) {
                log.info("GeoIP database at {} changed, reloading", path);
                load();
            } else {
                warnIfStale(fileTimestamp);
            }
        } catch (IOException e) {
            log.error("Failed to check GeoIP database at {}: {}", path, e.getMessage());
        }
    }

    synchronized boolean load() {
        Path path = databasePath();
        if (!Files.isRegularFile(path)) {
            log.warn("GeoIP database not found at {}. Locations resolve to Unknown until it is installed.", path);
            return false;
        }
        try {
            DatabaseReader fresh = new DatabaseReader.Builder(path.toFile()).withCache(new CHMCache()).build();
            Instant fileTimestamp = Files.getLastModifiedTime(path).toInstant();
            DatabaseReader previous = reader.getAndSet(fresh);
            loadedFileTimestamp = fileTimestamp;
            closeReader(previous);
            log.info("GeoIP database loaded from {} (type {})", path, fresh.getMetadata().getDatabaseType());
            warnIfStale(fileTimestamp);
            return true;
        } catch (IOException e) {
            log.error("Failed to load GeoIP database from {}: {}", path, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isAvailable() {
        return reader.get() != null;
    }

    @Override
    public Optional<GeoLocation> lookup(InetAddress address) throws IOException {
        DatabaseReader current = reader.get();
        if (current == null) {
            return Optional.empty();
        }
        try {
            return current.tryCity(address).map(this::toLocation);
        } catch (GeoIp2Exception e) {
            throw new IOException("GeoIP lookup failed", e);
        }
    }

    @Override
    public GeoDatabaseStatus status() {
        Path path = databasePath();
        GeoDatabaseStatus.GeoDatabaseStatusBuilder status = GeoDatabaseStatus.builder()
                .initialized(isAvailable())
                .databasePath(path.toString());
        try {
            if (Files.isRegularFile(path)) {
                Instant lastModified = Files.getLastModifiedTime(path).toInstant();
                Duration age = Duration.between(lastModified, clock.instant());
                status.databaseExists(true)
                        .lastModified(lastModified)
                        .databaseAgeDays(age.toDays())
                        .stale(age.compareTo(appProperties.getGeo().getStaleAfter()) > 0);
            }
        } catch (IOException e) {
            log.warn("Could not read GeoIP database attributes at {}: {}", path, e.getMessage());
        }
        return status.build();
    }

    private GeoLocation toLocation(CityResponse response) {
        Country country = response.getCountry();
        Location location = response.getLocation();
        return GeoLocation.builder()
                .countryCode(country.getIsoCode() != null ? country.getIsoCode() : GeoLocation.UNKNOWN_COUNTRY_CODE)
                .country(country.getName() != null ? country.getName() : GeoLocation.UNKNOWN_COUNTRY)
                .region(response.getMostSpecificSubdivision().getName())
                .city(response.getCity().getName())
                .lat(location.getLatitude())
                .lng(location.getLongitude())
                .timezone(location.getTimeZone())
                .build();
    }

    private void warnIfStale(Instant fileTimestamp) {
        Duration age = Duration.between(fileTimestamp, clock.instant());
        if (age.compareTo(appProperties.getGeo().getStaleAfter()) > 0) {
            log.warn("GeoIP database is {} days old. Download a fresh GeoLite2-City release.", age.toDays());
        }
    }

    private void closeReader(DatabaseReader databaseReader) {
        if (databaseReader == null) {
            return;
        }
        try {
            databaseReader.close();
        } catch (IOException e) {
            log.warn("Error closing GeoIP database reader: {}", e.getMessage());
        }
    }

    private Path databasePath() {
        return Path.of(appProperties.getGeo().getDatabasePath());
    }
}
