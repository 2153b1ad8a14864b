package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.model.GeoLocation;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Profile("!redis")
@RequiredArgsConstructor
public class CaffeineGeoLocationCache implements GeoLocationCache {

    private final Cache<String, GeoLocation> geoLocationCache;

    @Override
    public Optional<GeoLocation> get(String key) {
        return Optional.ofNullable(geoLocationCache.getIfPresent(key));
    }

    @Override
    public void put(String key, GeoLocation location) {
        geoLocationCache.put(key, location);
    }
}
