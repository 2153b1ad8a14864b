package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.model.GeoLocation;

import java.util.Optional;

/**
 * Resolved locations keyed by {@code geoip:<salted hash>}. Entries expire after the configured TTL.
 * Implementations degrade to a miss rather than fail.
 */
public interface GeoLocationCache {

    Optional<GeoLocation> get(String key);

    void put(String key, GeoLocation location);
}
