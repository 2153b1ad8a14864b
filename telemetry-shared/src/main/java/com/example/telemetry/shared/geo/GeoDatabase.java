package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.dto.GeoDatabaseStatus;
import com.example.telemetry.shared.model.GeoLocation;

import java.io.IOException;
import java.net.InetAddress;
import java.util.Optional;

/**
 * Local IP geolocation database. Lookups block on file I/O.
 */
public interface GeoDatabase {

    boolean isAvailable();

    /**
     * @return the location without ipKey and resolvedAt, or empty when the address is not in the database
     */
    Optional<GeoLocation> lookup(InetAddress address) throws IOException;

    GeoDatabaseStatus status();
}
