package com.example.telemetry.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of resolving an IP address. Unresolvable addresses yield the {@link #unknown} sentinel,
 * which callers treat as an ordinary value.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GeoLocation {

    public static final String UNKNOWN_COUNTRY_CODE = "XX";
    public static final String UNKNOWN_COUNTRY = "Unknown";

    private String ipKey;
    private String countryCode;
    private String country;
    private String region;
    private String city;
    private Double lat;
    private Double lng;
    private String timezone;
    private Instant resolvedAt;

    public static GeoLocation unknown(String ipKey, Instant resolvedAt) {
        return GeoLocation.builder()
                .ipKey(ipKey)
                .countryCode(UNKNOWN_COUNTRY_CODE)
                .country(UNKNOWN_COUNTRY)
                .resolvedAt(resolvedAt)
                .build();
    }

    @JsonIgnore
    public boolean isUnknown() {
        return countryCode == null || UNKNOWN_COUNTRY_CODE.equals(countryCode);
    }

    @JsonIgnore
    public boolean hasCoordinates() {
        return lat != null && lng != null;
    }
}
