package com.example.telemetry.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Anonymized session location for the dashboard session list: no user id, no IP hash, coarse coordinates.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionLocationView {
    private String countryCode;
    private String country;
    private String region;
    private String city;
    private Double lat;
    private Double lng;
    private OffsetDateTime timestamp;
}
