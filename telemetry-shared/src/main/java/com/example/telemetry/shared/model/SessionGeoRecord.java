package com.example.telemetry.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionGeoRecord {
    private Long id;
    private String sessionId;
    private String userId;
    private String organizationId;
    private String countryCode;
    private String country;
    private String region;
    private String city;
    private Double latitude;
    private Double longitude;
    private String ipHash;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
