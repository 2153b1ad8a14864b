package com.example.telemetry.shared.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ranked row of a country or region distribution. {@code countryCode} is only set for region rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeoDistributionEntry {
    private String code;
    private String name;
    private String countryCode;
    private long count;
    private double percentage;
}
