package com.example.telemetry.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoDatabaseStatus {
    private boolean initialized;
    private boolean databaseExists;
    private String databasePath;
    private Long databaseAgeDays;
    private Instant lastModified;
    private boolean stale;
}
