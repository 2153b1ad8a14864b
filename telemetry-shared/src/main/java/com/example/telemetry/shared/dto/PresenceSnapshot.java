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
public class PresenceSnapshot {
    private String organizationId;
    private long totalUsers;
    private Instant timestamp;
}
