package com.example.telemetry.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Cross-organization presence breakdown, only ever sent to super-admins.
 * {@code byOrganization} is sorted by count descending, then organization id ascending.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GlobalPresenceSnapshot {
    private long totalUsers;
    private int organizationCount;
    private List<OrganizationCount> byOrganization;
    private Instant timestamp;
}
