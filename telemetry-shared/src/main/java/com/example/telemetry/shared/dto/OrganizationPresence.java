package com.example.telemetry.shared.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrganizationPresence {
    private String organizationId;
    private long count;
    private int uniqueUsers;
    private Set<String> userIds;
}
