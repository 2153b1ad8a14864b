package com.example.telemetry.realtime.auth;

import com.example.telemetry.shared.model.Role;

/**
 * Identity taken from a verified bearer token.
 */
public record AuthenticatedPrincipal(String userId, String organizationId, Role role) {

    public boolean isSuperAdmin() {
        return role == Role.SUPER_ADMIN;
    }

    public boolean canAccessOrganization(String requestedOrganizationId) {
        return isSuperAdmin() || organizationId.equals(requestedOrganizationId);
    }
}
