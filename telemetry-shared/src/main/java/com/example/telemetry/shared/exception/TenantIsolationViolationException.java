package com.example.telemetry.shared.exception;

import lombok.Getter;

/**
 * A caller tried to read or subscribe to data of an organization other than its own.
 * Always fatal for the connection or request that caused it.
 */
@Getter
public class TenantIsolationViolationException extends TelemetryException {

    private final String userId;
    private final String ownOrganizationId;
    private final String requestedOrganizationId;

    public TenantIsolationViolationException(String userId, String ownOrganizationId, String requestedOrganizationId) {
        super("Access to organization '" + requestedOrganizationId + "' is not permitted");
        this.userId = userId;
        this.ownOrganizationId = ownOrganizationId;
        this.requestedOrganizationId = requestedOrganizationId;
    }
}
