package com.example.telemetry.realtime.controller;

import com.example.telemetry.realtime.auth.AuthenticatedPrincipal;
import com.example.telemetry.realtime.auth.JwtBearerTokenVerifier;
import com.example.telemetry.shared.exception.AuthException;
import com.example.telemetry.shared.exception.TenantIsolationViolationException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;

@Component
@RequiredArgsConstructor
public class RequestPrincipalResolver {

    private final JwtBearerTokenVerifier tokenVerifier;

    public AuthenticatedPrincipal resolve(ServerWebExchange exchange) {
        String token = JwtBearerTokenVerifier.extractBearer(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            throw new AuthException("Missing bearer token");
        }
        return tokenVerifier.verify(token);
    }

    /**
     * The organization a request operates on: the caller's own unless another one was asked for,
     * which only super-admins may do.
     */
    public String targetOrganization(AuthenticatedPrincipal principal, String requestedOrganizationId) {
        if (requestedOrganizationId == null || requestedOrganizationId.isBlank()) {
            return principal.organizationId();
        }
        if (!principal.canAccessOrganization(requestedOrganizationId)) {
            throw new TenantIsolationViolationException(principal.userId(), principal.organizationId(), requestedOrganizationId);
        }
        return requestedOrganizationId;
    }

    public void requireSuperAdmin(AuthenticatedPrincipal principal, String resource) {
        if (!principal.isSuperAdmin()) {
            throw new TenantIsolationViolationException(principal.userId(), principal.organizationId(), resource);
        }
    }
}
