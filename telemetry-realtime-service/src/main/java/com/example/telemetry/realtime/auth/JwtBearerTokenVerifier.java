package com.example.telemetry.realtime.auth;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.exception.AuthException;
import com.example.telemetry.shared.model.Role;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Verifies HS256 bearer tokens issued by the platform's auth service.
 */
@Component
@Slf4j
public class JwtBearerTokenVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtParser parser;

    public JwtBearerTokenVerifier(AppProperties appProperties) {
        AppProperties.Auth auth = appProperties.getAuth();
        SecretKey key = Keys.hmacShaKeyFor(auth.getJwtSecret().getBytes(StandardCharsets.UTF_8));
        JwtParserBuilder builder = Jwts.parser().verifyWith(key);
        if (auth.getIssuer() != null && !auth.getIssuer().isBlank()) {
            builder.requireIssuer(auth.getIssuer());
        }
        this.parser = builder.build();
    }

    /**
     * @throws AuthException when the token is missing, malformed, expired, signed with another key
     *                       or lacks the user and organization claims
     */
    public AuthenticatedPrincipal verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException("Missing bearer token");
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(token.trim()).getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new AuthException("Invalid token", e);
        }

        String userId = firstClaim(claims, "sub", "userId");
        String organizationId = firstClaim(claims, "organizationId", "orgId");
        if (userId == null || organizationId == null) {
            throw new AuthException("Token lacks user or organization claims");
        }
        return new AuthenticatedPrincipal(userId, organizationId, Role.fromClaim(firstClaim(claims, "role", "systemRole")));
    }

    /**
     * Token part of an {@code Authorization: Bearer ...} header, or null.
     */
    public static String extractBearer(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static String firstClaim(Claims claims, String... names) {
        for (String name : names) {
            Object value = claims.get(name);
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return null;
    }
}
