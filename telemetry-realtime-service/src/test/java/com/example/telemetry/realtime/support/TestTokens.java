package com.example.telemetry.realtime.support;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Signs bearer tokens the way the platform auth service does.
 */
public final class TestTokens {

    public static final String SECRET = "test-secret-test-secret-test-secret-0123456789";

    private TestTokens() {}

    public static String member(String userId, String organizationId) {
        return sign(SECRET, userId, organizationId, "member", Duration.ofHours(1));
    }

    public static String superAdmin(String userId, String organizationId) {
        return sign(SECRET, userId, organizationId, "super_admin", Duration.ofHours(1));
    }

    public static String sign(String secret, String userId, String organizationId, String role, Duration validFor) {
        Instant now = Instant.now();
        return Jwts.builder()
                .subject(userId)
                .claim("organizationId", organizationId)
                .claim("role", role)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(validFor)))
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
