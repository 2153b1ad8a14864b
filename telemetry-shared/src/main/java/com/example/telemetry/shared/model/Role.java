package com.example.telemetry.shared.model;

import java.util.Locale;

public enum Role {
    SUPER_ADMIN,
    ORG_ADMIN,
    MEMBER;

    /**
     * Maps a role claim from an issued token onto the roles this service distinguishes.
     * Unrecognized or missing claims get the least privileged role.
     */
    public static Role fromClaim(String claim) {
        if (claim == null) {
            return MEMBER;
        }
        switch (claim.trim().toLowerCase(Locale.ROOT)) {
            case "super_admin":
            case "super-admin":
            case "platform_admin":
                return SUPER_ADMIN;
            case "org_admin":
            case "admin":
            case "owner":
                return ORG_ADMIN;
            default:
                return MEMBER;
        }
    }
}
