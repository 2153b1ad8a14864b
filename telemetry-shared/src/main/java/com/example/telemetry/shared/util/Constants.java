package com.example.telemetry.shared.util;

public final class Constants {

    private Constants() {}

    public static final String DLT_SUFFIX = "-dlt";

    /** Logger name for security events (isolation violations, rejected cross-tenant deliveries). */
    public static final String SECURITY_LOGGER = "SECURITY";

    public static final class EventChannels {
        private EventChannels() {}
        public static final String ORGANIZATION_PREFIX = "analytics:";
        public static final String GLOBAL = "analytics:global";

        public static String forOrganization(String organizationId) {
            return ORGANIZATION_PREFIX + organizationId;
        }
    }

    public static final class CacheKeys {
        private CacheKeys() {}
        public static final String GEOIP_PREFIX = "geoip:";
    }

    public enum Channel {
        PRESENCE,
        ANALYTICS
    }
}
