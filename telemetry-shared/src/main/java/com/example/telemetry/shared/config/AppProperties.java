package com.example.telemetry.shared.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    private String podName;
    private String clusterName;

    private final Presence presence = new Presence();
    private final Broadcast broadcast = new Broadcast();
    private final Geo geo = new Geo();
    private final Events events = new Events();
    private final Gateway gateway = new Gateway();
    private final Auth auth = new Auth();
    private final Kafka kafka = new Kafka();

    @Data
    public static class Presence {
        @NotNull
        private Duration heartbeatTimeout = Duration.ofSeconds(30);
        @NotBlank
        private String keyPrefix = "presence";
        @Positive
        private long sweepIntervalMs = 15_000;
    }

    @Data
    public static class Broadcast {
        @NotNull
        private Duration interval = Duration.ofSeconds(5);
        @Positive
        private int globalBreakdownLimit = 50;
    }

    @Data
    public static class Geo {
        @NotBlank
        private String databasePath = "data/GeoLite2-City.mmdb";
        @NotNull
        private Duration cacheTtl = Duration.ofHours(24);
        @Positive
        private long cacheMaximumSize = 100_000;
        @NotBlank
        private String hashSalt = "telemetry-geoip-salt";
        private boolean truncateForPrivacy = false;
        @NotNull
        private Duration staleAfter = Duration.ofDays(7);
        @Min(0)
        @Max(4)
        private int heatmapPrecision = 1;
        @Positive
        private int heatmapCap = 500;
        @Positive
        private int lookupThreads = 4;
        @NotBlank
        private String reloadCron = "0 0 3 * * SUN";
    }

    @Data
    public static class Events {
        @Positive
        private int recentCapacity = 100;
    }

    @Data
    public static class Gateway {
        @NotNull
        private Duration authTimeout = Duration.ofSeconds(10);
        @Positive
        private int degradeThreshold = 256;
        @Positive
        private int terminateThreshold = 1024;
        @NotNull
        private Duration reconnectMinBackoff = Duration.ofMillis(500);
        @NotNull
        private Duration reconnectMaxBackoff = Duration.ofSeconds(10);
        @Positive
        private long idleCheckIntervalMs = 5_000;
    }

    @Data
    public static class Auth {
        @NotBlank
        private String jwtSecret;
        private String issuer;
    }

    @Data
    public static class Kafka {
        private final Topic topic = new Topic();
        private final Consumer consumer = new Consumer();
        private final Retry retry = new Retry();

        @Data
        public static class Topic {
            @NotBlank
            private String nameAnalyticsEvents = "telemetry-analytics-events";
            @Positive
            private int partitions = 3;
            @Positive
            private short replicationFactor = 1;
        }

        @Data
        public static class Consumer {
            @NotBlank
            private String groupAnalytics = "telemetry-analytics-ingest";
            private boolean enabled = true;
        }

        @Data
        public static class Retry {
            @Positive
            private int maxAttempts = 3;
            @Positive
            private long backoffDelay = 1000L;
        }
    }
}
