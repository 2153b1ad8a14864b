package com.example.telemetry.realtime.health;

import com.example.telemetry.realtime.gateway.RealtimeGateway;
import com.example.telemetry.shared.dto.GeoDatabaseStatus;
import com.example.telemetry.shared.geo.GeoDatabase;
import com.example.telemetry.shared.presence.ConnectionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Health of the realtime service. The presence store is required; a missing geo database
 * only degrades geo analytics and is reported without taking the service down.
 */
@Component
public class TelemetryHealthIndicator implements HealthIndicator {

    private final RealtimeGateway realtimeGateway;
    private final ConnectionRegistry connectionRegistry;
    private final GeoDatabase geoDatabase;

    public TelemetryHealthIndicator(RealtimeGateway realtimeGateway,
                                    ConnectionRegistry connectionRegistry,
                                    GeoDatabase geoDatabase) {
        this.realtimeGateway = realtimeGateway;
        this.connectionRegistry = connectionRegistry;
        this.geoDatabase = geoDatabase;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();

        boolean presenceHealthy = checkPresenceStore(details);
        checkGeoDatabase(details);
        details.put("gateway", realtimeGateway.stats());

        Health.Builder healthBuilder = presenceHealthy ? Health.up() : Health.down();
        return healthBuilder.withDetails(details).build();
    }

    /**
     * Check presence store health
     */
    private boolean checkPresenceStore(Map<String, Object> details) {
        try {
            Map<String, Long> counts = connectionRegistry.countActiveByOrganization(connectionRegistry.heartbeatTimeoutSeconds());
            details.put("presenceStatus", "UP");
            details.put("activeOrganizations", counts.size());
            return true;
        } catch (Exception e) {
            details.put("presenceStatus", "DOWN");
            details.put("presenceError", e.getMessage());
            return false;
        }
    }

    private void checkGeoDatabase(Map<String, Object> details) {
        GeoDatabaseStatus status = geoDatabase.status();
        details.put("geoDatabaseStatus", status.isInitialized() ? "UP" : "UNAVAILABLE");
        details.put("geoDatabaseStale", status.isStale());
    }
}
