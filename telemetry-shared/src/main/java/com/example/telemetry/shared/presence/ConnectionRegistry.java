package com.example.telemetry.shared.presence;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.exception.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Set;

/**
 * Tenant-scoped registry of live connections. A connection counts as active while its last heartbeat
 * lies inside the requested window; entries past the heartbeat timeout are reaped by {@link #sweep()}
 * even when the client never disconnected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConnectionRegistry {

    private final PresenceStore presenceStore;
    private final AppProperties appProperties;
    private final Clock clock;

    public void register(String organizationId, String userId, String socketId) {
        requireText(organizationId, "organizationId");
        requireText(userId, "userId");
        requireText(socketId, "socketId");
        presenceStore.upsert(organizationId, userId, socketId, clock.millis());
        log.debug("Registered presence for user {} socket {} in org {}", userId, socketId, organizationId);
    }

    public boolean unregister(String organizationId, String socketId) {
        requireText(organizationId, "organizationId");
        requireText(socketId, "socketId");
        boolean removed = presenceStore.remove(organizationId, socketId);
        log.debug("Unregistered socket {} in org {} (present: {})", socketId, organizationId, removed);
        return removed;
    }

    /**
     * Refreshes the score of a registered socket. Returns false when the entry is gone (for example reaped).
     */
    public boolean heartbeat(String organizationId, String socketId) {
        requireText(organizationId, "organizationId");
        requireText(socketId, "socketId");
        return presenceStore.refresh(organizationId, socketId, clock.millis());
    }

    public long countActive(String organizationId, long windowSeconds) {
        requireText(organizationId, "organizationId");
        long now = clock.millis();
        return presenceStore.count(organizationId, windowStart(now, windowSeconds), now);
    }

    public Map<String, Long> countActiveByOrganization(long windowSeconds) {
        long now = clock.millis();
        return presenceStore.countByOrganization(windowStart(now, windowSeconds), now);
    }

    public Set<String> activeUsers(String organizationId, long windowSeconds) {
        requireText(organizationId, "organizationId");
        long now = clock.millis();
        return presenceStore.distinctUsers(organizationId, windowStart(now, windowSeconds), now);
    }

    public boolean isUserOnline(String organizationId, String userId, long windowSeconds) {
        return activeUsers(organizationId, windowSeconds).contains(userId);
    }

    /**
     * Removes every entry whose last heartbeat is older than the heartbeat timeout.
     */
    public int sweep() {
        long cutoff = clock.millis() - appProperties.getPresence().getHeartbeatTimeout().toMillis();
        int removed = presenceStore.removeOlderThan(cutoff);
        if (removed > 0) {
            log.info("Reaped {} stale presence entries older than {}ms", removed, appProperties.getPresence().getHeartbeatTimeout().toMillis());
        }
        return removed;
    }

    public long heartbeatTimeoutSeconds() {
        return appProperties.getPresence().getHeartbeatTimeout().toSeconds();
    }

    private long windowStart(long now, long windowSeconds) {
        if (windowSeconds <= 0) {
            throw new InvalidRequestException("windowSeconds must be positive");
        }
        return now - windowSeconds * 1000L;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(name + " must not be blank");
        }
    }
}
