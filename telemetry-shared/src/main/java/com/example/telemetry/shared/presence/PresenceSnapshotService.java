package com.example.telemetry.shared.presence;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.dto.GlobalPresenceSnapshot;
import com.example.telemetry.shared.dto.OrganizationCount;
import com.example.telemetry.shared.dto.OrganizationPresence;
import com.example.telemetry.shared.dto.PresenceSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds presence snapshots over the heartbeat-timeout window, shared by the broadcast tick,
 * the gateway's initial messages and the REST queries.
 */
@Service
@RequiredArgsConstructor
public class PresenceSnapshotService {

    private static final Comparator<OrganizationCount> BY_COUNT_THEN_ID =
            Comparator.comparingLong(OrganizationCount::getCount).reversed()
                    .thenComparing(OrganizationCount::getOrganizationId);

    private final ConnectionRegistry connectionRegistry;
    private final SnapshotTimestamps snapshotTimestamps;
    private final AppProperties appProperties;

    public PresenceSnapshot organizationSnapshot(String organizationId) {
        long total = connectionRegistry.countActive(organizationId, connectionRegistry.heartbeatTimeoutSeconds());
        return PresenceSnapshot.builder()
                .organizationId(organizationId)
                .totalUsers(total)
                .timestamp(snapshotTimestamps.next(organizationId))
                .build();
    }

    /**
     * Totals cover every organization; the breakdown is cut to the configured limit.
     */
    public GlobalPresenceSnapshot globalSnapshot() {
        Map<String, Long> counts = connectionRegistry.countActiveByOrganization(connectionRegistry.heartbeatTimeoutSeconds());
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        List<OrganizationCount> breakdown = counts.entrySet().stream()
                .filter(entry -> entry.getValue() > 0)
                .map(entry -> new OrganizationCount(entry.getKey(), entry.getValue()))
                .sorted(BY_COUNT_THEN_ID)
                .limit(appProperties.getBroadcast().getGlobalBreakdownLimit())
                .toList();

        return GlobalPresenceSnapshot.builder()
                .totalUsers(total)
                .organizationCount((int) counts.values().stream().filter(count -> count > 0).count())
                .byOrganization(breakdown)
                .timestamp(snapshotTimestamps.nextGlobal())
                .build();
    }

    /**
     * Drops the organization's snapshot clock once nobody on this instance watches it any more.
     */
    public void releaseOrganization(String organizationId) {
        snapshotTimestamps.forget(organizationId);
    }

    public OrganizationPresence organizationPresence(String organizationId) {
        long window = connectionRegistry.heartbeatTimeoutSeconds();
        Set<String> users = connectionRegistry.activeUsers(organizationId, window);
        return OrganizationPresence.builder()
                .organizationId(organizationId)
                .count(connectionRegistry.countActive(organizationId, window))
                .uniqueUsers(users.size())
                .userIds(users)
                .build();
    }
}
