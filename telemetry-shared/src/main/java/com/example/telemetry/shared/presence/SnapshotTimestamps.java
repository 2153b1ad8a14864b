package com.example.telemetry.shared.presence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands out snapshot timestamps that never go backwards for a given organization,
 * even if the wall clock does.
 */
@Component
@RequiredArgsConstructor
public class SnapshotTimestamps {

    private final Clock clock;
    private final ConcurrentHashMap<String, Instant> lastByOrganization = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> lastGlobal = new AtomicReference<>(Instant.EPOCH);

    public Instant next(String organizationId) {
        return lastByOrganization.merge(organizationId, clock.instant(), SnapshotTimestamps::later);
    }

    public Instant nextGlobal() {
        Instant now = clock.instant();
        return lastGlobal.accumulateAndGet(now, SnapshotTimestamps::later);
    }

    public void forget(String organizationId) {
        lastByOrganization.remove(organizationId);
    }

    private static Instant later(Instant previous, Instant candidate) {
        return candidate.isBefore(previous) ? previous : candidate;
    }
}
