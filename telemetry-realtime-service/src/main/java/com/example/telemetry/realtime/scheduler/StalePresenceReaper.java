package com.example.telemetry.realtime.scheduler;

import com.example.telemetry.shared.aspect.Monitored;
import com.example.telemetry.shared.exception.TransientStoreException;
import com.example.telemetry.shared.presence.ConnectionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Removes presence entries of connections that stopped heartbeating without disconnecting,
 * for example because the instance holding them died.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StalePresenceReaper {

    private final ConnectionRegistry connectionRegistry;

    /**
     * The SchedulerLock ensures only one instance sweeps at a time.
     */
    @Monitored("scheduler")
    @Scheduled(fixedDelayString = "${telemetry.presence.sweep-interval-ms:15000}")
    @SchedulerLock(name = "sweepStalePresence", lockAtLeastFor = "PT5S", lockAtMostFor = "PT1M")
    public void sweepStalePresence() {
        try {
            connectionRegistry.sweep();
        } catch (TransientStoreException e) {
            log.warn("Stale presence sweep skipped, store unavailable: {}", e.getMessage());
        }
    }
}
