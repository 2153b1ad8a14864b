package com.example.telemetry.realtime.scheduler;

import com.example.telemetry.realtime.gateway.RealtimeGateway;
import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.config.MonitoringConfig;
import com.example.telemetry.shared.dto.GlobalPresenceSnapshot;
import com.example.telemetry.shared.dto.PresenceSnapshot;
import com.example.telemetry.shared.exception.TransientStoreException;
import com.example.telemetry.shared.presence.PresenceSnapshotService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pushes presence snapshots to the gateway's presence subscribers on a fixed interval.
 *
 * A tick computes every snapshot before delivering any of them, so a store failure halfway
 * skips the whole tick instead of updating some organizations only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PresenceBroadcastScheduler {

    private final RealtimeGateway realtimeGateway;
    private final PresenceSnapshotService presenceSnapshotService;
    private final AppProperties appProperties;
    private final MonitoringConfig.TelemetryMetricsCollector metricsCollector;

    private Scheduler tickScheduler;
    private Disposable ticks;

    @PostConstruct
    public void start() {
        start(Schedulers.newSingle("presence-broadcast"));
    }

    void start(Scheduler scheduler) {
        Duration interval = appProperties.getBroadcast().getInterval();
        tickScheduler = scheduler;
        ticks = Flux.interval(interval, interval, tickScheduler)
                .onBackpressureDrop(tick -> log.debug("Presence tick {} dropped, previous one still running", tick))
                .subscribe(this::runTick,
                        error -> log.error("Presence broadcast stopped unexpectedly: {}", error.getMessage(), error));
        log.info("Presence broadcast started, interval {}", interval);
    }

    @PreDestroy
    public void stop() {
        if (ticks != null && !ticks.isDisposed()) {
            ticks.dispose();
        }
        if (tickScheduler != null) {
            tickScheduler.dispose();
        }
        log.info("Presence broadcast stopped.");
    }

    // An exception escaping into Flux.interval would cancel every later tick
    private void runTick(long tickNumber) {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Presence broadcast tick {} failed: {}", tickNumber, e.getMessage(), e);
            metricsCollector.incrementCounter("telemetry.broadcast.ticks", "result", "skipped");
        }
    }

    /**
     * One broadcast round. Returns the number of organization snapshots delivered.
     */
    public int tick() {
        Set<String> organizations = realtimeGateway.subscribedOrganizations();
        boolean global = realtimeGateway.hasGlobalPresenceSubscribers();
        if (organizations.isEmpty() && !global) {
            return 0;
        }

        long start = System.currentTimeMillis();
        List<PresenceSnapshot> snapshots = new ArrayList<>(organizations.size());
        GlobalPresenceSnapshot globalSnapshot = null;
        try {
            for (String organizationId : organizations) {
                snapshots.add(presenceSnapshotService.organizationSnapshot(organizationId));
            }
            if (global) {
                globalSnapshot = presenceSnapshotService.globalSnapshot();
            }
        } catch (TransientStoreException e) {
            log.warn("Skipping presence broadcast tick, store unavailable: {}", e.getMessage());
            metricsCollector.incrementCounter("telemetry.broadcast.ticks", "result", "skipped");
            return 0;
        }

        snapshots.forEach(realtimeGateway::deliverPresenceUpdate);
        if (globalSnapshot != null) {
            realtimeGateway.deliverGlobalBreakdown(globalSnapshot);
        }

        metricsCollector.incrementCounter("telemetry.broadcast.ticks", "result", "delivered");
        metricsCollector.recordTimer("telemetry.broadcast.tick.duration", System.currentTimeMillis() - start);
        log.debug("Broadcast presence to {} organizations (global: {})", snapshots.size(), global);
        return snapshots.size();
    }
}
