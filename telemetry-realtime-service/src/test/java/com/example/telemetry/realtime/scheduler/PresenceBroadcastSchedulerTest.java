package com.example.telemetry.realtime.scheduler;

import com.example.telemetry.realtime.gateway.RealtimeGateway;
import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.config.MonitoringConfig;
import com.example.telemetry.shared.dto.GlobalPresenceSnapshot;
import com.example.telemetry.shared.dto.PresenceSnapshot;
import com.example.telemetry.shared.exception.TransientStoreException;
import com.example.telemetry.shared.presence.PresenceSnapshotService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PresenceBroadcastSchedulerTest {

    @Mock
    private RealtimeGateway realtimeGateway;
    @Mock
    private PresenceSnapshotService presenceSnapshotService;

    private MonitoringConfig.TelemetryMetricsCollector metrics;
    private PresenceBroadcastScheduler scheduler;

    @BeforeEach
    void setUp() {
        metrics = new MonitoringConfig.TelemetryMetricsCollector(new SimpleMeterRegistry());
        scheduler = new PresenceBroadcastScheduler(realtimeGateway, presenceSnapshotService, new AppProperties(), metrics);
    }

    @Test
    void idleTickDoesNothing() {
        when(realtimeGateway.subscribedOrganizations()).thenReturn(Set.of());
        when(realtimeGateway.hasGlobalPresenceSubscribers()).thenReturn(false);

        assertThat(scheduler.tick()).isZero();
        verifyNoInteractions(presenceSnapshotService);
    }

    @Test
    void deliversOneSnapshotPerSubscribedOrganization() {
        PresenceSnapshot a = snapshot("org-a", 3);
        PresenceSnapshot b = snapshot("org-b", 1);
        GlobalPresenceSnapshot global = GlobalPresenceSnapshot.builder().totalUsers(4).organizationCount(2).byOrganization(List.of()).build();
        when(realtimeGateway.subscribedOrganizations()).thenReturn(Set.of("org-a", "org-b"));
        when(realtimeGateway.hasGlobalPresenceSubscribers()).thenReturn(true);
        when(presenceSnapshotService.organizationSnapshot("org-a")).thenReturn(a);
        when(presenceSnapshotService.organizationSnapshot("org-b")).thenReturn(b);
        when(presenceSnapshotService.globalSnapshot()).thenReturn(global);

        assertThat(scheduler.tick()).isEqualTo(2);

        verify(realtimeGateway).deliverPresenceUpdate(a);
        verify(realtimeGateway).deliverPresenceUpdate(b);
        verify(realtimeGateway).deliverGlobalBreakdown(global);
        assertThat(metrics.getCounterValue("telemetry.broadcast.ticks", "result", "delivered")).isEqualTo(1);
    }

    @Test
    void storeFailureSkipsTheWholeTick() {
        when(realtimeGateway.subscribedOrganizations()).thenReturn(Set.of("org-a"));
        when(realtimeGateway.hasGlobalPresenceSubscribers()).thenReturn(true);
        when(presenceSnapshotService.organizationSnapshot("org-a")).thenReturn(snapshot("org-a", 1));
        when(presenceSnapshotService.globalSnapshot()).thenThrow(new TransientStoreException("redis down", null));

        assertThat(scheduler.tick()).isZero();

        verify(realtimeGateway, never()).deliverPresenceUpdate(any());
        verify(realtimeGateway, never()).deliverGlobalBreakdown(any());
        assertThat(metrics.getCounterValue("telemetry.broadcast.ticks", "result", "skipped")).isEqualTo(1);
    }

    @Test
    void unexpectedFailureSkipsOneTickAndLaterTicksStillRun() {
        AppProperties appProperties = new AppProperties();
        appProperties.getBroadcast().setInterval(Duration.ofSeconds(1));
        PresenceBroadcastScheduler periodic = new PresenceBroadcastScheduler(realtimeGateway, presenceSnapshotService, appProperties, metrics);
        PresenceSnapshot snapshot = snapshot("org-a", 2);
        when(realtimeGateway.subscribedOrganizations()).thenReturn(Set.of("org-a"));
        when(realtimeGateway.hasGlobalPresenceSubscribers()).thenReturn(false);
        when(presenceSnapshotService.organizationSnapshot("org-a"))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(snapshot);

        VirtualTimeScheduler virtualTime = VirtualTimeScheduler.create();
        periodic.start(virtualTime);
        try {
            virtualTime.advanceTimeBy(Duration.ofSeconds(3));
        } finally {
            periodic.stop();
        }

        verify(presenceSnapshotService, times(3)).organizationSnapshot("org-a");
        verify(realtimeGateway, times(2)).deliverPresenceUpdate(snapshot);
        assertThat(metrics.getCounterValue("telemetry.broadcast.ticks", "result", "skipped")).isEqualTo(1);
        assertThat(metrics.getCounterValue("telemetry.broadcast.ticks", "result", "delivered")).isEqualTo(2);
    }

    private static PresenceSnapshot snapshot(String organizationId, long total) {
        return PresenceSnapshot.builder().organizationId(organizationId).totalUsers(total).timestamp(Instant.EPOCH).build();
    }
}
