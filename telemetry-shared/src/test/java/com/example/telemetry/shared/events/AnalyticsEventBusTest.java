package com.example.telemetry.shared.events;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.config.MonitoringConfig;
import com.example.telemetry.shared.dto.PublishEventRequest;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.exception.TransientStoreException;
import com.example.telemetry.shared.model.AnalyticsEvent;
import com.example.telemetry.shared.model.AnalyticsEventType;
import com.example.telemetry.shared.support.MutableClock;
import com.example.telemetry.shared.util.Constants;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalyticsEventBusTest {

    private LocalEventBroker broker;
    private RecentEventBuffer buffer;
    private MutableClock clock;
    private MonitoringConfig.TelemetryMetricsCollector metrics;
    private AnalyticsEventBus bus;

    @BeforeEach
    void setUp() {
        broker = new LocalEventBroker();
        AppProperties appProperties = new AppProperties();
        appProperties.getEvents().setRecentCapacity(5);
        buffer = new RecentEventBuffer(appProperties);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        metrics = new MonitoringConfig.TelemetryMetricsCollector(new SimpleMeterRegistry());
        bus = new AnalyticsEventBus(broker, buffer, clock, metrics);
        bus.start();
    }

    @AfterEach
    void tearDown() {
        bus.stop();
    }

    @Test
    void organizationSubscribersOnlySeeTheirOwnEvents() {
        List<AnalyticsEvent> seenByA = new CopyOnWriteArrayList<>();
        List<AnalyticsEvent> seenByB = new CopyOnWriteArrayList<>();
        List<AnalyticsEvent> seenGlobally = new CopyOnWriteArrayList<>();
        Disposable a = bus.subscribeOrganization("org-a").subscribe(seenByA::add);
        Disposable b = bus.subscribeOrganization("org-b").subscribe(seenByB::add);
        Disposable global = bus.subscribeGlobal().subscribe(seenGlobally::add);

        for (int i = 0; i < 1000; i++) {
            bus.publish(i % 2 == 0 ? "org-a" : "org-b", AnalyticsEventType.USER_ACTIVITY, Map.of("n", i), null);
        }

        assertThat(seenByA).hasSize(500).allMatch(event -> event.getOrganizationId().equals("org-a"));
        assertThat(seenByB).hasSize(500).allMatch(event -> event.getOrganizationId().equals("org-b"));
        assertThat(seenGlobally).hasSize(1000);
        a.dispose();
        b.dispose();
        global.dispose();
    }

    @Test
    void foreignEventOnAnOrganizationChannelIsDropped() {
        List<AnalyticsEvent> seen = new CopyOnWriteArrayList<>();
        Disposable subscription = bus.subscribeOrganization("org-a").subscribe(seen::add);

        broker.publish(Constants.EventChannels.forOrganization("org-a"), AnalyticsEvent.builder()
                .id("evt_forged")
                .type(AnalyticsEventType.API_ERROR)
                .organizationId("org-b")
                .timestamp(clock.instant())
                .build());

        assertThat(seen).isEmpty();
        assertThat(metrics.getCounterValue("telemetry.events.isolation_drops")).isEqualTo(1);
        subscription.dispose();
    }

    @Test
    void eventsAreStampedAndPreservePublishOrder() {
        List<AnalyticsEvent> seen = new CopyOnWriteArrayList<>();
        Disposable subscription = bus.subscribeOrganization("org-a").subscribe(seen::add);

        AnalyticsEvent first = bus.publish("org-a", AnalyticsEventType.MEETING_STARTED, Map.of("meetingId", "m-1"), null);
        clock.advance(Duration.ofMillis(5));
        AnalyticsEvent second = bus.publish("org-a", AnalyticsEventType.MEETING_ENDED, null, null);

        assertThat(first.getId()).startsWith("evt_");
        assertThat(first.getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(second.getPayload()).isEmpty();
        assertThat(seen).extracting(AnalyticsEvent::getId).containsExactly(first.getId(), second.getId());
        subscription.dispose();
    }

    @Test
    void eventIdsAreUnique() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            ids.add(bus.publish("org-a", AnalyticsEventType.API_REQUEST, null, null).getId());
        }
        assertThat(ids).hasSize(500);
    }

    @Test
    void recentBufferIsFedFromTheGlobalChannel() {
        for (int i = 0; i < 7; i++) {
            bus.publish("org-a", AnalyticsEventType.USER_ACTIVITY, Map.of("n", i), null);
        }
        bus.publish("org-b", AnalyticsEventType.USER_LOGIN, null, null);

        assertThat(bus.getRecent("org-a", 10)).hasSize(5)
                .extracting(event -> event.getPayload().get("n"))
                .containsExactly(2, 3, 4, 5, 6);
        assertThat(bus.getRecent("org-a", 2)).extracting(event -> event.getPayload().get("n")).containsExactly(5, 6);
        assertThat(bus.getRecent("org-b", 10)).hasSize(1);
        assertThat(bus.getRecentGlobal(10)).hasSize(5).last()
                .extracting(AnalyticsEvent::getOrganizationId).isEqualTo("org-b");
        assertThat(bus.getRecent("org-c", 10)).isEmpty();
    }

    @Test
    void publishRequestResolvesTheWireType() {
        AnalyticsEvent event = bus.publish(PublishEventRequest.builder()
                .organizationId("org-a")
                .type("transcription:completed")
                .data(Map.of("duration", 42))
                .build());

        assertThat(event.getType()).isEqualTo(AnalyticsEventType.TRANSCRIPTION_COMPLETED);
        assertThatThrownBy(() -> bus.publish(PublishEventRequest.builder().organizationId("org-a").type("meeting:*").build()))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> bus.publish(" ", AnalyticsEventType.API_ERROR, null, null))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void unreachableBrokerDropsTheEventWithoutFailingTheProducer() {
        EventBroker failing = mock(EventBroker.class);
        when(failing.subscribe(anyString())).thenReturn(Flux.never());
        doThrow(new TransientStoreException("redis down", null)).when(failing).publish(anyString(), any());
        AnalyticsEventBus failingBus = new AnalyticsEventBus(failing, buffer, clock, metrics);

        AnalyticsEvent event = failingBus.publish("org-a", AnalyticsEventType.ALERT_TRIGGERED, null, null);

        assertThat(event.getId()).isNotBlank();
        assertThat(metrics.getCounterValue("telemetry.events.dropped", "reason", "broker_unavailable")).isEqualTo(1);
    }
}
