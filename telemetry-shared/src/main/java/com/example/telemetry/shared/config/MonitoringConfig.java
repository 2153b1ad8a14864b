package com.example.telemetry.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for presence, geo resolution, event fanout and the realtime gateway.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    @Bean
    public MeterBinder telemetryMetrics() {
        return registry -> {
            registry.counter("telemetry.events.dropped", "reason", "broker_unavailable");
            registry.counter("telemetry.events.isolation_drops");

            registry.counter("telemetry.geo.lookups", "result", "hit");
            registry.counter("telemetry.geo.lookups", "result", "miss");
            registry.counter("telemetry.geo.lookups", "result", "unknown");

            registry.counter("telemetry.broadcast.ticks", "result", "delivered");
            registry.counter("telemetry.broadcast.ticks", "result", "skipped");

            Timer.builder("telemetry.broadcast.tick.duration")
                  .description("Time taken to compute and fan out one presence snapshot tick")
                  .register(registry);

            registry.counter("telemetry.security.isolation_violations", "source", "gateway");
            registry.counter("telemetry.gateway.slow_consumers");
        };
    }

    @Bean
    public TelemetryMetricsCollector telemetryMetricsCollector(MeterRegistry registry) {
        return new TelemetryMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths don't re-register them.
     */
    public static class TelemetryMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

        public TelemetryMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment();
        }

        public void recordTimer(String name, long duration, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k ->
                Timer.builder(name).tags(tags).register(registry))
                  .record(duration, TimeUnit.MILLISECONDS);
        }

        public void setGauge(String name, double value, String... tags) {
            String key = name + "_" + String.join("_", tags);
            AtomicLong gauge = gauges.computeIfAbsent(key, k -> {
                AtomicLong newGauge = new AtomicLong();
                registry.gauge(name, Tags.of(tags), newGauge);
                return newGauge;
            });
            gauge.set((long) value);
        }

        public long getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? (long) counter.count() : 0;
        }
    }
}
