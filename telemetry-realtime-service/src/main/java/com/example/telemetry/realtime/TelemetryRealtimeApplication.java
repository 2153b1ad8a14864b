package com.example.telemetry.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Realtime telemetry service.
 *
 * Serves the presence and analytics WebSocket channels, pushes periodic presence snapshots,
 * tracks session geography and answers the admin analytics queries. Shared configuration and
 * domain services are picked up from {@code com.example.telemetry.shared}.
 */
@SpringBootApplication(scanBasePackages = "com.example.telemetry")
@EnableKafka
@EnableAsync
public class TelemetryRealtimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TelemetryRealtimeApplication.class, args);
    }
}
