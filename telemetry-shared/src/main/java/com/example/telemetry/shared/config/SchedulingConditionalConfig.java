package com.example.telemetry.shared.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables Spring's scheduling for all profiles except 'checkpoint-build'.
 */
@Configuration
@EnableScheduling
@Profile("!checkpoint-build")
public class SchedulingConditionalConfig {
}
