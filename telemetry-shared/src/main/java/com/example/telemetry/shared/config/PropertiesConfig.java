package com.example.telemetry.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PropertiesConfig {

    @Value("${pod.name:${POD_NAME:telemetry-realtime-0}}")
    private String podName;

    @Value("${cluster.name:${CLUSTER_NAME:cluster-a}}")
    private String clusterName;

    @Bean
    @ConfigurationProperties(prefix = "telemetry")
    public AppProperties appProperties() {
        AppProperties properties = new AppProperties();

        // Pod and cluster identity come from the environment, everything else binds from telemetry.*
        properties.setPodName(podName);
        properties.setClusterName(clusterName);
        return properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
