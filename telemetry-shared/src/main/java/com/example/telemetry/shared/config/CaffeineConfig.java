package com.example.telemetry.shared.config;

import com.example.telemetry.shared.model.GeoLocation;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

@Configuration
@Profile("!redis")
public class CaffeineConfig {

    @Bean
    public Cache<String, GeoLocation> geoLocationCache(AppProperties appProperties) {
        AppProperties.Geo geo = appProperties.getGeo();
        return Caffeine.newBuilder()
                .maximumSize(geo.getCacheMaximumSize())
                .expireAfterWrite(geo.getCacheTtl())
                .recordStats()
                .build();
    }
}
