package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.model.GeoLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Cluster-wide location cache so every instance benefits from a lookup done by any of them.
 */
@Component
@Profile("redis")
@RequiredArgsConstructor
@Slf4j
public class RedisGeoLocationCache implements GeoLocationCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;

    @Override
    public Optional<GeoLocation> get(String key) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, GeoLocation.class));
        } catch (DataAccessException e) {
            log.warn("Geo cache read failed for key {}: {}", key, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable geo cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, GeoLocation location) {
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(location), appProperties.getGeo().getCacheTtl());
        } catch (DataAccessException e) {
            log.warn("Geo cache write failed for key {}: {}", key, e.getMessage());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize geo location for cache key {}", key, e);
        }
    }
}
