package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.model.GeoLocation;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisGeoLocationCacheTest {

    private static final String KEY = "geo:ip:3f2a";

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private RedisGeoLocationCache cache;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        cache = new RedisGeoLocationCache(redisTemplate, objectMapper, new AppProperties());
    }

    @Test
    void storedLocationIsReadBack() throws Exception {
        GeoLocation berlin = berlin();
        when(valueOperations.get(KEY)).thenReturn(objectMapper.writeValueAsString(berlin));

        assertThat(cache.get(KEY)).contains(berlin);
    }

    @Test
    void missingEntryIsEmpty() {
        when(valueOperations.get(KEY)).thenReturn(null);

        assertThat(cache.get(KEY)).isEmpty();
    }

    @Test
    void unreadableEntryIsTreatedAsAMiss() {
        when(valueOperations.get(KEY)).thenReturn("{\"lat\": \"north\"");

        assertThat(cache.get(KEY)).isEmpty();
    }

    @Test
    void redisOutageOnReadIsTreatedAsAMiss() {
        when(valueOperations.get(KEY)).thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(cache.get(KEY)).isEmpty();
    }

    @Test
    void putWritesJsonWithTheConfiguredTtl() throws Exception {
        GeoLocation berlin = berlin();

        cache.put(KEY, berlin);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq(KEY), json.capture(), eq(Duration.ofHours(24)));
        assertThat(objectMapper.readValue(json.getValue(), GeoLocation.class)).isEqualTo(berlin);
    }

    @Test
    void redisOutageOnWriteIsNotPropagated() {
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        assertThatCode(() -> cache.put(KEY, berlin())).doesNotThrowAnyException();
    }

    private static GeoLocation berlin() {
        return GeoLocation.builder()
                .ipKey("3f2a")
                .countryCode("DE")
                .country("Germany")
                .region("Berlin")
                .city("Berlin")
                .lat(52.52)
                .lng(13.40)
                .timezone("Europe/Berlin")
                .resolvedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }
}
