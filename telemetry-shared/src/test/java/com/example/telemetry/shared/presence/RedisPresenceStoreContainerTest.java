package com.example.telemetry.shared.presence;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.config.RedisConfig;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The presence scripts against a real Redis.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisPresenceStoreContainerTest {

    private static final long ALL = Long.MAX_VALUE;

    @Container
    private static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private RedisPresenceStore store;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        redisTemplate.execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
        RedisConfig scripts = new RedisConfig();
        store = new RedisPresenceStore(redisTemplate, scripts.presenceRegisterScript(), scripts.presenceUnregisterScript(),
                scripts.presenceHeartbeatScript(), scripts.presenceSweepScript(), new AppProperties());
    }

    @Test
    void registerRefreshUnregisterLifecycle() {
        store.upsert("org-a", "alice", "s1", 1_000);
        store.upsert("org-a", "alice", "s2", 1_000);
        store.upsert("org-a", "bob", "s3", 1_000);

        assertThat(store.count("org-a", 0, ALL)).isEqualTo(3);
        assertThat(store.distinctUsers("org-a", 0, ALL)).containsExactlyInAnyOrder("alice", "bob");

        assertThat(store.refresh("org-a", "s1", 5_000)).isTrue();
        assertThat(store.count("org-a", 5_000, ALL)).isEqualTo(1);

        assertThat(store.remove("org-a", "s2")).isTrue();
        assertThat(store.remove("org-a", "s2")).isFalse();
        assertThat(store.count("org-a", 0, ALL)).isEqualTo(2);
    }

    @Test
    void registeringTheSameSocketTwiceKeepsOneEntry() {
        store.upsert("org-a", "alice", "s1", 1_000);
        store.upsert("org-a", "alice", "s1", 2_000);

        assertThat(store.count("org-a", 0, ALL)).isEqualTo(1);
        assertThat(store.count("org-a", 2_000, ALL)).isEqualTo(1);
    }

    @Test
    void socketReRegisteredUnderAnotherUserMovesToThatUser() {
        store.upsert("org-a", "alice", "s1", 1_000);
        store.upsert("org-a", "bob", "s1", 2_000);

        assertThat(store.count("org-a", 0, ALL)).isEqualTo(1);
        assertThat(store.distinctUsers("org-a", 0, ALL)).containsExactly("bob");

        assertThat(store.remove("org-a", "s1")).isTrue();
        assertThat(store.count("org-a", 0, ALL)).isZero();
    }

    @Test
    void heartbeatForUnknownSocketIsRejected() {
        store.upsert("org-a", "alice", "s1", 1_000);

        assertThat(store.refresh("org-a", "s-unknown", 2_000)).isFalse();
        assertThat(store.refresh("org-b", "s1", 2_000)).isFalse();
        assertThat(store.count("org-a", 2_000, ALL)).isZero();
    }

    @Test
    void sweepRemovesStaleEntriesAndTheirOwners() {
        store.upsert("org-a", "alice", "s1", 1_000);
        store.upsert("org-a", "bob", "s2", 5_000);
        store.upsert("org-b", "carol", "s3", 1_000);

        assertThat(store.removeOlderThan(2_000)).isEqualTo(2);

        assertThat(store.count("org-a", 0, ALL)).isEqualTo(1);
        assertThat(store.refresh("org-a", "s1", 6_000)).isFalse();
        assertThat(store.refresh("org-a", "s2", 6_000)).isTrue();
        assertThat(store.countByOrganization(0, ALL)).containsOnlyKeys("org-a");
        assertThat(redisTemplate.opsForSet().members("presence:orgs")).containsExactly("org-a");
    }

    @Test
    void organizationSweptEmptyIsIndexedAgainOnRegister() {
        store.upsert("org-a", "alice", "s1", 1_000);
        store.removeOlderThan(2_000);
        assertThat(store.countByOrganization(0, ALL)).isEmpty();

        store.upsert("org-a", "alice", "s2", 3_000);

        assertThat(store.countByOrganization(0, ALL)).containsEntry("org-a", 1L);
    }
}
