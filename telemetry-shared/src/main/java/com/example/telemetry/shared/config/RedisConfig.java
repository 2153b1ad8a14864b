package com.example.telemetry.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Redis wiring for multi-instance deployments: presence scripts and the pub/sub listener container.
 */
@Configuration
@Profile("redis")
public class RedisConfig {

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory, Executor redisTaskExecutor) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(redisTaskExecutor);
        return container;
    }

    // A dedicated thread pool for the Redis listeners so fanout never blocks the Lettuce event loop
    @Bean
    public Executor redisTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("redis-listener-");
        executor.initialize();
        return executor;
    }

    @Bean
    public DefaultRedisScript<Long> presenceRegisterScript() {
        return script("scripts/presence-register.lua");
    }

    @Bean
    public DefaultRedisScript<Long> presenceUnregisterScript() {
        return script("scripts/presence-unregister.lua");
    }

    @Bean
    public DefaultRedisScript<Long> presenceHeartbeatScript() {
        return script("scripts/presence-heartbeat.lua");
    }

    @Bean
    public DefaultRedisScript<Long> presenceSweepScript() {
        return script("scripts/presence-sweep.lua");
    }

    private DefaultRedisScript<Long> script(String location) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource(location));
        script.setResultType(Long.class);
        return script;
    }
}
