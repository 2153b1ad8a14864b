package com.example.telemetry.shared.events;

import com.example.telemetry.shared.exception.TransientStoreException;
import com.example.telemetry.shared.model.AnalyticsEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Redis pub/sub broker so that every instance sees every event regardless of which one published it.
 * One listener is registered per channel on first subscription; received messages are fanned out locally.
 */
@Component
@Profile("redis")
@Slf4j
public class RedisEventBroker implements EventBroker {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final LocalEventBroker localFanout = new LocalEventBroker();
    private final Set<String> listenedChannels = ConcurrentHashMap.newKeySet();

    public RedisEventBroker(StringRedisTemplate redisTemplate, RedisMessageListenerContainer listenerContainer, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(String channel, AnalyticsEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Analytics event " + event.getId() + " is not serializable", e);
        }
        try {
            redisTemplate.convertAndSend(channel, json);
        } catch (DataAccessException e) {
            throw new TransientStoreException("Failed to publish event " + event.getId() + " on " + channel, e);
        }
    }

    @Override
    public Flux<AnalyticsEvent> subscribe(String channel) {
        return Flux.defer(() -> {
            ensureListening(channel);
            return localFanout.subscribe(channel);
        });
    }

    private void ensureListening(String channel) {
        if (!listenedChannels.add(channel)) {
            return;
        }
        try {
            listenerContainer.addMessageListener(new ChannelListener(channel), new ChannelTopic(channel));
            log.info("Listening for analytics events on Redis channel {}", channel);
        } catch (RuntimeException e) {
            listenedChannels.remove(channel);
            throw new TransientStoreException("Failed to subscribe to Redis channel " + channel, e);
        }
    }

    private final class ChannelListener implements MessageListener {

        private final String channel;

        private ChannelListener(String channel) {
            this.channel = channel;
        }

        @Override
        public void onMessage(Message message, byte[] pattern) {
            try {
                AnalyticsEvent event = objectMapper.readValue(message.getBody(), AnalyticsEvent.class);
                localFanout.publish(channel, event);
            } catch (IOException e) {
                log.error("Failed to deserialize analytics event from Redis channel {}. Raw message: {}",
                        channel, new String(message.getBody()), e);
            }
        }
    }
}
