package com.example.telemetry.shared.presence;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.exception.TransientStoreException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis presence store shared by every gateway instance.
 * <p>
 * Per organization: a sorted set {@code <prefix>:{org}:sockets} of {@code userId:socketId} members scored
 * by last heartbeat, and a hash {@code <prefix>:{org}:owners} mapping socketId to userId so a socket can be
 * removed without knowing its user. Both keys share a hash tag so the Lua scripts stay single-slot.
 * A set {@code <prefix>:orgs} tracks organizations that may hold entries. It lives in another slot, so it is
 * maintained outside the scripts: added to after every register and pruned by the sweep only once an
 * organization's set is still empty after the removal.
 */
@Component
@Profile("redis")
@RequiredArgsConstructor
@Slf4j
public class RedisPresenceStore implements PresenceStore {

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> presenceRegisterScript;
    private final DefaultRedisScript<Long> presenceUnregisterScript;
    private final DefaultRedisScript<Long> presenceHeartbeatScript;
    private final DefaultRedisScript<Long> presenceSweepScript;
    private final AppProperties appProperties;

    @Override
    @Retry(name = "presenceStore")
    public void upsert(String organizationId, String userId, String socketId, long score) {
        execute("register", () -> {
            redisTemplate.execute(presenceRegisterScript, keys(organizationId), userId, socketId, Long.toString(score));
            redisTemplate.opsForSet().add(organizationsKey(), organizationId);
            return null;
        });
    }

    @Override
    @Retry(name = "presenceStore")
    public boolean remove(String organizationId, String socketId) {
        Long removed = execute("unregister", () ->
                redisTemplate.execute(presenceUnregisterScript, keys(organizationId), socketId));
        return removed != null && removed > 0;
    }

    @Override
    @Retry(name = "presenceStore")
    public boolean refresh(String organizationId, String socketId, long score) {
        Long refreshed = execute("heartbeat", () ->
                redisTemplate.execute(presenceHeartbeatScript, keys(organizationId), socketId, Long.toString(score)));
        return refreshed != null && refreshed > 0;
    }

    @Override
    @Retry(name = "presenceStore")
    public long count(String organizationId, long minScore, long maxScore) {
        Long count = execute("count", () ->
                redisTemplate.opsForZSet().count(socketsKey(organizationId), minScore, maxScore));
        return count != null ? count : 0;
    }

    @Override
    @Retry(name = "presenceStore")
    public Set<String> distinctUsers(String organizationId, long minScore, long maxScore) {
        Set<String> members = execute("range", () ->
                redisTemplate.opsForZSet().rangeByScore(socketsKey(organizationId), minScore, maxScore));
        Set<String> users = new HashSet<>();
        if (members != null) {
            members.forEach(member -> users.add(userIdOf(member)));
        }
        return users;
    }

    @Override
    @Retry(name = "presenceStore")
    public Map<String, Long> countByOrganization(long minScore, long maxScore) {
        return execute("countAll", () -> {
            Map<String, Long> counts = new HashMap<>();
            Set<String> organizations = redisTemplate.opsForSet().members(organizationsKey());
            if (organizations == null) {
                return counts;
            }
            for (String organizationId : organizations) {
                Long count = redisTemplate.opsForZSet().count(socketsKey(organizationId), minScore, maxScore);
                if (count != null && count > 0) {
                    counts.put(organizationId, count);
                }
            }
            return counts;
        });
    }

    @Override
    @Retry(name = "presenceStore")
    public int removeOlderThan(long minScore) {
        return execute("sweep", () -> {
            int removed = 0;
            Set<String> organizations = redisTemplate.opsForSet().members(organizationsKey());
            if (organizations == null) {
                return 0;
            }
            for (String organizationId : organizations) {
                Long swept = redisTemplate.execute(presenceSweepScript, keys(organizationId), Long.toString(minScore));
                removed += swept != null ? swept.intValue() : 0;

                pruneOrganization(organizationId);
            }
            return removed;
        });
    }

    /**
     * Drops an emptied organization from the index. A register landing between the emptiness check and the
     * removal is caught by the second check, which puts the organization back.
     */
    private void pruneOrganization(String organizationId) {
        if (!isEmpty(organizationId)) {
            return;
        }
        redisTemplate.opsForSet().remove(organizationsKey(), organizationId);
        if (!isEmpty(organizationId)) {
            redisTemplate.opsForSet().add(organizationsKey(), organizationId);
            log.debug("Organization {} re-registered during sweep, kept in index", organizationId);
        }
    }

    private boolean isEmpty(String organizationId) {
        Long remaining = redisTemplate.opsForZSet().zCard(socketsKey(organizationId));
        return remaining != null && remaining == 0;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.warn("Presence store operation '{}' failed: {}", operation, e.getMessage());
            throw new TransientStoreException("Presence store " + operation + " failed", e);
        }
    }

    private List<String> keys(String organizationId) {
        return List.of(socketsKey(organizationId), ownersKey(organizationId));
    }

    private String socketsKey(String organizationId) {
        return appProperties.getPresence().getKeyPrefix() + ":{" + organizationId + "}:sockets";
    }

    private String ownersKey(String organizationId) {
        return appProperties.getPresence().getKeyPrefix() + ":{" + organizationId + "}:owners";
    }

    private String organizationsKey() {
        return appProperties.getPresence().getKeyPrefix() + ":orgs";
    }

    static String userIdOf(String member) {
        int separator = member.lastIndexOf(':');
        return separator < 0 ? member : member.substring(0, separator);
    }
}
