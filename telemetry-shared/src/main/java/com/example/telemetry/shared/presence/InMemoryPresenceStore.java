package com.example.telemetry.shared.presence;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Single-node presence store. All operations are serialized on the instance monitor.
 */
@Component
@Profile("!redis")
public class InMemoryPresenceStore implements PresenceStore {

    private final Map<String, Map<String, Entry>> organizations = new HashMap<>();

    @Override
    public synchronized void upsert(String organizationId, String userId, String socketId, long score) {
        organizations.computeIfAbsent(organizationId, k -> new HashMap<>())
                .put(socketId, new Entry(userId, score));
    }

    @Override
    public synchronized boolean remove(String organizationId, String socketId) {
        Map<String, Entry> sockets = organizations.get(organizationId);
        if (sockets == null || sockets.remove(socketId) == null) {
            return false;
        }
        if (sockets.isEmpty()) {
            organizations.remove(organizationId);
        }
        return true;
    }

    @Override
    public synchronized boolean refresh(String organizationId, String socketId, long score) {
        Map<String, Entry> sockets = organizations.get(organizationId);
        if (sockets == null) {
            return false;
        }
        Entry entry = sockets.get(socketId);
        if (entry == null) {
            return false;
        }
        sockets.put(socketId, new Entry(entry.userId(), score));
        return true;
    }

    @Override
    public synchronized long count(String organizationId, long minScore, long maxScore) {
        Map<String, Entry> sockets = organizations.get(organizationId);
        if (sockets == null) {
            return 0;
        }
        return sockets.values().stream().filter(e -> e.inRange(minScore, maxScore)).count();
    }

    @Override
    public synchronized Set<String> distinctUsers(String organizationId, long minScore, long maxScore) {
        Set<String> users = new HashSet<>();
        Map<String, Entry> sockets = organizations.get(organizationId);
        if (sockets != null) {
            sockets.values().stream()
                    .filter(e -> e.inRange(minScore, maxScore))
                    .forEach(e -> users.add(e.userId()));
        }
        return users;
    }

    @Override
    public synchronized Map<String, Long> countByOrganization(long minScore, long maxScore) {
        Map<String, Long> counts = new HashMap<>();
        organizations.forEach((organizationId, sockets) -> {
            long count = sockets.values().stream().filter(e -> e.inRange(minScore, maxScore)).count();
            if (count > 0) {
                counts.put(organizationId, count);
            }
        });
        return counts;
    }

    @Override
    public synchronized int removeOlderThan(long minScore) {
        int removed = 0;
        Iterator<Map<String, Entry>> organizationIterator = organizations.values().iterator();
        while (organizationIterator.hasNext()) {
            Map<String, Entry> sockets = organizationIterator.next();
            Iterator<Entry> socketIterator = sockets.values().iterator();
            while (socketIterator.hasNext()) {
                if (socketIterator.next().score() < minScore) {
                    socketIterator.remove();
                    removed++;
                }
            }
            if (sockets.isEmpty()) {
                organizationIterator.remove();
            }
        }
        return removed;
    }

    private record Entry(String userId, long score) {
        boolean inRange(long min, long max) {
            return score >= min && score <= max;
        }
    }
}
