package com.example.telemetry.shared.events;

import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.model.AnalyticsEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Strict FIFO ring buffers of the most recent events: one per organization plus one across all of them.
 * When full, the oldest entry is evicted.
 */
@Component
public class RecentEventBuffer {

    private final int capacity;
    private final Map<String, ArrayDeque<AnalyticsEvent>> byOrganization = new ConcurrentHashMap<>();
    private final ArrayDeque<AnalyticsEvent> global;

    public RecentEventBuffer(AppProperties appProperties) {
        this.capacity = appProperties.getEvents().getRecentCapacity();
        this.global = new ArrayDeque<>(capacity);
    }

    public void add(AnalyticsEvent event) {
        if (event.getOrganizationId() != null) {
            append(byOrganization.computeIfAbsent(event.getOrganizationId(), key -> new ArrayDeque<>(capacity)), event);
        }
        append(global, event);
    }

    /**
     * Up to {@code limit} most recent events of the organization, oldest first.
     */
    public List<AnalyticsEvent> recent(String organizationId, int limit) {
        ArrayDeque<AnalyticsEvent> buffer = byOrganization.get(organizationId);
        return buffer == null ? List.of() : tail(buffer, limit);
    }

    public List<AnalyticsEvent> recentGlobal(int limit) {
        return tail(global, limit);
    }

    public int capacity() {
        return capacity;
    }

    private void append(ArrayDeque<AnalyticsEvent> buffer, AnalyticsEvent event) {
        synchronized (buffer) {
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
            }
            buffer.addLast(event);
        }
    }

    private List<AnalyticsEvent> tail(ArrayDeque<AnalyticsEvent> buffer, int limit) {
        if (limit < 1) {
            throw new InvalidRequestException("limit must be positive");
        }
        synchronized (buffer) {
            int size = Math.min(limit, buffer.size());
            List<AnalyticsEvent> result = new ArrayList<>(size);
            Iterator<AnalyticsEvent> newestFirst = buffer.descendingIterator();
            while (result.size() < size) {
                result.add(newestFirst.next());
            }
            Collections.reverse(result);
            return result;
        }
    }
}
