package com.example.telemetry.shared.presence;

import java.util.Map;
import java.util.Set;

/**
 * Backing store for presence entries: one ordered set per organization, members keyed by
 * {@code (userId, socketId)} and scored with the epoch millis of their last heartbeat.
 * Every mutation is atomic at the store level.
 */
public interface PresenceStore {

    /**
     * Adds the entry or refreshes its score. A socket re-registered under a different user replaces the old entry.
     */
    void upsert(String organizationId, String userId, String socketId, long score);

    boolean remove(String organizationId, String socketId);

    /**
     * Refreshes the score of an existing entry; never creates one.
     */
    boolean refresh(String organizationId, String socketId, long score);

    long count(String organizationId, long minScore, long maxScore);

    Set<String> distinctUsers(String organizationId, long minScore, long maxScore);

    /**
     * Counts per organization for every organization holding at least one entry in range.
     */
    Map<String, Long> countByOrganization(long minScore, long maxScore);

    /**
     * Removes entries scored strictly below {@code minScore} across all organizations.
     */
    int removeOlderThan(long minScore);
}
