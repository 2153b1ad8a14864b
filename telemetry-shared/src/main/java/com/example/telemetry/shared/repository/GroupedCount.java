package com.example.telemetry.shared.repository;

/**
 * One {@code GROUP BY} row: the grouping code, a display name, the owning country for region rows, and the row count.
 */
public record GroupedCount(String code, String name, String countryCode, long count) {
}
