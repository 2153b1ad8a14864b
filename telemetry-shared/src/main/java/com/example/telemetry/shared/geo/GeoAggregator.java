package com.example.telemetry.shared.geo;

import com.example.telemetry.shared.aspect.Monitored;
import com.example.telemetry.shared.config.AppProperties;
import com.example.telemetry.shared.dto.GeoDistributionEntry;
import com.example.telemetry.shared.dto.HeatmapPoint;
import com.example.telemetry.shared.dto.SessionLocationView;
import com.example.telemetry.shared.exception.InvalidRequestException;
import com.example.telemetry.shared.model.SessionGeoRecord;
import com.example.telemetry.shared.repository.GroupedCount;
import com.example.telemetry.shared.repository.HeatmapBucket;
import com.example.telemetry.shared.repository.SessionGeoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Read-only statistics over persisted session locations.
 */
@Service
@Monitored("service")
@RequiredArgsConstructor
@Slf4j
public class GeoAggregator {

    public static final int MAX_WINDOW_DAYS = 365;
    public static final int MAX_SESSION_LIMIT = 1000;

    private final SessionGeoRepository sessionGeoRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    /**
     * Ranked by count descending, country code ascending. Percentages sum to exactly 100 for a non-empty window.
     */
    public List<GeoDistributionEntry> aggregateByCountry(String organizationId, int windowDays) {
        requireOrganization(organizationId);
        return toDistribution(sessionGeoRepository.countByCountry(organizationId, since(windowDays)));
    }

    /**
     * Regions within {@code countryCode}, or across every country when it is null.
     */
    public List<GeoDistributionEntry> aggregateByRegion(String organizationId, String countryCode, int windowDays) {
        requireOrganization(organizationId);
        return toDistribution(sessionGeoRepository.countByRegion(organizationId, normalizeCountryCode(countryCode), since(windowDays)));
    }

    /**
     * Country distribution across all organizations. Callers must restrict this to super-admins.
     */
    public List<GeoDistributionEntry> aggregateGlobal(int windowDays) {
        return toDistribution(sessionGeoRepository.countByCountry(null, since(windowDays)));
    }

    /**
     * At most {@code heatmapCap} points, heaviest first, each carrying its weight relative to the heaviest.
     */
    public List<HeatmapPoint> getHeatmapPoints(String organizationId, int windowDays) {
        requireOrganization(organizationId);
        AppProperties.Geo geo = appProperties.getGeo();
        int cap = geo.getHeatmapCap();

        List<HeatmapBucket> buckets = sessionGeoRepository.heatmapBuckets(organizationId, since(windowDays), geo.getHeatmapPrecision(), cap);
        if (buckets.isEmpty()) {
            return List.of();
        }

        long maxWeight = buckets.stream().mapToLong(HeatmapBucket::weight).max().orElse(1L);
        return buckets.stream()
                .limit(cap)
                .map(bucket -> HeatmapPoint.builder()
                        .lat(bucket.lat())
                        .lng(bucket.lng())
                        .weight(bucket.weight())
                        .normalizedWeight((double) bucket.weight() / maxWeight)
                        .build())
                .toList();
    }

    public List<SessionLocationView> recentSessions(String organizationId, int limit) {
        requireOrganization(organizationId);
        if (limit < 1 || limit > MAX_SESSION_LIMIT) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_SESSION_LIMIT);
        }
        return sessionGeoRepository.findRecent(organizationId, limit).stream()
                .map(this::anonymize)
                .toList();
    }

    private List<GeoDistributionEntry> toDistribution(List<GroupedCount> rows) {
        long[] counts = rows.stream().mapToLong(GroupedCount::count).toArray();
        double[] percentages = Percentages.of(counts);

        List<GeoDistributionEntry> entries = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            GroupedCount row = rows.get(i);
            entries.add(GeoDistributionEntry.builder()
                    .code(row.code())
                    .name(row.name())
                    .countryCode(row.countryCode())
                    .count(row.count())
                    .percentage(percentages[i])
                    .build());
        }
        return entries;
    }

    private SessionLocationView anonymize(SessionGeoRecord record) {
        return SessionLocationView.builder()
                .countryCode(record.getCountryCode())
                .country(record.getCountry())
                .region(record.getRegion())
                .city(record.getCity())
                .lat(coarsen(record.getLatitude()))
                .lng(coarsen(record.getLongitude()))
                .timestamp(record.getUpdatedAt())
                .build();
    }

    private static Double coarsen(Double coordinate) {
        return coordinate == null ? null : Math.round(coordinate * 10.0) / 10.0;
    }

    private OffsetDateTime since(int windowDays) {
        if (windowDays < 1 || windowDays > MAX_WINDOW_DAYS) {
            throw new InvalidRequestException("windowDays must be between 1 and " + MAX_WINDOW_DAYS);
        }
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).minusDays(windowDays);
    }

    private static String normalizeCountryCode(String countryCode) {
        if (countryCode == null || countryCode.isBlank()) {
            return null;
        }
        String normalized = countryCode.trim().toUpperCase(Locale.ROOT);
        if (!normalized.matches("[A-Z]{2}")) {
            throw new InvalidRequestException("countryCode must be a two-letter ISO code");
        }
        return normalized;
    }

    private static void requireOrganization(String organizationId) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new InvalidRequestException("organizationId must not be blank");
        }
    }
}
