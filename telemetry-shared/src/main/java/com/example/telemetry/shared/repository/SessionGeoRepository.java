package com.example.telemetry.shared.repository;

import com.example.telemetry.shared.model.SessionGeoRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable session locations. Rows are keyed by session id; aggregation happens in SQL so memory
 * stays bounded by the number of groups, not the number of sessions.
 */
@Repository
public class SessionGeoRepository {

    private final JdbcTemplate jdbcTemplate;

    public SessionGeoRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private final RowMapper<SessionGeoRecord> recordRowMapper = (rs, rowNum) -> SessionGeoRecord.builder()
            .id(rs.getLong("id"))
            .sessionId(rs.getString("session_id"))
            .userId(rs.getString("user_id"))
            .organizationId(rs.getString("organization_id"))
            .countryCode(rs.getString("country_code"))
            .country(rs.getString("country"))
            .region(rs.getString("region"))
            .city(rs.getString("city"))
            .latitude(nullableDouble(rs, "latitude"))
            .longitude(nullableDouble(rs, "longitude"))
            .ipHash(rs.getString("ip_hash"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
            .build();

    /**
     * Inserts the record or updates the existing row for its session. {@code created_at} of an existing row is kept.
     */
    public void upsert(SessionGeoRecord record, OffsetDateTime seenAt) {
        String sql = """
            MERGE INTO session_geo_data AS t
            USING (
                SELECT
                    CAST(? AS VARCHAR(255)) AS session_id,
                    CAST(? AS VARCHAR(255)) AS user_id,
                    CAST(? AS VARCHAR(255)) AS organization_id,
                    CAST(? AS VARCHAR(2)) AS country_code,
                    CAST(? AS VARCHAR(255)) AS country,
                    CAST(? AS VARCHAR(255)) AS region,
                    CAST(? AS VARCHAR(255)) AS city,
                    CAST(? AS DOUBLE PRECISION) AS latitude,
                    CAST(? AS DOUBLE PRECISION) AS longitude,
                    CAST(? AS VARCHAR(64)) AS ip_hash,
                    CAST(? AS TIMESTAMP WITH TIME ZONE) AS seen_at
            ) AS s ON t.session_id = s.session_id
            WHEN MATCHED THEN
                UPDATE SET
                    user_id = s.user_id,
                    organization_id = s.organization_id,
                    country_code = s.country_code,
                    country = s.country,
                    region = s.region,
                    city = s.city,
                    latitude = s.latitude,
                    longitude = s.longitude,
                    ip_hash = s.ip_hash,
                    updated_at = s.seen_at
            WHEN NOT MATCHED THEN
                INSERT (session_id, user_id, organization_id, country_code, country, region, city,
                        latitude, longitude, ip_hash, created_at, updated_at)
                VALUES (s.session_id, s.user_id, s.organization_id, s.country_code, s.country, s.region, s.city,
                        s.latitude, s.longitude, s.ip_hash, s.seen_at, s.seen_at)
            """;

        jdbcTemplate.update(sql,
                record.getSessionId(),
                record.getUserId(),
                record.getOrganizationId(),
                record.getCountryCode(),
                record.getCountry(),
                record.getRegion(),
                record.getCity(),
                record.getLatitude(),
                record.getLongitude(),
                record.getIpHash(),
                seenAt);
    }

    public Optional<SessionGeoRecord> findBySessionId(String sessionId) {
        List<SessionGeoRecord> results = jdbcTemplate.query(
                "SELECT * FROM session_geo_data WHERE session_id = ?", recordRowMapper, sessionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long countBySessionId(String sessionId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM session_geo_data WHERE session_id = ?", Long.class, sessionId);
        return count != null ? count : 0;
    }

    /**
     * Sessions per country since {@code since}, ordered by count descending then country code.
     * A null organization aggregates across all organizations.
     */
    public List<GroupedCount> countByCountry(String organizationId, OffsetDateTime since) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("""
            SELECT country_code, MAX(country) AS country_name, COUNT(*) AS cnt
            FROM session_geo_data
            WHERE created_at >= ?
            """);
        params.add(since);
        if (organizationId != null) {
            sql.append(" AND organization_id = ?");
            params.add(organizationId);
        }
        sql.append(" GROUP BY country_code ORDER BY cnt DESC, country_code ASC");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> new GroupedCount(
                rs.getString("country_code"),
                rs.getString("country_name"),
                null,
                rs.getLong("cnt")), params.toArray());
    }

    /**
     * Sessions per region since {@code since}; rows without a region are excluded.
     * A null country code aggregates regions of every country.
     */
    public List<GroupedCount> countByRegion(String organizationId, String countryCode, OffsetDateTime since) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("""
            SELECT country_code, region, COUNT(*) AS cnt
            FROM session_geo_data
            WHERE organization_id = ? AND created_at >= ? AND region IS NOT NULL
            """);
        params.add(organizationId);
        params.add(since);
        if (countryCode != null) {
            sql.append(" AND country_code = ?");
            params.add(countryCode);
        }
        sql.append(" GROUP BY country_code, region ORDER BY cnt DESC, region ASC, country_code ASC");

        return jdbcTemplate.query(sql.toString(), (rs, rowNum) -> new GroupedCount(
                rs.getString("region"),
                rs.getString("region"),
                rs.getString("country_code"),
                rs.getLong("cnt")), params.toArray());
    }

    /**
     * Buckets coordinates onto a grid of {@code precision} decimal places and returns the
     * {@code limit} heaviest buckets, ties broken by latitude then longitude.
     */
    public List<HeatmapBucket> heatmapBuckets(String organizationId, OffsetDateTime since, int precision, int limit) {
        String sql = String.format("""
            SELECT lat_bucket, lng_bucket, COUNT(*) AS weight
            FROM (
                SELECT ROUND(latitude, %1$d) AS lat_bucket, ROUND(longitude, %1$d) AS lng_bucket
                FROM session_geo_data
                WHERE organization_id = ? AND created_at >= ?
                  AND latitude IS NOT NULL AND longitude IS NOT NULL
            ) buckets
            GROUP BY lat_bucket, lng_bucket
            ORDER BY weight DESC, lat_bucket ASC, lng_bucket ASC
            LIMIT ?
            """, precision);

        return jdbcTemplate.query(sql, (rs, rowNum) -> new HeatmapBucket(
                rs.getDouble("lat_bucket"),
                rs.getDouble("lng_bucket"),
                rs.getLong("weight")), organizationId, since, limit);
    }

    public List<SessionGeoRecord> findRecent(String organizationId, int limit) {
        String sql = "SELECT * FROM session_geo_data WHERE organization_id = ? ORDER BY updated_at DESC, id DESC LIMIT ?";
        return jdbcTemplate.query(sql, recordRowMapper, organizationId, limit);
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }
}
