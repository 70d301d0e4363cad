package com.delta.listingimport.ingest.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class QuotaRepository {
    private static final Logger log = LoggerFactory.getLogger(QuotaRepository.class);

    private final NamedParameterJdbcTemplate jdbc;

    public QuotaRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void ensureMonth(String monthKey) {
        MapSqlParameterSource params = new MapSqlParameterSource("month", monthKey);
        Integer existing = jdbc.queryForObject(
            "SELECT COUNT(*) FROM api_quota_usage WHERE month_key = :month",
            params,
            Integer.class
        );
        if (existing != null && existing > 0) {
            return;
        }
        try {
            jdbc.update("INSERT INTO api_quota_usage (month_key, total_count) VALUES (:month, 0)", params);
        } catch (DataIntegrityViolationException e) {
            log.debug("Quota row for {} created concurrently", monthKey);
        }
    }

    /**
     * Atomically adds one to the month's total unless that would reach past {@code limit}.
     */
    public boolean tryIncrement(String monthKey, int limit, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE api_quota_usage
                SET total_count = total_count + 1,
                    last_request_at = :now
                WHERE month_key = :month
                  AND total_count < :limit
                """,
            new MapSqlParameterSource()
                .addValue("month", monthKey)
                .addValue("limit", limit)
                .addValue("now", toTimestamp(now))
        );
        return updated == 1;
    }

    public void decrement(String monthKey) {
        jdbc.update(
            "UPDATE api_quota_usage SET total_count = total_count - 1 WHERE month_key = :month AND total_count > 0",
            new MapSqlParameterSource("month", monthKey)
        );
    }

    public void adjustEndpoint(String monthKey, String endpoint, int delta) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("month", monthKey)
            .addValue("endpoint", endpoint)
            .addValue("delta", delta);
        String update = """
            UPDATE api_quota_endpoint_usage
            SET request_count = CASE WHEN request_count + :delta < 0 THEN 0 ELSE request_count + :delta END
            WHERE month_key = :month AND endpoint = :endpoint
            """;
        if (jdbc.update(update, params) > 0 || delta <= 0) {
            return;
        }
        try {
            jdbc.update(
                "INSERT INTO api_quota_endpoint_usage (month_key, endpoint, request_count) VALUES (:month, :endpoint, :delta)",
                params
            );
        } catch (DataIntegrityViolationException e) {
            jdbc.update(update, params);
        }
    }

    public Optional<QuotaRow> find(String monthKey) {
        List<QuotaRow> rows = jdbc.query(
            "SELECT month_key, total_count, last_request_at FROM api_quota_usage WHERE month_key = :month",
            new MapSqlParameterSource("month", monthKey),
            (rs, rowNum) -> new QuotaRow(
                rs.getString("month_key"),
                rs.getInt("total_count"),
                toInstant(rs.getTimestamp("last_request_at"))
            )
        );
        return rows.stream().findFirst();
    }

    public Map<String, Integer> endpointCounts(String monthKey) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT endpoint, request_count
                FROM api_quota_endpoint_usage
                WHERE month_key = :month
                ORDER BY endpoint
                """,
            new MapSqlParameterSource("month", monthKey),
            rs -> {
                counts.put(rs.getString("endpoint"), rs.getInt("request_count"));
            }
        );
        return counts;
    }

    public void setTotal(String monthKey, int total) {
        ensureMonth(monthKey);
        jdbc.update(
            "UPDATE api_quota_usage SET total_count = :total WHERE month_key = :month",
            new MapSqlParameterSource().addValue("month", monthKey).addValue("total", Math.max(0, total))
        );
    }

    public void deleteMonth(String monthKey) {
        MapSqlParameterSource params = new MapSqlParameterSource("month", monthKey);
        jdbc.update("DELETE FROM api_quota_endpoint_usage WHERE month_key = :month", params);
        jdbc.update("DELETE FROM api_quota_usage WHERE month_key = :month", params);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    public record QuotaRow(String monthKey, int total, Instant lastRequestAt) {
    }
}
