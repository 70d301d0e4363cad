package com.delta.listingimport.ingest.persistence;

import com.delta.listingimport.ingest.error.IllegalStateTransitionException;
import com.delta.listingimport.ingest.error.NotFoundException;
import com.delta.listingimport.ingest.model.Batch;
import com.delta.listingimport.ingest.model.BatchItem;
import com.delta.listingimport.ingest.model.BatchStatus;
import com.delta.listingimport.ingest.model.ImportStrategy;
import com.delta.listingimport.ingest.model.ParseStatus;
import com.delta.listingimport.ingest.model.ParsedProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
public class BatchRepository {
    private static final Logger log = LoggerFactory.getLogger(BatchRepository.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ParsedPropertyJson json;
    private final Clock clock;
    private final RowMapper<BatchItem> itemMapper;

    public BatchRepository(NamedParameterJdbcTemplate jdbc, ParsedPropertyJson json, Clock clock) {
        this.jdbc = jdbc;
        this.json = json;
        this.clock = clock;
        this.itemMapper = (rs, rowNum) -> new BatchItem(
            rs.getLong("id"),
            rs.getLong("batch_id"),
            rs.getInt("item_position"),
            rs.getString("source_url"),
            ParseStatus.fromCode(rs.getString("parse_status")),
            json.read(rs.getString("parsed_data")),
            rs.getString("parse_error"),
            rs.getInt("loading_progress"),
            rs.getObject("committed_entity_id", Long.class),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    public long insertBatch(String ownerId, long collectionId) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO import_batches (
                    owner_id, collection_id, status, total_count, success_count, failure_count, created_at
                )
                VALUES (
                    :ownerId, :collectionId, :status, 0, 0, 0, :now
                )
                """,
            new MapSqlParameterSource()
                .addValue("ownerId", ownerId)
                .addValue("collectionId", collectionId)
                .addValue("status", BatchStatus.PENDING.code())
                .addValue("now", toTimestamp(clock.instant())),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }

    /**
     * Appends items after the batch's current last position, in input order, and grows the batch total.
     */
    public List<BatchItem> appendItems(long batchId, List<String> sourceUrls) {
        Integer maxPosition = jdbc.queryForObject(
            "SELECT MAX(item_position) FROM batch_items WHERE batch_id = :batchId",
            new MapSqlParameterSource("batchId", batchId),
            Integer.class
        );
        int next = maxPosition == null ? 0 : maxPosition + 1;
        Timestamp now = toTimestamp(clock.instant());
        MapSqlParameterSource[] rows = new MapSqlParameterSource[sourceUrls.size()];
        for (int i = 0; i < sourceUrls.size(); i++) {
            rows[i] = new MapSqlParameterSource()
                .addValue("batchId", batchId)
                .addValue("position", next + i)
                .addValue("sourceUrl", sourceUrls.get(i))
                .addValue("status", ParseStatus.PENDING.code())
                .addValue("now", now);
        }
        jdbc.batchUpdate(
            """
                INSERT INTO batch_items (
                    batch_id, item_position, source_url, parse_status, loading_progress, created_at, updated_at
                )
                VALUES (
                    :batchId, :position, :sourceUrl, :status, 0, :now, :now
                )
                """,
            rows
        );
        jdbc.update(
            "UPDATE import_batches SET total_count = total_count + :added WHERE id = :batchId",
            new MapSqlParameterSource()
                .addValue("batchId", batchId)
                .addValue("added", sourceUrls.size())
        );
        return jdbc.query(
            """
                SELECT * FROM batch_items
                WHERE batch_id = :batchId AND item_position >= :from
                ORDER BY item_position
                """,
            new MapSqlParameterSource()
                .addValue("batchId", batchId)
                .addValue("from", next),
            itemMapper
        );
    }

    public Optional<Batch> findBatch(long batchId) {
        List<Batch> rows = jdbc.query(
            "SELECT * FROM import_batches WHERE id = :id",
            new MapSqlParameterSource("id", batchId),
            (rs, rowNum) -> new Batch(
                rs.getLong("id"),
                rs.getString("owner_id"),
                rs.getLong("collection_id"),
                BatchStatus.valueOf(rs.getString("status").toUpperCase(Locale.ROOT)),
                parseStrategy(rs.getString("strategy")),
                rs.getInt("total_count"),
                rs.getInt("success_count"),
                rs.getInt("failure_count"),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at"))
            )
        );
        return rows.stream().findFirst();
    }

    public boolean batchExists(long batchId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM import_batches WHERE id = :id",
            new MapSqlParameterSource("id", batchId),
            Integer.class
        );
        return count != null && count > 0;
    }

    public List<BatchItem> findItems(long batchId) {
        return jdbc.query(
            "SELECT * FROM batch_items WHERE batch_id = :batchId ORDER BY item_position",
            new MapSqlParameterSource("batchId", batchId),
            itemMapper
        );
    }

    public List<BatchItem> findItemsByStatus(long batchId, ParseStatus status) {
        return jdbc.query(
            "SELECT * FROM batch_items WHERE batch_id = :batchId AND parse_status = :status ORDER BY item_position",
            new MapSqlParameterSource()
                .addValue("batchId", batchId)
                .addValue("status", status.code()),
            itemMapper
        );
    }

    public Optional<BatchItem> findItem(long itemId) {
        List<BatchItem> rows = jdbc.query(
            "SELECT * FROM batch_items WHERE id = :id",
            new MapSqlParameterSource("id", itemId),
            itemMapper
        );
        return rows.stream().findFirst();
    }

    public BatchItem transition(long itemId, ParseStatus next, int loadingProgress) {
        return transition(itemId, next, loadingProgress, null, null);
    }

    /**
     * Moves an item to {@code next} if the transition table allows it from the stored status. The write is
     * conditional on the status read, so a concurrent writer makes this call fail instead of being overwritten.
     * A null {@code parsedData} or {@code parseError} keeps the stored value.
     */
    public BatchItem transition(
        long itemId,
        ParseStatus next,
        int loadingProgress,
        ParsedProperty parsedData,
        String parseError
    ) {
        BatchItem current = findItem(itemId)
            .orElseThrow(() -> new NotFoundException("Batch item " + itemId + " not found"));
        ParseStatus from = current.parseStatus();
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateTransitionException(
                "Item " + itemId + " cannot move from " + from.code() + " to " + next.code()
            );
        }
        int updated = jdbc.update(
            """
                UPDATE batch_items
                SET parse_status = :next,
                    loading_progress = :progress,
                    parsed_data = COALESCE(:parsedData, parsed_data),
                    parse_error = COALESCE(:parseError, parse_error),
                    updated_at = :now
                WHERE id = :id AND parse_status = :from
                """,
            new MapSqlParameterSource()
                .addValue("id", itemId)
                .addValue("from", from.code())
                .addValue("next", next.code())
                .addValue("progress", Math.max(0, Math.min(100, loadingProgress)))
                .addValue("parsedData", json.write(parsedData))
                .addValue("parseError", truncate(parseError))
                .addValue("now", toTimestamp(clock.instant()))
        );
        if (updated != 1) {
            throw new IllegalStateTransitionException(
                "Item " + itemId + " changed concurrently while moving from " + from.code() + " to " + next.code()
            );
        }
        log.debug("Item {} {} -> {} ({}%)", itemId, from.code(), next.code(), loadingProgress);
        return findItem(itemId).orElse(current);
    }

    public void setCommittedEntity(long itemId, long entityId, int loadingProgress) {
        jdbc.update(
            """
                UPDATE batch_items
                SET committed_entity_id = :entityId,
                    loading_progress = :progress,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", itemId)
                .addValue("entityId", entityId)
                .addValue("progress", loadingProgress)
                .addValue("now", toTimestamp(clock.instant()))
        );
    }

    public boolean updateProgress(long itemId, ParseStatus expected, int loadingProgress) {
        return jdbc.update(
            """
                UPDATE batch_items
                SET loading_progress = :progress,
                    updated_at = :now
                WHERE id = :id AND parse_status = :expected
                """,
            new MapSqlParameterSource()
                .addValue("id", itemId)
                .addValue("expected", expected.code())
                .addValue("progress", loadingProgress)
                .addValue("now", toTimestamp(clock.instant()))
        ) > 0;
    }

    /**
     * Claims a pending batch for one strategy run. Returns false when the batch is missing or already
     * processing or completed, in which case nothing is written.
     */
    public boolean markProcessing(long batchId, ImportStrategy strategy) {
        return jdbc.update(
            """
                UPDATE import_batches
                SET status = :status,
                    strategy = :strategy,
                    started_at = :now,
                    completed_at = NULL
                WHERE id = :id AND status = :expected
                """,
            new MapSqlParameterSource()
                .addValue("id", batchId)
                .addValue("status", BatchStatus.PROCESSING.code())
                .addValue("expected", BatchStatus.PENDING.code())
                .addValue("strategy", strategy.code())
                .addValue("now", toTimestamp(clock.instant()))
        ) > 0;
    }

    /**
     * Recomputes the batch counters from its items: parsed and imported items count as successes,
     * failed items as failures.
     */
    public void refreshCounts(long batchId) {
        jdbc.update(
            """
                UPDATE import_batches
                SET success_count = (
                        SELECT COUNT(*) FROM batch_items
                        WHERE batch_id = :id AND parse_status IN ('parsed', 'imported')
                    ),
                    failure_count = (
                        SELECT COUNT(*) FROM batch_items
                        WHERE batch_id = :id AND parse_status = 'failed'
                    )
                WHERE id = :id
                """,
            new MapSqlParameterSource("id", batchId)
        );
    }

    public void markCompleted(long batchId) {
        refreshCounts(batchId);
        jdbc.update(
            "UPDATE import_batches SET status = :status, completed_at = :now WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", batchId)
                .addValue("status", BatchStatus.COMPLETED.code())
                .addValue("now", toTimestamp(clock.instant()))
        );
    }

    public boolean deleteBatch(long batchId) {
        MapSqlParameterSource params = new MapSqlParameterSource("id", batchId);
        jdbc.update("DELETE FROM batch_items WHERE batch_id = :id", params);
        return jdbc.update("DELETE FROM import_batches WHERE id = :id", params) > 0;
    }

    private static ImportStrategy parseStrategy(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ImportStrategy.valueOf(value.toUpperCase(Locale.ROOT));
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
