package com.delta.listingimport.ingest.persistence;

import com.delta.listingimport.ingest.duplicate.AddressNormalizer;
import com.delta.listingimport.ingest.model.CommittedProperty;
import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.PropertyOverrides;
import com.delta.listingimport.ingest.store.CollectionPropertyStore;
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
import java.util.Optional;

@Repository
public class JdbcCollectionPropertyStore implements CollectionPropertyStore {
    private static final String SELECT_COLUMNS = """
        SELECT id, owner_id, collection_id, source, source_url, normalized_address, address_full,
               numeric_price, price_range, property_data, is_fully_parsed, loading_progress,
               custom_description, agent_notes, custom_beds, custom_baths, custom_sqft,
               created_at, updated_at
        FROM listing_properties
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ParsedPropertyJson json;
    private final Clock clock;
    private final RowMapper<CommittedProperty> rowMapper;

    public JdbcCollectionPropertyStore(NamedParameterJdbcTemplate jdbc, ParsedPropertyJson json, Clock clock) {
        this.jdbc = jdbc;
        this.json = json;
        this.clock = clock;
        this.rowMapper = (rs, rowNum) -> new CommittedProperty(
            rs.getLong("id"),
            rs.getString("owner_id"),
            rs.getLong("collection_id"),
            ListingSource.valueOf(rs.getString("source")),
            rs.getString("source_url"),
            rs.getString("normalized_address"),
            rs.getString("address_full"),
            rs.getObject("numeric_price", Double.class),
            rs.getString("price_range"),
            json.read(rs.getString("property_data")),
            rs.getBoolean("is_fully_parsed"),
            rs.getInt("loading_progress"),
            new PropertyOverrides(
                rs.getString("custom_description"),
                rs.getString("agent_notes"),
                parseInteger(rs.getString("custom_beds")),
                parseDouble(rs.getString("custom_baths")),
                parseInteger(rs.getString("custom_sqft"))
            ),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    @Override
    public CommittedProperty commit(
        String ownerId,
        long collectionId,
        ParsedProperty data,
        boolean fullyParsed,
        int loadingProgress,
        PropertyOverrides overrides
    ) {
        PropertyOverrides effective = overrides == null ? PropertyOverrides.none() : overrides;
        Instant now = clock.instant();
        Double price = data.pricing().numericPrice();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("ownerId", ownerId)
            .addValue("collectionId", collectionId)
            .addValue("source", data.source().name())
            .addValue("sourceUrl", data.sourceUrl())
            .addValue("normalizedAddress", data.address().isPlaceholder() ? null : AddressNormalizer.normalize(data.address().full()))
            .addValue("addressFull", data.address().full())
            .addValue("numericPrice", price)
            .addValue("priceRange", AddressNormalizer.priceRange(price))
            .addValue("propertyData", json.write(data))
            .addValue("fullyParsed", fullyParsed)
            .addValue("loadingProgress", clampProgress(loadingProgress))
            .addValue("customDescription", effective.customDescription())
            .addValue("agentNotes", effective.agentNotes())
            .addValue("customBeds", toText(effective.customBeds()))
            .addValue("customBaths", toText(effective.customBaths()))
            .addValue("customSqft", toText(effective.customSqft()))
            .addValue("now", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO listing_properties (
                    owner_id, collection_id, source, source_url, normalized_address, address_full,
                    numeric_price, price_range, property_data, is_fully_parsed, loading_progress,
                    custom_description, agent_notes, custom_beds, custom_baths, custom_sqft,
                    created_at, updated_at
                )
                VALUES (
                    :ownerId, :collectionId, :source, :sourceUrl, :normalizedAddress, :addressFull,
                    :numericPrice, :priceRange, :propertyData, :fullyParsed, :loadingProgress,
                    :customDescription, :agentNotes, :customBeds, :customBaths, :customSqft,
                    :now, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        long id = key == null ? 0L : key.longValue();
        return findById(id).orElseThrow(() -> new IllegalStateException("Committed property " + id + " not readable"));
    }

    @Override
    public void backfill(long propertyId, ParsedProperty data) {
        Double price = data.pricing().numericPrice();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", propertyId)
            .addValue("normalizedAddress", data.address().isPlaceholder() ? null : AddressNormalizer.normalize(data.address().full()))
            .addValue("addressFull", data.address().full())
            .addValue("numericPrice", price)
            .addValue("priceRange", AddressNormalizer.priceRange(price))
            .addValue("propertyData", json.write(data))
            .addValue("now", toTimestamp(clock.instant()));
        jdbc.update(
            """
                UPDATE listing_properties
                SET normalized_address = COALESCE(:normalizedAddress, normalized_address),
                    address_full = :addressFull,
                    numeric_price = :numericPrice,
                    price_range = :priceRange,
                    property_data = :propertyData,
                    is_fully_parsed = TRUE,
                    loading_progress = 100,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
    }

    @Override
    public void updateLoadingProgress(long propertyId, int loadingProgress) {
        jdbc.update(
            "UPDATE listing_properties SET loading_progress = :progress, updated_at = :now WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("id", propertyId)
                .addValue("progress", clampProgress(loadingProgress))
                .addValue("now", toTimestamp(clock.instant()))
        );
    }

    @Override
    public Optional<CommittedProperty> findById(long propertyId) {
        List<CommittedProperty> rows = jdbc.query(
            SELECT_COLUMNS + " WHERE id = :id",
            new MapSqlParameterSource("id", propertyId),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    @Override
    public Optional<CommittedProperty> findBySourceUrl(String ownerId, long collectionId, String sourceUrl) {
        List<CommittedProperty> rows = jdbc.query(
            SELECT_COLUMNS + """
                WHERE owner_id = :ownerId
                  AND collection_id = :collectionId
                  AND source_url = :sourceUrl
                ORDER BY id
                """,
            new MapSqlParameterSource()
                .addValue("ownerId", ownerId)
                .addValue("collectionId", collectionId)
                .addValue("sourceUrl", sourceUrl),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    @Override
    public Optional<CommittedProperty> findByNormalizedAddress(String ownerId, long collectionId, String normalizedAddress) {
        List<CommittedProperty> rows = jdbc.query(
            SELECT_COLUMNS + """
                WHERE owner_id = :ownerId
                  AND collection_id = :collectionId
                  AND normalized_address = :normalizedAddress
                ORDER BY id
                """,
            new MapSqlParameterSource()
                .addValue("ownerId", ownerId)
                .addValue("collectionId", collectionId)
                .addValue("normalizedAddress", normalizedAddress),
            rowMapper
        );
        return rows.stream().findFirst();
    }

    @Override
    public int countInScope(String ownerId, long collectionId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM listing_properties WHERE owner_id = :ownerId AND collection_id = :collectionId",
            new MapSqlParameterSource()
                .addValue("ownerId", ownerId)
                .addValue("collectionId", collectionId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    private static int clampProgress(int progress) {
        return Math.max(0, Math.min(100, progress));
    }

    private static String toText(Number value) {
        return value == null ? null : value.toString();
    }

    private static Integer parseInteger(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Double parseDouble(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
