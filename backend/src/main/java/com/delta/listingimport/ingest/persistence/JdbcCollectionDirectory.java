package com.delta.listingimport.ingest.persistence;

import com.delta.listingimport.ingest.store.CollectionDirectory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcCollectionDirectory implements CollectionDirectory {
    private final NamedParameterJdbcTemplate jdbc;

    public JdbcCollectionDirectory(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean exists(String ownerId, long collectionId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM collections WHERE id = :id AND owner_id = :ownerId",
            new MapSqlParameterSource()
                .addValue("id", collectionId)
                .addValue("ownerId", ownerId),
            Integer.class
        );
        return count != null && count > 0;
    }

    @Override
    public long createCollection(String ownerId, String name) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            "INSERT INTO collections (owner_id, name) VALUES (:ownerId, :name)",
            new MapSqlParameterSource()
                .addValue("ownerId", ownerId)
                .addValue("name", name),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        return key == null ? 0L : key.longValue();
    }
}
