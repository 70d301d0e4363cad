package com.delta.listingimport.ingest.store;

import com.delta.listingimport.ingest.model.CommittedProperty;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.PropertyOverrides;

import java.util.Optional;

/**
 * Write side of the destination collection: the "commit property to collection" operation and the
 * lookups the duplicate gate needs.
 */
public interface CollectionPropertyStore {
    CommittedProperty commit(
        String ownerId,
        long collectionId,
        ParsedProperty data,
        boolean fullyParsed,
        int loadingProgress,
        PropertyOverrides overrides
    );

    /**
     * Replaces the placeholder snapshot of an instantly created property with fully parsed data.
     */
    void backfill(long propertyId, ParsedProperty data);

    void updateLoadingProgress(long propertyId, int loadingProgress);

    Optional<CommittedProperty> findById(long propertyId);

    Optional<CommittedProperty> findBySourceUrl(String ownerId, long collectionId, String sourceUrl);

    Optional<CommittedProperty> findByNormalizedAddress(String ownerId, long collectionId, String normalizedAddress);

    int countInScope(String ownerId, long collectionId);
}
