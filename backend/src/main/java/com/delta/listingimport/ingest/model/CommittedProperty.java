package com.delta.listingimport.ingest.model;

import java.time.Instant;

public record CommittedProperty(
    long id,
    String ownerId,
    long collectionId,
    ListingSource source,
    String sourceUrl,
    String normalizedAddress,
    String addressFull,
    Double numericPrice,
    String priceRange,
    ParsedProperty propertyData,
    boolean fullyParsed,
    int loadingProgress,
    PropertyOverrides overrides,
    Instant createdAt,
    Instant updatedAt
) {
}
