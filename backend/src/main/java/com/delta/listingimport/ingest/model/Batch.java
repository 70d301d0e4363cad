package com.delta.listingimport.ingest.model;

import java.time.Instant;

public record Batch(
    long id,
    String ownerId,
    long collectionId,
    BatchStatus status,
    ImportStrategy strategy,
    int totalCount,
    int successCount,
    int failureCount,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {
}
