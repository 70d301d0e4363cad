package com.delta.listingimport.ingest.model;

import java.time.Instant;

public record BatchItem(
    long id,
    long batchId,
    int position,
    String sourceUrl,
    ParseStatus parseStatus,
    ParsedProperty parsedData,
    String parseError,
    int loadingProgress,
    Long committedEntityId,
    Instant updatedAt
) {
}
