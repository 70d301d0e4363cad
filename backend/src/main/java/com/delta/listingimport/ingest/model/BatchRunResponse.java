package com.delta.listingimport.ingest.model;

import java.util.List;

public record BatchRunResponse(
    long batchId,
    List<ItemResult> results,
    BatchSummary summary
) {
}
