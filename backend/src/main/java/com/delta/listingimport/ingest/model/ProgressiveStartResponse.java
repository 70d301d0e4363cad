package com.delta.listingimport.ingest.model;

public record ProgressiveStartResponse(
    long batchId,
    boolean started,
    int quickParsed,
    int quickFailed
) {
}
