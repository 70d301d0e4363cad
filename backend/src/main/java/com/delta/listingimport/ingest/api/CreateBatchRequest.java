package com.delta.listingimport.ingest.api;

public record CreateBatchRequest(
    String ownerId,
    Long collectionId
) {
}
