package com.delta.listingimport.ingest.model;

import java.util.List;

public record InstantCreateResponse(
    long batchId,
    List<ItemResult> properties
) {
}
