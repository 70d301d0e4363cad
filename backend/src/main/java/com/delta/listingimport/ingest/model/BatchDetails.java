package com.delta.listingimport.ingest.model;

import java.util.List;

public record BatchDetails(
    Batch batch,
    List<BatchItem> items
) {
}
