package com.delta.listingimport.ingest.model;

public record ImportSelection(
    long itemId,
    PropertyOverrides overrides
) {
}
