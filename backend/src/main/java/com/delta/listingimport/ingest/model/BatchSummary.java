package com.delta.listingimport.ingest.model;

public record BatchSummary(
    int total,
    int successful,
    int failed
) {
}
