package com.delta.listingimport.ingest.api;

public record ExternalImportRequest(
    String propertyId
) {
}
