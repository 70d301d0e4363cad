package com.delta.listingimport.ingest.model;

public record PropertyDetails(
    Integer beds,
    Double baths,
    Integer sqft,
    Integer yearBuilt,
    String lotSize,
    String propertyType
) {
    public static PropertyDetails empty() {
        return new PropertyDetails(null, null, null, null, null, null);
    }
}
