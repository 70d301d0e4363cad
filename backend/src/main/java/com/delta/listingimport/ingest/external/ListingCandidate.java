package com.delta.listingimport.ingest.external;

/**
 * One row of a location search, trimmed to what a picker needs before the full detail lookup.
 */
public record ListingCandidate(
    String propertyId,
    String address,
    String city,
    String state,
    String zipCode,
    Double price,
    Integer beds,
    Double baths,
    Integer sqft,
    String photo,
    String status
) {
}
