package com.delta.listingimport.ingest.model;

public record ListingInfo(
    String mlsNumber,
    String agentName,
    String officeName,
    String status,
    String listDate
) {
    public static ListingInfo empty() {
        return new ListingInfo(null, null, null, null, null);
    }
}
