package com.delta.listingimport.ingest.model;

public record ListingImage(
    String url,
    String alt,
    Integer width,
    Integer height
) {
    public static ListingImage of(String url, String alt) {
        return new ListingImage(url, alt, null, null);
    }
}
