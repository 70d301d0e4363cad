package com.delta.listingimport.ingest.model;

public record UrlAddress(String sourceId, PropertyAddress address) {
    public UrlAddress {
        address = address == null ? PropertyAddress.placeholder() : address;
    }
}
