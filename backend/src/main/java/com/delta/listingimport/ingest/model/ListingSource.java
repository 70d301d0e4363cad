package com.delta.listingimport.ingest.model;

public enum ListingSource {
    FLEXMLS("FlexMLS"),
    ZILLOW("Zillow"),
    REALTOR("Realtor.com"),
    TRULIA("Trulia"),
    EXTERNAL_API("Listings API"),
    UNKNOWN("Unknown");

    private final String displayName;

    ListingSource(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isScraped() {
        return this != EXTERNAL_API && this != UNKNOWN;
    }
}
