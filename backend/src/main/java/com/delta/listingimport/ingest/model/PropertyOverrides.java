package com.delta.listingimport.ingest.model;

public record PropertyOverrides(
    String customDescription,
    String agentNotes,
    Integer customBeds,
    Double customBaths,
    Integer customSqft
) {
    public static PropertyOverrides none() {
        return new PropertyOverrides(null, null, null, null, null);
    }
}
