package com.delta.listingimport.ingest.external;

public record AutocompleteSuggestion(String text, String type, String propertyId) {
}
