package com.delta.listingimport.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BatchStatus {
    PENDING,
    PROCESSING,
    COMPLETED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
