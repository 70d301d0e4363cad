package com.delta.listingimport.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ImportStrategy {
    INSTANT,
    PROGRESSIVE,
    EXHAUSTIVE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
