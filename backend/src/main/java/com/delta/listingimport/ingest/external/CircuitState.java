package com.delta.listingimport.ingest.external;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
