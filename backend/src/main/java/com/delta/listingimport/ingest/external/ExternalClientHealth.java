package com.delta.listingimport.ingest.external;

public record ExternalClientHealth(
    boolean configured,
    CircuitBreakerStats circuitBreaker,
    QuotaUsage quota,
    int inFlightRequests,
    int cachedResponses
) {
}
