package com.delta.listingimport.ingest.external;

import java.time.Instant;

public record CircuitBreakerStats(
    CircuitState state,
    int failureCount,
    int successCount,
    Instant lastFailureTime,
    Instant nextAttemptTime
) {
}
