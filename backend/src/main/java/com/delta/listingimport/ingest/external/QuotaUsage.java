package com.delta.listingimport.ingest.external;

import java.time.Instant;
import java.util.Map;

public record QuotaUsage(
    String month,
    int total,
    int limit,
    int remaining,
    double percentUsed,
    Map<String, Integer> byEndpoint,
    Instant lastRequestAt
) {
}
