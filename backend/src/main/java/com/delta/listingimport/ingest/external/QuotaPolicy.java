package com.delta.listingimport.ingest.external;

/**
 * Which admitted calls stay counted against the monthly quota.
 */
public enum QuotaPolicy {
    /** Every admitted call counts, whatever its outcome. */
    ALL_CALLS,
    /** Calls answered by the open breaker without reaching the provider are refunded. */
    UPSTREAM_CALLS,
    /** Only calls that return a result count. */
    SUCCESSFUL_CALLS
}
