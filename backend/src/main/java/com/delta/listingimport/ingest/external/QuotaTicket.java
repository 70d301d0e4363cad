package com.delta.listingimport.ingest.external;

public record QuotaTicket(String month, String endpoint) {
}
