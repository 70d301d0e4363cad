package com.delta.listingimport.ingest.model;

public record ItemResult(
    long itemId,
    String sourceUrl,
    boolean success,
    Long entityId,
    String address,
    String error,
    boolean duplicate
) {
    public static ItemResult success(long itemId, String sourceUrl, Long entityId, String address) {
        return new ItemResult(itemId, sourceUrl, true, entityId, address, null, false);
    }

    public static ItemResult failure(long itemId, String sourceUrl, String error) {
        return new ItemResult(itemId, sourceUrl, false, null, null, error, false);
    }

    public static ItemResult duplicate(long itemId, String sourceUrl, String error) {
        return new ItemResult(itemId, sourceUrl, false, null, null, error, true);
    }
}
