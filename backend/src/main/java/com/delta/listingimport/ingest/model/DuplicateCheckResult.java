package com.delta.listingimport.ingest.model;

public record DuplicateCheckResult(
    boolean duplicate,
    String reason,
    Long matchedEntityId
) {
    public static final String SAME_URL = "Same MLS URL already imported";
    public static final String SIMILAR_ADDRESS = "Similar address already exists";

    public static DuplicateCheckResult notDuplicate() {
        return new DuplicateCheckResult(false, null, null);
    }

    public static DuplicateCheckResult sameUrl(Long entityId) {
        return new DuplicateCheckResult(true, SAME_URL, entityId);
    }

    public static DuplicateCheckResult similarAddress(Long entityId) {
        return new DuplicateCheckResult(true, SIMILAR_ADDRESS, entityId);
    }
}
