package com.delta.listingimport.ingest.duplicate;

import com.delta.listingimport.ingest.model.CommittedProperty;
import com.delta.listingimport.ingest.model.DuplicateCheckResult;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.PropertyAddress;
import com.delta.listingimport.ingest.store.CollectionPropertyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Scoped duplicate gate: a candidate is a duplicate when a property in the same owner/collection already has
 * its source URL, or failing that its normalized address. The URL rule is checked first.
 */
@Service
public class DuplicateDetector {
    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    private final CollectionPropertyStore store;

    public DuplicateDetector(CollectionPropertyStore store) {
        this.store = store;
    }

    public DuplicateCheckResult check(String ownerId, long collectionId, ParsedProperty candidate) {
        if (candidate == null) {
            return DuplicateCheckResult.notDuplicate();
        }
        return check(ownerId, collectionId, candidate.sourceUrl(), candidate.address());
    }

    public DuplicateCheckResult check(String ownerId, long collectionId, String sourceUrl, PropertyAddress address) {
        if (sourceUrl != null && !sourceUrl.isBlank()) {
            Optional<CommittedProperty> byUrl = store.findBySourceUrl(ownerId, collectionId, sourceUrl.trim());
            if (byUrl.isPresent()) {
                log.info("Duplicate by URL in {}/{}: {} matches property {}", ownerId, collectionId, sourceUrl, byUrl.get().id());
                return DuplicateCheckResult.sameUrl(byUrl.get().id());
            }
        }
        if (address == null || address.isPlaceholder()) {
            return DuplicateCheckResult.notDuplicate();
        }
        String normalized = AddressNormalizer.normalize(address.full());
        if (normalized == null) {
            return DuplicateCheckResult.notDuplicate();
        }
        Optional<CommittedProperty> byAddress = store.findByNormalizedAddress(ownerId, collectionId, normalized);
        if (byAddress.isPresent()) {
            log.info("Duplicate by address in {}/{}: '{}' matches property {}", ownerId, collectionId, normalized, byAddress.get().id());
            return DuplicateCheckResult.similarAddress(byAddress.get().id());
        }
        return DuplicateCheckResult.notDuplicate();
    }
}
