package com.delta.listingimport.ingest.store;

import com.delta.listingimport.ingest.model.CommittedProperty;

/**
 * Hook fired after a property is committed. Implementations must not block or throw into the caller.
 */
public interface ImportNotifier {
    void propertyImported(CommittedProperty property);
}
