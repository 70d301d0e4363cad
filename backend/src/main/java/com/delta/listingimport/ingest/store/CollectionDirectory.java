package com.delta.listingimport.ingest.store;

/**
 * Owner/collection lookup. Batches may only target a collection that belongs to the requesting owner.
 */
public interface CollectionDirectory {
    boolean exists(String ownerId, long collectionId);

    long createCollection(String ownerId, String name);
}
