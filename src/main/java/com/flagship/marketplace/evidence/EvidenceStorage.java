package com.flagship.marketplace.evidence;

/**
 * Binary object storage for evidence files. Only the returned reference is
 * kept with the transaction.
 */
public interface EvidenceStorage {

    /**
     * Stores the bytes and returns an opaque reference to them.
     */
    String put(byte[] content);

    /**
     * Deletes the object behind a reference. Unknown references are ignored.
     */
    void delete(String ref);
}
