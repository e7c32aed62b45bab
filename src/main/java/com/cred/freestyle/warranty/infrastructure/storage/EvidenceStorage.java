package com.cred.freestyle.warranty.infrastructure.storage;

/**
 * Storage for purchase bills attached to registrations. Services depend on
 * this interface rather than on a concrete filesystem or object store.
 *
 * @author Warranty Platform Team
 */
public interface EvidenceStorage {

    /**
     * Store a bill under a freshly generated, collision-free name.
     *
     * @param namePrefix Prefix for the generated name (sanitized by the implementation)
     * @param extension File extension without the dot
     * @param content File content
     * @return Opaque reference to the stored object
     * @throws com.cred.freestyle.warranty.exception.EvidenceStorageException if the write fails
     */
    String store(String namePrefix, String extension, byte[] content);

    /**
     * Load a stored bill.
     *
     * @param reference Reference returned by {@link #store}
     * @return File content
     * @throws com.cred.freestyle.warranty.exception.ResourceNotFoundException if nothing is stored under the reference
     * @throws com.cred.freestyle.warranty.exception.EvidenceStorageException if the read fails
     */
    byte[] load(String reference);

    /**
     * Delete a stored bill. Deleting a missing reference is not an error.
     *
     * @param reference Reference returned by {@link #store}
     * @return true if an object was removed
     * @throws com.cred.freestyle.warranty.exception.EvidenceStorageException if the delete fails
     */
    boolean delete(String reference);
}
