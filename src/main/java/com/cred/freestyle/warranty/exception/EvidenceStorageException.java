package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when a bill cannot be written to or read from evidence storage.
 *
 * @author Warranty Platform Team
 */
public class EvidenceStorageException extends RuntimeException {

    public EvidenceStorageException(String message) {
        super(message);
    }

    public EvidenceStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
