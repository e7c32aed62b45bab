package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when an uploaded bill is missing, empty, too large or of an unsupported type.
 *
 * @author Warranty Platform Team
 */
public class InvalidEvidenceException extends RuntimeException {

    public InvalidEvidenceException(String message) {
        super(message);
    }
}
