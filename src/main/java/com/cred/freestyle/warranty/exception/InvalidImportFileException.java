package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when a bulk import file cannot be read or has the wrong format.
 *
 * @author Warranty Platform Team
 */
public class InvalidImportFileException extends RuntimeException {

    public InvalidImportFileException(String message) {
        super(message);
    }

    public InvalidImportFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
