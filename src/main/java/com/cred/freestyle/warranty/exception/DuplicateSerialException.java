package com.cred.freestyle.warranty.exception;

import java.util.List;

/**
 * Exception thrown when an insert violates the serial number uniqueness constraint.
 *
 * @author Warranty Platform Team
 */
public class DuplicateSerialException extends RuntimeException {

    private final List<String> serialNumbers;

    public DuplicateSerialException(List<String> serialNumbers, Throwable cause) {
        super(String.format("Serial number(s) already exist: %d in batch", serialNumbers.size()), cause);
        this.serialNumbers = List.copyOf(serialNumbers);
    }

    public List<String> getSerialNumbers() {
        return serialNumbers;
    }
}
