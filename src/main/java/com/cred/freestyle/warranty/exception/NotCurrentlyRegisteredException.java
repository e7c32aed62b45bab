package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when a release targets a serial that is not registered
 * (or not registered to the expected user).
 *
 * @author Warranty Platform Team
 */
public class NotCurrentlyRegisteredException extends RuntimeException {

    private final String serialNumber;
    private final String expectedOwnerId;

    public NotCurrentlyRegisteredException(String serialNumber) {
        super(String.format("Serial number %s is not currently registered", serialNumber));
        this.serialNumber = serialNumber;
        this.expectedOwnerId = null;
    }

    public NotCurrentlyRegisteredException(String serialNumber, String expectedOwnerId) {
        super(String.format("Serial number %s is not currently registered to user %s",
                serialNumber, expectedOwnerId));
        this.serialNumber = serialNumber;
        this.expectedOwnerId = expectedOwnerId;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public String getExpectedOwnerId() {
        return expectedOwnerId;
    }
}
