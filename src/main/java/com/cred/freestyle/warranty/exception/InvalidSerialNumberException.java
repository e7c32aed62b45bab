package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when a serial number is blank or malformed.
 *
 * @author Warranty Platform Team
 */
public class InvalidSerialNumberException extends RuntimeException {

    private final String serialNumber;

    public InvalidSerialNumberException(String serialNumber) {
        super(serialNumber == null || serialNumber.isBlank()
                ? "Serial number is required"
                : String.format("Serial number '%s' is malformed", serialNumber));
        this.serialNumber = serialNumber;
    }

    public String getSerialNumber() {
        return serialNumber;
    }
}
