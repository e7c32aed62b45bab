package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when a serial number does not exist in the ledger.
 *
 * @author Warranty Platform Team
 */
public class SerialNotFoundException extends RuntimeException {

    private final String serialNumber;

    public SerialNotFoundException(String serialNumber) {
        super(String.format("Serial number %s not found", serialNumber));
        this.serialNumber = serialNumber;
    }

    public String getSerialNumber() {
        return serialNumber;
    }
}
