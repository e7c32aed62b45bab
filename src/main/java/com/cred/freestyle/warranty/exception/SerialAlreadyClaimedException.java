package com.cred.freestyle.warranty.exception;

/**
 * Exception thrown when a claim loses because the serial is not AVAILABLE,
 * either registered earlier or taken by a concurrent claim.
 *
 * @author Warranty Platform Team
 */
public class SerialAlreadyClaimedException extends RuntimeException {

    private final String serialNumber;

    public SerialAlreadyClaimedException(String serialNumber) {
        super(String.format("Serial number %s is already registered", serialNumber));
        this.serialNumber = serialNumber;
    }

    public String getSerialNumber() {
        return serialNumber;
    }
}
