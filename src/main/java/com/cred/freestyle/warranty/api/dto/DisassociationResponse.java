package com.cred.freestyle.warranty.api.dto;

import com.cred.freestyle.warranty.domain.model.ReleasedSerial;

/**
 * Response DTO for releasing a registration.
 *
 * @author Warranty Platform Team
 */
public class DisassociationResponse {

    private String serialNumber;
    private String status;
    private String disassociatedFromUser;
    private String message;

    public DisassociationResponse() {
    }

    public static DisassociationResponse fromReleased(ReleasedSerial released) {
        DisassociationResponse response = new DisassociationResponse();
        response.setSerialNumber(released.getRecord().getSerialNumber());
        response.setStatus(released.getRecord().getStatus().name());
        response.setDisassociatedFromUser(released.getPreviousOwnerId());
        response.setMessage(String.format("Serial number %s disassociated from user %s",
                released.getRecord().getSerialNumber(), released.getPreviousOwnerId()));
        return response;
    }

    // Getters and setters
    public String getSerialNumber() {
        return serialNumber;
    }

    public void setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getDisassociatedFromUser() {
        return disassociatedFromUser;
    }

    public void setDisassociatedFromUser(String disassociatedFromUser) {
        this.disassociatedFromUser = disassociatedFromUser;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
