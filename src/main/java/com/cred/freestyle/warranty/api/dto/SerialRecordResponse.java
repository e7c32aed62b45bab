package com.cred.freestyle.warranty.api.dto;

import com.cred.freestyle.warranty.domain.model.SerialRecord;

import java.time.Instant;

/**
 * Response DTO for a ledger entry, as seen by its owner or an administrator.
 *
 * @author Warranty Platform Team
 */
public class SerialRecordResponse {

    private String serialNumber;
    private Long productId;
    private String status;
    private String ownerId;
    private Instant registeredAt;
    private String evidenceReference;

    public SerialRecordResponse() {
    }

    /**
     * Create response from SerialRecord entity.
     *
     * @param record SerialRecord entity
     * @return SerialRecordResponse
     */
    public static SerialRecordResponse fromEntity(SerialRecord record) {
        SerialRecordResponse response = new SerialRecordResponse();
        response.setSerialNumber(record.getSerialNumber());
        response.setProductId(record.getProductId());
        response.setStatus(record.getStatus().name());
        response.setOwnerId(record.getOwnerId());
        response.setRegisteredAt(record.getRegisteredAt());
        response.setEvidenceReference(record.getEvidenceReference());
        return response;
    }

    // Getters and setters
    public String getSerialNumber() {
        return serialNumber;
    }

    public void setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
    }

    public Long getProductId() {
        return productId;
    }

    public void setProductId(Long productId) {
        this.productId = productId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(Instant registeredAt) {
        this.registeredAt = registeredAt;
    }

    public String getEvidenceReference() {
        return evidenceReference;
    }

    public void setEvidenceReference(String evidenceReference) {
        this.evidenceReference = evidenceReference;
    }
}
