package com.cred.freestyle.warranty.api.dto;

import com.cred.freestyle.warranty.domain.model.AuditEntry;

import java.time.Instant;

/**
 * Response DTO for an audit trail entry. Details are the stored JSON text.
 *
 * @author Warranty Platform Team
 */
public class AuditEntryResponse {

    private String auditId;
    private Instant occurredAt;
    private String actor;
    private String action;
    private String targetType;
    private String targetId;
    private String details;

    public AuditEntryResponse() {
    }

    public static AuditEntryResponse fromEntity(AuditEntry entry) {
        AuditEntryResponse response = new AuditEntryResponse();
        response.setAuditId(entry.getAuditId());
        response.setOccurredAt(entry.getOccurredAt());
        response.setActor(entry.getActor());
        response.setAction(entry.getAction());
        response.setTargetType(entry.getTargetType());
        response.setTargetId(entry.getTargetId());
        response.setDetails(entry.getDetails());
        return response;
    }

    // Getters and setters
    public String getAuditId() {
        return auditId;
    }

    public void setAuditId(String auditId) {
        this.auditId = auditId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public void setOccurredAt(Instant occurredAt) {
        this.occurredAt = occurredAt;
    }

    public String getActor() {
        return actor;
    }

    public void setActor(String actor) {
        this.actor = actor;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getTargetType() {
        return targetType;
    }

    public void setTargetType(String targetType) {
        this.targetType = targetType;
    }

    public String getTargetId() {
        return targetId;
    }

    public void setTargetId(String targetId) {
        this.targetId = targetId;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }
}
