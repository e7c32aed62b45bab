package com.cred.freestyle.warranty.domain.model;

import java.time.Instant;

/**
 * Outcome of releasing a registration: the record as it is now AVAILABLE,
 * plus the registration it replaced.
 *
 * @author Warranty Platform Team
 */
public class ReleasedSerial {

    private final SerialRecord record;
    private final String previousOwnerId;
    private final String previousEvidenceReference;
    private final Instant previousRegisteredAt;

    public ReleasedSerial(SerialRecord record, String previousOwnerId,
                          String previousEvidenceReference, Instant previousRegisteredAt) {
        this.record = record;
        this.previousOwnerId = previousOwnerId;
        this.previousEvidenceReference = previousEvidenceReference;
        this.previousRegisteredAt = previousRegisteredAt;
    }

    public SerialRecord getRecord() {
        return record;
    }

    public String getPreviousOwnerId() {
        return previousOwnerId;
    }

    public String getPreviousEvidenceReference() {
        return previousEvidenceReference;
    }

    public Instant getPreviousRegisteredAt() {
        return previousRegisteredAt;
    }
}
