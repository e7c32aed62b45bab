package com.cred.freestyle.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Check;

import java.time.Instant;
import java.util.UUID;

/**
 * Ledger entry for one physical unit, identified by its serial number.
 *
 * Lifecycle:
 * - AVAILABLE: uploaded by an administrator, not owned by anyone
 * - REGISTERED: claimed by exactly one customer with a bill on file
 *
 * The owner/status/registration-time consistency rule and the upper-case
 * serial number rule are enforced by check constraints on the table, and
 * the product reference is not updatable once the row exists.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "serial_records", indexes = {
    @Index(name = "idx_serial_number_unique", columnList = "serial_number", unique = true),
    @Index(name = "idx_serial_product_status", columnList = "product_id, status"),
    @Index(name = "idx_serial_owner", columnList = "owner_id")
})
@Check(name = "chk_serial_registration_state", constraints =
        "(status = 'AVAILABLE' AND owner_id IS NULL AND registered_at IS NULL) OR "
        + "(status = 'REGISTERED' AND owner_id IS NOT NULL AND registered_at IS NOT NULL)")
@Check(name = "chk_serial_upper_case", constraints = "serial_number = UPPER(serial_number)")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SerialRecord {

    @Id
    @Column(name = "record_id", nullable = false, length = 36)
    private String recordId;

    /**
     * Normalized (trimmed, upper-case) serial number. Globally unique.
     */
    @Column(name = "serial_number", nullable = false, unique = true, updatable = false, length = 64)
    private String serialNumber;

    @Column(name = "product_id", nullable = false, updatable = false)
    private Long productId;

    /**
     * Read-only association so the schema carries a foreign key to products.
     */
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_serial_product"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Product product;

    @Column(name = "owner_id", length = 64)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SerialStatus status;

    @Column(name = "registered_at")
    private Instant registeredAt;

    /**
     * Opaque reference to the stored bill (set while REGISTERED).
     */
    @Column(name = "evidence_reference", length = 255)
    private String evidenceReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (recordId == null) {
            recordId = UUID.randomUUID().toString();
        }
        if (status == null) {
            status = SerialStatus.AVAILABLE;
        }
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isAvailable() {
        return status == SerialStatus.AVAILABLE;
    }

    public boolean isRegistered() {
        return status == SerialStatus.REGISTERED;
    }

    /**
     * Create a fresh AVAILABLE record for bulk import.
     *
     * @param serialNumber Normalized serial number
     * @param productId Owning product
     * @return Unsaved record
     */
    public static SerialRecord available(String serialNumber, Long productId) {
        return SerialRecord.builder()
                .serialNumber(serialNumber)
                .productId(productId)
                .status(SerialStatus.AVAILABLE)
                .build();
    }

    public enum SerialStatus {
        AVAILABLE,
        REGISTERED
    }
}
