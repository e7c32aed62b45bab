package com.cred.freestyle.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Customer account as seen by the ledger: only the flags that decide whether
 * the customer may register serial numbers.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "customer_accounts", indexes = {
    @Index(name = "idx_customer_mobile", columnList = "mobile_number", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerAccount {

    @Id
    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "mobile_number", length = 20)
    private String mobileNumber;

    @Column(name = "company_name", length = 255)
    private String companyName;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    @Column(name = "can_register_serials", nullable = false)
    private Boolean canRegisterSerials;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (isActive == null) {
            isActive = true;
        }
        if (canRegisterSerials == null) {
            canRegisterSerials = true;
        }
        createdAt = Instant.now();
    }

    public boolean isEligibleToRegister() {
        return Boolean.TRUE.equals(isActive) && Boolean.TRUE.equals(canRegisterSerials);
    }
}
