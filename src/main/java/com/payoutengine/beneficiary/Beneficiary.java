package com.payoutengine.beneficiary;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Local record of a payee. The platform owns the beneficiary itself; this row
 * keeps what settlement needs: where to pay and since when.
 */
@Entity
@Table(name = "beneficiaries")
@Data
@NoArgsConstructor
public class Beneficiary {

    /**
     * Platform beneficiary id.
     */
    @Id
    @Column(name = "beneficiary_id")
    private String beneficiaryId;

    @Column(nullable = false)
    private String name;

    /**
     * Platform virtual account payouts are credited to.
     */
    @Column(name = "virtual_account", nullable = false)
    private String virtualAccount;

    /**
     * First day of the first billing period.
     */
    @Column(name = "onboarded_on", nullable = false)
    private LocalDate onboardedOn;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Beneficiary(String beneficiaryId, String name, String virtualAccount, LocalDate onboardedOn, Instant now) {
        this.beneficiaryId = beneficiaryId;
        this.name = name;
        this.virtualAccount = virtualAccount;
        this.onboardedOn = onboardedOn;
        this.createdAt = now;
        this.updatedAt = now;
    }
}
