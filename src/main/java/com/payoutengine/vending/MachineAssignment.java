package com.payoutengine.vending;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Links a vending machine to the beneficiary who receives its revenue.
 *
 * Rows are never edited: reassigning a machine closes the active row and
 * inserts a new one, so past periods keep the commission they were computed with.
 */
@Entity
@Table(name = "machine_assignments", indexes = {
    @Index(name = "idx_assignment_machine", columnList = "machine_id"),
    @Index(name = "idx_assignment_beneficiary", columnList = "beneficiary_id")
})
@Data
@NoArgsConstructor
public class MachineAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Device id in the terminal service.
     */
    @Column(name = "machine_id", nullable = false)
    private String machineId;

    @Column(name = "beneficiary_id", nullable = false)
    private String beneficiaryId;

    /**
     * Operator commission, 0-100 with at most one decimal.
     */
    @Column(name = "commission_percent", nullable = false, precision = 4, scale = 1)
    private BigDecimal commissionPercent;

    @Column(name = "assigned_at", nullable = false, updatable = false)
    private Instant assignedAt;

    /**
     * Null while the assignment is active.
     */
    @Column(name = "unassigned_at")
    private Instant unassignedAt;

    @Column(name = "created_by")
    private String createdBy;

    public MachineAssignment(String machineId, String beneficiaryId, BigDecimal commissionPercent,
                             Instant assignedAt, String createdBy) {
        this.machineId = machineId;
        this.beneficiaryId = beneficiaryId;
        this.commissionPercent = commissionPercent;
        this.assignedAt = assignedAt;
        this.createdBy = createdBy;
    }

    public boolean isActive() {
        return unassignedAt == null;
    }

    public void close(Instant at) {
        this.unassignedAt = at;
    }
}
