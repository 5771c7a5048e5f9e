package com.payoutengine.payout;

import com.payoutengine.common.exception.InvalidPayoutStateException;
import com.payoutengine.credentials.Layer;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One settlement of a beneficiary's billing period.
 *
 * Payouts are never deleted. The completed payouts of a beneficiary form an
 * append-only ledger whose periods do not overlap.
 */
@Entity
@Table(name = "payouts", indexes = {
    @Index(name = "idx_payout_beneficiary", columnList = "beneficiary_id, status"),
    @Index(name = "idx_payout_transfer_key", columnList = "transfer_key", unique = true)
})
@Data
@NoArgsConstructor
public class Payout {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "beneficiary_id", nullable = false)
    private String beneficiaryId;

    @Column(name = "period_start", nullable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false)
    private LocalDate periodEnd;

    @Column(name = "total_sales", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalSales;

    @Column(name = "commission_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    /**
     * Always {@code totalSales - commissionAmount}.
     */
    @Column(name = "payout_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal payoutAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PayoutStatus status;

    /**
     * Platform transfer id. Present on every COMPLETED payout.
     */
    @Column(name = "external_reference")
    private String externalReference;

    /**
     * Remote or local failure message, verbatim. Present on every FAILED payout;
     * on a PROCESSING payout it records why the outcome is still unknown.
     */
    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    /**
     * Idempotency key ({@code ext_key}) of the transfer.
     */
    @Column(name = "transfer_key", nullable = false, updatable = false)
    private String transferKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Layer layer;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "executed_at")
    private Instant executedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Payout(String beneficiaryId, LocalDate periodStart, LocalDate periodEnd,
                  BigDecimal totalSales, BigDecimal commissionAmount, String transferKey,
                  Layer layer, String createdBy, Instant now) {
        this.beneficiaryId = beneficiaryId;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.totalSales = totalSales;
        this.commissionAmount = commissionAmount;
        this.payoutAmount = totalSales.subtract(commissionAmount);
        this.transferKey = transferKey;
        this.layer = layer;
        this.createdBy = createdBy;
        this.status = PayoutStatus.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public void startProcessing(Instant now) {
        requireStatus(PayoutStatus.PENDING, PayoutStatus.PROCESSING);
        this.status = PayoutStatus.PROCESSING;
        this.updatedAt = now;
    }

    public void complete(String externalReference, Instant now) {
        requireStatus(PayoutStatus.PROCESSING, PayoutStatus.COMPLETED);
        if (externalReference == null || externalReference.isBlank()) {
            throw new IllegalArgumentException("A completed payout needs an external reference");
        }
        this.status = PayoutStatus.COMPLETED;
        this.externalReference = externalReference;
        this.errorMessage = null;
        this.executedAt = now;
        this.updatedAt = now;
    }

    public void fail(String errorMessage, Instant now) {
        requireStatus(PayoutStatus.PROCESSING, PayoutStatus.FAILED);
        this.status = PayoutStatus.FAILED;
        this.errorMessage = errorMessage == null || errorMessage.isBlank() ? "Unknown error" : errorMessage;
        this.executedAt = now;
        this.updatedAt = now;
    }

    /**
     * Fail a payout that never reached PROCESSING. No transfer was dispatched for it.
     */
    public void abandon(String reason, Instant now) {
        requireStatus(PayoutStatus.PENDING, PayoutStatus.FAILED);
        this.status = PayoutStatus.FAILED;
        this.errorMessage = reason;
        this.executedAt = now;
        this.updatedAt = now;
    }

    /**
     * Note why a PROCESSING payout could not be settled yet.
     */
    public void markUnconfirmed(String reason, Instant now) {
        requireStatus(PayoutStatus.PROCESSING, PayoutStatus.PROCESSING);
        this.errorMessage = reason;
        this.updatedAt = now;
    }

    private void requireStatus(PayoutStatus expected, PayoutStatus requested) {
        if (status != expected) {
            throw new InvalidPayoutStateException(id, status, requested);
        }
    }
}
