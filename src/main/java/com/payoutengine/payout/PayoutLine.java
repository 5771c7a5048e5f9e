package com.payoutengine.payout;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-machine breakdown of a payout. The commission percent is a copy taken
 * at calculation time, not a reference to the assignment.
 */
@Entity
@Table(name = "payout_lines", indexes = {
    @Index(name = "idx_payout_line_payout", columnList = "payout_id")
})
@Data
@NoArgsConstructor
public class PayoutLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "payout_id", nullable = false)
    private Long payoutId;

    @Column(name = "machine_id", nullable = false)
    private String machineId;

    @Column(name = "sales_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal salesAmount;

    @Column(name = "commission_percent", nullable = false, precision = 4, scale = 1)
    private BigDecimal commissionPercent;

    @Column(name = "commission_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "net_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal netAmount;

    public PayoutLine(Long payoutId, PayoutComputation.MachineLine line) {
        this.payoutId = payoutId;
        this.machineId = line.getMachineId();
        this.salesAmount = line.getSalesAmount().getAmount();
        this.commissionPercent = line.getCommissionPercent();
        this.commissionAmount = line.getCommissionAmount().getAmount();
        this.netAmount = line.getNetAmount().getAmount();
    }
}
