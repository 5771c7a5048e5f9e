package com.payoutengine.payout;

import com.payoutengine.common.Currency;
import com.payoutengine.common.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Result of a payout calculation. Nothing is persisted until the scheduler commits it.
 */
@Value
@Builder
public class PayoutComputation {
    String beneficiaryId;
    LocalDate periodStart;
    LocalDate periodEnd;
    List<MachineLine> lines;
    Money totalSales;
    Money totalCommission;
    Money payoutAmount;

    /**
     * The period was already settled up to {@code periodEnd}.
     */
    public boolean isEmptyWindow() {
        return periodEnd.isBefore(periodStart);
    }

    public static PayoutComputation empty(String beneficiaryId, LocalDate periodStart, LocalDate periodEnd) {
        Money zero = Money.zero(Currency.RUB);
        return PayoutComputation.builder()
            .beneficiaryId(beneficiaryId)
            .periodStart(periodStart)
            .periodEnd(periodEnd)
            .lines(List.of())
            .totalSales(zero)
            .totalCommission(zero)
            .payoutAmount(zero)
            .build();
    }

    @Value
    public static class MachineLine {
        String machineId;
        Money salesAmount;
        BigDecimal commissionPercent;
        Money commissionAmount;
        Money netAmount;
    }
}
