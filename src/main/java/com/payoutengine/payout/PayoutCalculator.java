package com.payoutengine.payout;

import com.payoutengine.beneficiary.Beneficiary;
import com.payoutengine.beneficiary.BeneficiaryService;
import com.payoutengine.common.Currency;
import com.payoutengine.common.Money;
import com.payoutengine.common.exception.ValidationException;
import com.payoutengine.vending.AssignmentService;
import com.payoutengine.vending.MachineAssignment;
import com.payoutengine.vending.TerminalDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates machine revenue into a beneficiary payout.
 *
 * The period starts the day after the last COMPLETED payout ended, or on the
 * beneficiary's onboarding date. A machine contributes only from the day it
 * was assigned. Commission is rounded per machine to minor units (HALF_UP);
 * totals are sums of the rounded lines, so
 * {@code payout = totalSales - totalCommission} holds exactly.
 *
 * Side-effect free: calling it twice for the same period returns the same numbers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutCalculator {

    private final BeneficiaryService beneficiaryService;
    private final AssignmentService assignmentService;
    private final TerminalDataService terminalDataService;
    private final PayoutStore payoutStore;
    private final Clock clock;

    public PayoutComputation calculate(String beneficiaryId, LocalDate periodEnd) {
        if (periodEnd == null) {
            throw new ValidationException("period_end is required");
        }
        Beneficiary beneficiary = beneficiaryService.getBeneficiary(beneficiaryId);

        LocalDate periodStart = payoutStore.findLastCompleted(beneficiaryId)
            .map(last -> last.getPeriodEnd().plusDays(1))
            .orElse(beneficiary.getOnboardedOn());

        if (periodEnd.isBefore(periodStart)) {
            log.debug("Nothing to settle for {}: period {}..{} is empty", beneficiaryId, periodStart, periodEnd);
            return PayoutComputation.empty(beneficiaryId, periodStart, periodEnd);
        }

        List<PayoutComputation.MachineLine> lines = new ArrayList<>();
        Money totalSales = Money.zero(Currency.RUB);
        Money totalCommission = Money.zero(Currency.RUB);

        for (MachineAssignment assignment : assignmentService.getActiveAssignments(beneficiaryId)) {
            LocalDate assignedOn = LocalDate.ofInstant(assignment.getAssignedAt(), clock.getZone());
            LocalDate from = assignedOn.isAfter(periodStart) ? assignedOn : periodStart;

            Money sales = from.isAfter(periodEnd)
                ? Money.zero(Currency.RUB)
                : terminalDataService.revenue(assignment.getMachineId(), from, periodEnd);
            Money commission = sales.percent(assignment.getCommissionPercent());
            Money net = sales.subtract(commission);

            lines.add(new PayoutComputation.MachineLine(assignment.getMachineId(), sales,
                assignment.getCommissionPercent(), commission, net));
            totalSales = totalSales.add(sales);
            totalCommission = totalCommission.add(commission);
        }

        PayoutComputation computation = PayoutComputation.builder()
            .beneficiaryId(beneficiaryId)
            .periodStart(periodStart)
            .periodEnd(periodEnd)
            .lines(List.copyOf(lines))
            .totalSales(totalSales)
            .totalCommission(totalCommission)
            .payoutAmount(totalSales.subtract(totalCommission))
            .build();

        log.debug("Calculated payout for {} over {}..{}: sales={}, commission={}, payout={}, machines={}",
            beneficiaryId, periodStart, periodEnd, totalSales, totalCommission,
            computation.getPayoutAmount(), lines.size());
        return computation;
    }
}
