package com.payoutengine.payout;

import com.payoutengine.common.exception.PayoutNotFoundException;
import com.payoutengine.credentials.Layer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Persistence of payouts and their lines.
 *
 * Each lifecycle step commits on its own, so a payout is durably PROCESSING
 * before its transfer is dispatched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutStore {

    private final PayoutRepository payoutRepository;
    private final PayoutLineRepository lineRepository;
    private final Clock clock;

    /**
     * Persist a PENDING payout with its machine lines.
     */
    @Transactional
    public Payout create(PayoutComputation computation, Layer layer, String transferKey, String createdBy) {
        Payout payout = new Payout(
            computation.getBeneficiaryId(),
            computation.getPeriodStart(),
            computation.getPeriodEnd(),
            computation.getTotalSales().getAmount(),
            computation.getTotalCommission().getAmount(),
            transferKey,
            layer,
            createdBy,
            clock.instant()
        );
        payoutRepository.save(payout);

        for (PayoutComputation.MachineLine line : computation.getLines()) {
            lineRepository.save(new PayoutLine(payout.getId(), line));
        }

        log.info("Created payout {} for {}: period {}..{}, amount {}, transferKey={}",
            payout.getId(), payout.getBeneficiaryId(), payout.getPeriodStart(), payout.getPeriodEnd(),
            payout.getPayoutAmount(), transferKey);
        return payout;
    }

    @Transactional
    public Payout markProcessing(Long payoutId) {
        Payout payout = getPayout(payoutId);
        payout.startProcessing(clock.instant());
        log.info("Payout {} processing", payoutId);
        return payoutRepository.save(payout);
    }

    @Transactional
    public Payout markCompleted(Long payoutId, String externalReference) {
        Payout payout = getPayout(payoutId);
        payout.complete(externalReference, clock.instant());
        log.info("Payout {} completed: externalReference={}", payoutId, externalReference);
        return payoutRepository.save(payout);
    }

    @Transactional
    public Payout markFailed(Long payoutId, String errorMessage) {
        Payout payout = getPayout(payoutId);
        payout.fail(errorMessage, clock.instant());
        log.warn("Payout {} failed: {}", payoutId, errorMessage);
        return payoutRepository.save(payout);
    }

    @Transactional
    public Payout markAbandoned(Long payoutId, String reason) {
        Payout payout = getPayout(payoutId);
        payout.abandon(reason, clock.instant());
        log.warn("Payout {} abandoned before dispatch: {}", payoutId, reason);
        return payoutRepository.save(payout);
    }

    /**
     * Keep the payout PROCESSING and record why its outcome is unknown.
     */
    @Transactional
    public Payout markUnconfirmed(Long payoutId, String reason) {
        Payout payout = getPayout(payoutId);
        payout.markUnconfirmed(reason, clock.instant());
        log.warn("Payout {} unconfirmed: {}", payoutId, reason);
        return payoutRepository.save(payout);
    }

    @Transactional(readOnly = true)
    public Payout getPayout(Long payoutId) {
        return payoutRepository.findById(payoutId)
            .orElseThrow(() -> new PayoutNotFoundException(payoutId));
    }

    @Transactional(readOnly = true)
    public List<PayoutLine> getLines(Long payoutId) {
        getPayout(payoutId);
        return lineRepository.findByPayoutIdOrderByMachineIdAsc(payoutId);
    }

    @Transactional(readOnly = true)
    public Optional<Payout> findLastCompleted(String beneficiaryId) {
        return payoutRepository.findTopByBeneficiaryIdAndStatusOrderByPeriodEndDesc(beneficiaryId, PayoutStatus.COMPLETED);
    }

    /**
     * PENDING or PROCESSING payouts of a beneficiary.
     */
    @Transactional(readOnly = true)
    public List<Payout> findUnsettled(String beneficiaryId) {
        return payoutRepository.findByBeneficiaryIdAndStatusIn(beneficiaryId,
            List.of(PayoutStatus.PENDING, PayoutStatus.PROCESSING));
    }

    /**
     * Payout history, newest first. Every filter is optional; dates match the period end.
     */
    @Transactional(readOnly = true)
    public List<Payout> getHistory(String beneficiaryId, PayoutStatus status, LocalDate from, LocalDate to) {
        List<Payout> candidates;
        if (beneficiaryId != null) {
            candidates = payoutRepository.findByBeneficiaryIdOrderByCreatedAtDesc(beneficiaryId);
        } else if (status != null) {
            candidates = payoutRepository.findByStatusOrderByCreatedAtDesc(status);
        } else {
            candidates = payoutRepository.findAllByOrderByCreatedAtDesc();
        }
        return candidates.stream()
            .filter(p -> status == null || p.getStatus() == status)
            .filter(p -> from == null || !p.getPeriodEnd().isBefore(from))
            .filter(p -> to == null || !p.getPeriodEnd().isAfter(to))
            .collect(Collectors.toList());
    }
}
