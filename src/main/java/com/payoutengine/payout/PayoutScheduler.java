package com.payoutengine.payout;

import com.payoutengine.beneficiary.Beneficiary;
import com.payoutengine.beneficiary.BeneficiaryService;
import com.payoutengine.common.IdempotencyKey;
import com.payoutengine.common.exception.BatchAlreadyRunningException;
import com.payoutengine.common.exception.BeneficiaryNotFoundException;
import com.payoutengine.common.exception.InvalidPayoutStateException;
import com.payoutengine.common.exception.ValidationException;
import com.payoutengine.credentials.CredentialProvider;
import com.payoutengine.credentials.Layer;
import com.payoutengine.gateway.ErrorKind;
import com.payoutengine.gateway.GatewayResponse;
import com.payoutengine.platform.PlatformClient;
import com.payoutengine.platform.PlatformDTOs;
import com.payoutengine.platform.PlatformResponseException;
import com.payoutengine.signing.SigningException;
import com.payoutengine.vending.AssignmentService;
import com.payoutengine.vending.TerminalDataException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executes payouts: one beneficiary at a time or as a scheduled batch.
 *
 * EXECUTION FLOW (runOne):
 * 1. Calculate the open period
 * 2. Skip when there is nothing to pay; no payout row is written
 * 3. Persist a PENDING payout with a fresh transfer key, move it to PROCESSING
 * 4. Transfer from the source virtual account to the beneficiary's virtual account
 * 5. COMPLETED with the transfer id, or FAILED with the remote message
 *
 * A timeout or duplicate-submission reply leaves the payout PROCESSING: the
 * transfer may have happened, so it is never resent. The beneficiary is
 * blocked until {@link #reconcile} settles the payout.
 *
 * At most one run per beneficiary is in flight, and one batch at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutScheduler {

    private static final Set<String> TRANSFER_DONE = Set.of("success", "executed", "completed", "done");
    private static final Set<String> TRANSFER_REJECTED = Set.of("rejected", "canceled", "cancelled", "failed", "error");

    private final PayoutCalculator calculator;
    private final PayoutStore payoutStore;
    private final PayoutScheduleService scheduleService;
    private final BeneficiaryService beneficiaryService;
    private final AssignmentService assignmentService;
    private final PlatformClient platformClient;
    private final CredentialProvider credentials;
    private final PayoutProperties properties;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean batchRunning = new AtomicBoolean(false);

    /**
     * Settle one beneficiary up to {@code periodEnd}.
     *
     * Remote failures are reported in the outcome, never thrown. An unknown
     * beneficiary, unavailable terminal data or a missing source account give
     * an ERROR outcome.
     *
     * @throws SigningException if the payout layer has no signing credential
     */
    public PayoutOutcome runOne(String beneficiaryId, LocalDate periodEnd, String createdBy) {
        if (!inFlight.add(beneficiaryId)) {
            log.warn("Payout run for {} rejected: another run is in flight", beneficiaryId);
            return PayoutOutcome.withoutPayout(beneficiaryId, PayoutOutcome.Status.BLOCKED,
                "Another payout run for this beneficiary is in progress");
        }
        try {
            return execute(beneficiaryId, periodEnd, createdBy);
        } finally {
            inFlight.remove(beneficiaryId);
        }
    }

    /**
     * Run every beneficiary with an active machine assignment against today's date.
     *
     * A failing beneficiary never stops the batch. The schedule's last run time
     * is written only after the batch finished.
     *
     * @throws BatchAlreadyRunningException if a batch is in progress
     * @throws SigningException if the payout layer has no signing credential
     */
    public BatchRunSummary runScheduled(String createdBy) {
        if (!batchRunning.compareAndSet(false, true)) {
            throw new BatchAlreadyRunningException();
        }
        try {
            Layer layer = properties.targetLayer();
            requireCredential(layer);

            Instant startedAt = clock.instant();
            LocalDate today = LocalDate.now(clock);
            List<String> beneficiaryIds = assignmentService.getBeneficiariesWithMachines();
            log.info("Scheduled payout run started: beneficiaries={}, periodEnd={}, layer={}, parallelism={}",
                beneficiaryIds.size(), today, layer.wireName(), properties.getBatchParallelism());

            List<PayoutOutcome> outcomes = properties.getBatchParallelism() > 1 && beneficiaryIds.size() > 1
                ? runParallel(beneficiaryIds, today, createdBy)
                : runSequential(beneficiaryIds, today, createdBy);

            Instant finishedAt = clock.instant();
            scheduleService.recordRun(finishedAt);

            BatchRunSummary summary = BatchRunSummary.of(outcomes, startedAt, finishedAt);
            log.info("Scheduled payout run finished: created={}/{}, skipped={}, failed={}, unconfirmed={}, blocked={}",
                summary.getCreated(), summary.getTotal(), summary.getSkipped(), summary.getFailed(),
                summary.getUnconfirmed(), summary.getBlocked());
            return summary;
        } finally {
            batchRunning.set(false);
        }
    }

    public boolean isBatchRunning() {
        return batchRunning.get();
    }

    /**
     * Settle an unsettled payout. A PROCESSING payout is settled by looking its
     * transfer up on the platform; nothing is resent. A PENDING payout never
     * dispatched a transfer and is failed.
     *
     * @param transferId platform transfer id; the payout's external reference is used when null
     * @throws InvalidPayoutStateException if the payout is already COMPLETED or FAILED
     * @throws ValidationException if no transfer id is known
     */
    public PayoutOutcome reconcile(Long payoutId, String transferId) {
        Payout payout = payoutStore.getPayout(payoutId);
        if (payout.getStatus() == PayoutStatus.PENDING) {
            return abandon(payout);
        }
        if (payout.getStatus() != PayoutStatus.PROCESSING) {
            throw new InvalidPayoutStateException(payoutId, payout.getStatus(), PayoutStatus.COMPLETED);
        }
        String effectiveId = transferId != null && !transferId.isBlank() ? transferId.trim() : payout.getExternalReference();
        if (effectiveId == null) {
            throw new ValidationException("transfer_id is required: payout " + payoutId
                + " has no known transfer id (transfer key " + payout.getTransferKey() + ")");
        }

        GatewayResponse response = platformClient.getTransfer(payout.getLayer(), effectiveId);
        if (!response.isSuccess()) {
            String reason = "Reconciliation lookup failed: " + response.getError().getMessage();
            payoutStore.markUnconfirmed(payoutId, reason);
            return PayoutOutcome.of(payout, PayoutOutcome.Status.UNCONFIRMED, reason);
        }

        String status = platformClient.readTransfer(response)
            .map(PlatformDTOs.TransferResult::getStatus)
            .map(s -> s.toLowerCase(Locale.ROOT))
            .orElse("");

        if (TRANSFER_DONE.contains(status)) {
            Payout completed = payoutStore.markCompleted(payoutId, effectiveId);
            return PayoutOutcome.of(completed, PayoutOutcome.Status.COMPLETED, null);
        }
        if (TRANSFER_REJECTED.contains(status)) {
            Payout failed = payoutStore.markFailed(payoutId, "Transfer " + effectiveId + " " + status);
            return PayoutOutcome.of(failed, PayoutOutcome.Status.FAILED, failed.getErrorMessage());
        }

        String reason = "Transfer " + effectiveId + " is still in status '" + status + "'";
        payoutStore.markUnconfirmed(payoutId, reason);
        return PayoutOutcome.of(payout, PayoutOutcome.Status.UNCONFIRMED, reason);
    }

    private PayoutOutcome abandon(Payout payout) {
        if (inFlight.contains(payout.getBeneficiaryId())) {
            return PayoutOutcome.of(payout, PayoutOutcome.Status.BLOCKED,
                "Payout " + payout.getId() + " is being executed");
        }
        Payout failed = payoutStore.markAbandoned(payout.getId(), "Abandoned before dispatch; no transfer was sent");
        return PayoutOutcome.of(failed, PayoutOutcome.Status.FAILED, failed.getErrorMessage());
    }

    private PayoutOutcome execute(String beneficiaryId, LocalDate periodEnd, String createdBy) {
        Layer layer = properties.targetLayer();
        requireCredential(layer);

        List<Payout> unsettled = payoutStore.findUnsettled(beneficiaryId);
        if (!unsettled.isEmpty()) {
            Payout open = unsettled.get(0);
            log.warn("Payout run for {} blocked by unsettled payout {} ({})", beneficiaryId, open.getId(), open.getStatus());
            return PayoutOutcome.of(open, PayoutOutcome.Status.BLOCKED,
                "Payout " + open.getId() + " is " + open.getStatus() + "; reconcile it first");
        }

        Beneficiary beneficiary;
        PayoutComputation computation;
        try {
            beneficiary = beneficiaryService.getBeneficiary(beneficiaryId);
            computation = calculator.calculate(beneficiaryId, periodEnd);
        } catch (BeneficiaryNotFoundException | TerminalDataException | ValidationException e) {
            log.warn("Payout for {} not calculated: {}", beneficiaryId, e.getMessage());
            return PayoutOutcome.withoutPayout(beneficiaryId, PayoutOutcome.Status.ERROR, e.getMessage());
        }
        if (!computation.getPayoutAmount().isPositive()) {
            log.info("Payout for {} skipped: amount {} for {}..{}", beneficiaryId,
                computation.getPayoutAmount(), computation.getPeriodStart(), computation.getPeriodEnd());
            return PayoutOutcome.builder()
                .beneficiaryId(beneficiaryId)
                .status(PayoutOutcome.Status.SKIPPED)
                .payoutAmount(computation.getPayoutAmount().getAmount())
                .message("No payout amount")
                .build();
        }

        String source = properties.getSourceVirtualAccount();
        if (source == null || source.isBlank()) {
            log.error("Payout for {} not executed: no source virtual account configured", beneficiaryId);
            return PayoutOutcome.withoutPayout(beneficiaryId, PayoutOutcome.Status.ERROR,
                "Source virtual account is not configured (payout-engine.payouts.source-virtual-account)");
        }

        Payout payout = payoutStore.create(computation, layer, IdempotencyKey.generate(), createdBy);
        payoutStore.markProcessing(payout.getId());

        PlatformDTOs.TransferRequest request = PlatformDTOs.TransferRequest.builder()
            .fromVirtualAccount(source)
            .toVirtualAccount(beneficiary.getVirtualAccount())
            .amount(payout.getPayoutAmount())
            .purpose(String.format(properties.getPurposeTemplate(), payout.getPeriodStart(), payout.getPeriodEnd()))
            .extKey(payout.getTransferKey())
            .build();

        GatewayResponse response = platformClient.transfer(layer, request);
        return settle(payout, response);
    }

    private PayoutOutcome settle(Payout payout, GatewayResponse response) {
        if (response.isSuccess()) {
            String reference = transferIdOf(response).orElse(payout.getTransferKey());
            Payout completed = payoutStore.markCompleted(payout.getId(), reference);
            return PayoutOutcome.of(completed, PayoutOutcome.Status.COMPLETED, null);
        }

        ErrorKind kind = response.getError().getKind();
        String message = response.getError().getMessage();
        if (kind == ErrorKind.TIMEOUT || kind == ErrorKind.DUPLICATE_SUBMISSION) {
            Payout unconfirmed = payoutStore.markUnconfirmed(payout.getId(), kind + ": " + message);
            return PayoutOutcome.of(unconfirmed, PayoutOutcome.Status.UNCONFIRMED, unconfirmed.getErrorMessage());
        }

        Payout failed = payoutStore.markFailed(payout.getId(), message);
        return PayoutOutcome.of(failed, PayoutOutcome.Status.FAILED, message);
    }

    private Optional<String> transferIdOf(GatewayResponse response) {
        try {
            return platformClient.readTransfer(response).map(PlatformDTOs.TransferResult::getTransferId);
        } catch (PlatformResponseException e) {
            log.warn("Transfer succeeded but its result could not be read: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private List<PayoutOutcome> runSequential(List<String> beneficiaryIds, LocalDate periodEnd, String createdBy) {
        List<PayoutOutcome> outcomes = new ArrayList<>();
        for (String beneficiaryId : beneficiaryIds) {
            outcomes.add(runIsolated(beneficiaryId, periodEnd, createdBy));
        }
        return outcomes;
    }

    private List<PayoutOutcome> runParallel(List<String> beneficiaryIds, LocalDate periodEnd, String createdBy) {
        ExecutorService pool = Executors.newFixedThreadPool(
            Math.min(properties.getBatchParallelism(), beneficiaryIds.size()));
        try {
            List<Future<PayoutOutcome>> futures = new ArrayList<>();
            for (String beneficiaryId : beneficiaryIds) {
                futures.add(pool.submit(() -> runIsolated(beneficiaryId, periodEnd, createdBy)));
            }
            List<PayoutOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), beneficiaryIds.get(i)));
            }
            return outcomes;
        } finally {
            pool.shutdown();
        }
    }

    private PayoutOutcome await(Future<PayoutOutcome> future, String beneficiaryId) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PayoutOutcome.withoutPayout(beneficiaryId, PayoutOutcome.Status.ERROR, "Interrupted");
        } catch (ExecutionException e) {
            return PayoutOutcome.withoutPayout(beneficiaryId, PayoutOutcome.Status.ERROR, e.getCause().getMessage());
        }
    }

    private PayoutOutcome runIsolated(String beneficiaryId, LocalDate periodEnd, String createdBy) {
        try {
            return runOne(beneficiaryId, periodEnd, createdBy);
        } catch (RuntimeException e) {
            log.error("Unexpected failure in payout run for {}", beneficiaryId, e);
            return PayoutOutcome.withoutPayout(beneficiaryId, PayoutOutcome.Status.ERROR, e.getMessage());
        }
    }

    private void requireCredential(Layer layer) {
        if (credentials.find(layer).isEmpty()) {
            throw new SigningException("No signing credential configured for layer " + layer.wireName(), layer);
        }
    }
}
