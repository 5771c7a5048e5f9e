package com.payoutengine.api.controller;

import com.payoutengine.api.dto.PayoutDetails;
import com.payoutengine.api.dto.PayoutRunRequest;
import com.payoutengine.api.dto.ReconcileRequest;
import com.payoutengine.api.dto.UpdateScheduleRequest;
import com.payoutengine.payout.BatchRunSummary;
import com.payoutengine.payout.Payout;
import com.payoutengine.payout.PayoutCalculator;
import com.payoutengine.payout.PayoutComputation;
import com.payoutengine.payout.PayoutOutcome;
import com.payoutengine.payout.PayoutSchedule;
import com.payoutengine.payout.PayoutScheduleService;
import com.payoutengine.payout.PayoutScheduler;
import com.payoutengine.payout.PayoutStatus;
import com.payoutengine.payout.PayoutStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * REST API for payouts and the batch schedule.
 */
@RestController
@RequestMapping("/api/v1/payouts")
@RequiredArgsConstructor
@Tag(name = "Payouts", description = "Vending revenue settlement")
public class PayoutController {

    private final PayoutCalculator calculator;
    private final PayoutScheduler scheduler;
    private final PayoutScheduleService scheduleService;
    private final PayoutStore payoutStore;
    private final Clock clock;

    @PostMapping("/calculate")
    @Operation(summary = "Preview a payout", description = "Side-effect free")
    public ResponseEntity<PayoutComputation> calculate(@Valid @RequestBody PayoutRunRequest request) {
        return ResponseEntity.ok(calculator.calculate(request.getBeneficiaryId(), periodEnd(request)));
    }

    @PostMapping("/execute")
    @Operation(summary = "Settle one beneficiary")
    public ResponseEntity<PayoutOutcome> execute(@Valid @RequestBody PayoutRunRequest request) {
        return ResponseEntity.ok(scheduler.runOne(request.getBeneficiaryId(), periodEnd(request), request.getCreatedBy()));
    }

    @PostMapping("/execute-scheduled")
    @Operation(summary = "Run the batch now")
    public ResponseEntity<BatchRunSummary> executeScheduled(@RequestParam(required = false) String createdBy) {
        return ResponseEntity.ok(scheduler.runScheduled(createdBy));
    }

    @GetMapping("/schedule")
    @Operation(summary = "Get the batch schedule")
    public ResponseEntity<PayoutSchedule> getSchedule() {
        return ResponseEntity.ok(scheduleService.getSchedule());
    }

    @PutMapping("/schedule")
    @Operation(summary = "Update the batch schedule")
    public ResponseEntity<PayoutSchedule> updateSchedule(@RequestBody UpdateScheduleRequest request) {
        return ResponseEntity.ok(scheduleService.updateSchedule(
            request.getCronExpression(), request.getEnabled(), request.getUpdatedBy()));
    }

    @GetMapping
    @Operation(summary = "Payout history, newest first")
    public ResponseEntity<List<Payout>> history(
            @RequestParam(required = false) String beneficiaryId,
            @RequestParam(required = false) PayoutStatus status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {
        return ResponseEntity.ok(payoutStore.getHistory(beneficiaryId, status, dateFrom, dateTo));
    }

    @GetMapping("/{payoutId}")
    @Operation(summary = "Payout with its machine lines")
    public ResponseEntity<PayoutDetails> details(@PathVariable Long payoutId) {
        return ResponseEntity.ok(new PayoutDetails(payoutStore.getPayout(payoutId), payoutStore.getLines(payoutId)));
    }

    @PostMapping("/{payoutId}/reconcile")
    @Operation(summary = "Settle a PROCESSING payout from the platform's transfer record")
    public ResponseEntity<PayoutOutcome> reconcile(@PathVariable Long payoutId,
                                                   @RequestBody(required = false) ReconcileRequest request) {
        return ResponseEntity.ok(scheduler.reconcile(payoutId, request != null ? request.getTransferId() : null));
    }

    private LocalDate periodEnd(PayoutRunRequest request) {
        return request.getPeriodEnd() != null ? request.getPeriodEnd() : LocalDate.now(clock);
    }
}
