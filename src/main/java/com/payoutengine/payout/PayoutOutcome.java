package com.payoutengine.payout;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * What happened to one beneficiary in a payout run.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PayoutOutcome {

    public enum Status {
        /** Transfer confirmed; the payout is COMPLETED. */
        COMPLETED,
        /** Transfer rejected; the payout is FAILED with the remote message. */
        FAILED,
        /** Transfer outcome unknown (timeout or duplicate); the payout stays PROCESSING until reconciled. */
        UNCONFIRMED,
        /** Nothing to pay for the period. No payout was created. */
        SKIPPED,
        /** Another transfer of the beneficiary is in flight or unsettled. No payout was created. */
        BLOCKED,
        /** The run failed before a transfer was attempted. */
        ERROR
    }

    String beneficiaryId;
    Status status;
    Long payoutId;
    BigDecimal payoutAmount;
    String message;

    public static PayoutOutcome of(Payout payout, Status status, String message) {
        return PayoutOutcome.builder()
            .beneficiaryId(payout.getBeneficiaryId())
            .status(status)
            .payoutId(payout.getId())
            .payoutAmount(payout.getPayoutAmount())
            .message(message)
            .build();
    }

    public static PayoutOutcome withoutPayout(String beneficiaryId, Status status, String message) {
        return PayoutOutcome.builder()
            .beneficiaryId(beneficiaryId)
            .status(status)
            .message(message)
            .build();
    }
}
