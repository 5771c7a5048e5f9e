package com.payoutengine.payout;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Result of a scheduled batch run. {@code created} counts beneficiaries whose
 * payout COMPLETED, so any failure shows as {@code created < total}.
 */
@Value
public class BatchRunSummary {
    int created;
    int total;
    int skipped;
    int failed;
    int unconfirmed;
    int blocked;
    Instant startedAt;
    Instant finishedAt;
    List<PayoutOutcome> outcomes;

    public static BatchRunSummary of(List<PayoutOutcome> outcomes, Instant startedAt, Instant finishedAt) {
        return new BatchRunSummary(
            count(outcomes, PayoutOutcome.Status.COMPLETED),
            outcomes.size(),
            count(outcomes, PayoutOutcome.Status.SKIPPED),
            count(outcomes, PayoutOutcome.Status.FAILED) + count(outcomes, PayoutOutcome.Status.ERROR),
            count(outcomes, PayoutOutcome.Status.UNCONFIRMED),
            count(outcomes, PayoutOutcome.Status.BLOCKED),
            startedAt,
            finishedAt,
            List.copyOf(outcomes)
        );
    }

    private static int count(List<PayoutOutcome> outcomes, PayoutOutcome.Status status) {
        return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
    }
}
