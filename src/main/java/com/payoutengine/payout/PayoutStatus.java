package com.payoutengine.payout;

/**
 * Lifecycle: PENDING -> PROCESSING -> COMPLETED | FAILED.
 */
public enum PayoutStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
