package com.payoutengine.common.exception;

import com.payoutengine.payout.PayoutStatus;

/**
 * Thrown when a payout status transition is not allowed.
 */
public class InvalidPayoutStateException extends PayoutEngineException {

    public InvalidPayoutStateException(Long payoutId, PayoutStatus current, PayoutStatus requested) {
        super(String.format("Payout %s cannot move from %s to %s", payoutId, current, requested));
    }
}
