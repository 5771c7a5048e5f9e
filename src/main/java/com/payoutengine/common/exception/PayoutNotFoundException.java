package com.payoutengine.common.exception;

/**
 * Thrown when a payout cannot be found.
 */
public class PayoutNotFoundException extends PayoutEngineException {

    public PayoutNotFoundException(Long payoutId) {
        super("Payout not found: " + payoutId);
    }
}
