package com.payoutengine.common.exception;

/**
 * Base exception for all payout engine exceptions.
 */
public class PayoutEngineException extends RuntimeException {

    public PayoutEngineException(String message) {
        super(message);
    }

    public PayoutEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
