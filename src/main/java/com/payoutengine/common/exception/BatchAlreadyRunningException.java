package com.payoutengine.common.exception;

/**
 * Thrown when a scheduled payout batch is started while another one is still running.
 */
public class BatchAlreadyRunningException extends PayoutEngineException {

    public BatchAlreadyRunningException() {
        super("A scheduled payout run is already in progress");
    }
}
