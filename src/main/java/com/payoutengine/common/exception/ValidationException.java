package com.payoutengine.common.exception;

/**
 * Thrown when input is malformed. Always raised before any remote call is made.
 */
public class ValidationException extends PayoutEngineException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
