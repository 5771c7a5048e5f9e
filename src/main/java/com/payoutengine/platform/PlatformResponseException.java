package com.payoutengine.platform;

import com.payoutengine.common.exception.PayoutEngineException;

/**
 * A successful platform reply whose result does not have the expected structure.
 */
public class PlatformResponseException extends PayoutEngineException {

    public PlatformResponseException(String message) {
        super(message);
    }

    public PlatformResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
