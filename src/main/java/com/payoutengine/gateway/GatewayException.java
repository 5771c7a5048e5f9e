package com.payoutengine.gateway;

import com.payoutengine.common.exception.PayoutEngineException;

/**
 * Base of the exceptions raised by {@link GatewayResponse#orThrow()} for remote outcomes.
 */
public abstract class GatewayException extends PayoutEngineException {

    protected GatewayException(String message) {
        super(message);
    }

    public abstract ErrorKind getKind();
}
