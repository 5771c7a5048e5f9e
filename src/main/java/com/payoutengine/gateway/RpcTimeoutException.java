package com.payoutengine.gateway;

import com.payoutengine.common.exception.PayoutEngineException;

public class RpcTimeoutException extends PayoutEngineException {

    public RpcTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
