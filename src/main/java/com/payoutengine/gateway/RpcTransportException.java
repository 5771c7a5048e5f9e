package com.payoutengine.gateway;

import com.payoutengine.common.exception.PayoutEngineException;

/**
 * The request never reached the platform (DNS, refused connection, TLS).
 */
public class RpcTransportException extends PayoutEngineException {

    public RpcTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
