package com.payoutengine.gateway;

/**
 * No reply within the read timeout. Whether the platform applied the call is unknown.
 */
public class GatewayTimeoutException extends GatewayException {

    public GatewayTimeoutException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TIMEOUT;
    }
}
