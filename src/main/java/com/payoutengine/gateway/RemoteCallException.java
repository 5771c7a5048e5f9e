package com.payoutengine.gateway;

public class RemoteCallException extends GatewayException {

    private final Integer code;

    public RemoteCallException(String message, Integer code) {
        super(message);
        this.code = code;
    }

    public Integer getCode() {
        return code;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.REMOTE;
    }
}
