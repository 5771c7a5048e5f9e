package com.payoutengine.gateway;

/**
 * The platform is already processing a request with the same {@code ext_key}.
 */
public class DuplicateSubmissionException extends GatewayException {

    private final Integer code;

    public DuplicateSubmissionException(String message, Integer code) {
        super(message);
        this.code = code;
    }

    public Integer getCode() {
        return code;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.DUPLICATE_SUBMISSION;
    }
}
