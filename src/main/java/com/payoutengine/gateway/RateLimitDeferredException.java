package com.payoutengine.gateway;

import java.time.Instant;

public class RateLimitDeferredException extends GatewayException {

    private final Instant nextAllowedAt;

    public RateLimitDeferredException(String message, Instant nextAllowedAt) {
        super(message);
        this.nextAllowedAt = nextAllowedAt;
    }

    public Instant getNextAllowedAt() {
        return nextAllowedAt;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.RATE_LIMIT_DEFERRED;
    }
}
