package com.payoutengine.gateway;

import lombok.Value;

import java.time.Instant;

/**
 * Whether a cache key may be dispatched now. {@code nextAllowedAt} is null when no call was recorded.
 */
@Value
public class Admission {
    boolean open;
    Instant nextAllowedAt;
}
