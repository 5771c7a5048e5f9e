package com.payoutengine.gateway;

import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * How the gateway treats one platform method.
 */
@Value
public class MethodPolicy {
    String method;
    MethodKind kind;

    /**
     * Zero for methods whose results are never cached.
     */
    Duration cacheTtl;

    Duration minInterval;

    /**
     * Read methods whose cached results a successful call of this method makes stale.
     */
    List<String> invalidates;

    public boolean isRead() {
        return kind == MethodKind.READ;
    }

    public boolean isCacheable() {
        return isRead() && cacheTtl.compareTo(Duration.ZERO) > 0;
    }
}
