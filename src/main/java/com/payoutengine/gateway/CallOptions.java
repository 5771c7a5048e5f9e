package com.payoutengine.gateway;

import lombok.Value;

@Value
public class CallOptions {

    public static final CallOptions DEFAULT = new CallOptions(false);

    /**
     * Skip a live cache entry. The admission window still applies.
     */
    boolean force;

    public static CallOptions forceRefresh() {
        return new CallOptions(true);
    }
}
