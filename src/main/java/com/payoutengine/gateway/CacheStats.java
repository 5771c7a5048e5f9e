package com.payoutengine.gateway;

import lombok.Value;

@Value
public class CacheStats {
    long hits;
    long misses;
    int size;

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
