package com.payoutengine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * A successful read result. Replaced as a whole on refresh, never mutated.
 */
@Value
public class CacheEntry {
    String key;
    JsonNode payload;
    Instant cachedAt;
    Duration ttl;

    public Instant expiresAt() {
        return cachedAt.plus(ttl);
    }

    public boolean isLive(Instant now) {
        return now.isBefore(expiresAt());
    }

    public long ageSeconds(Instant now) {
        return Math.max(0, Duration.between(cachedAt, now).getSeconds());
    }
}
