package com.payoutengine.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * Call metadata stamped on every gateway response.
 */
@Value
public class CacheInfo {

    @JsonProperty("cached")
    boolean cached;

    @JsonProperty("next_allowed_at")
    Instant nextAllowedAt;

    @JsonProperty("cache_age_seconds")
    Long cacheAgeSeconds;

    public static CacheInfo fresh(Instant nextAllowedAt) {
        return new CacheInfo(false, nextAllowedAt, null);
    }
}
