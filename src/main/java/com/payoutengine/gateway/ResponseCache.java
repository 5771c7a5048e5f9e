package com.payoutengine.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.payoutengine.credentials.Layer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store of read results plus the admission side-table.
 *
 * The admission table records, per cache key, the earliest instant the same
 * call may be dispatched again. It is kept apart from the entries so that a
 * failed call, which is never cached, still closes the window.
 */
@Component
@Slf4j
public class ResponseCache {

    private final Clock clock;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, Instant> nextAllowed = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ResponseCache(Clock clock) {
        this.clock = clock;
    }

    /**
     * Live entry for the key, if any. Counts towards hit/miss statistics.
     */
    public Optional<CacheEntry> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry != null && entry.isLive(clock.instant())) {
            hits.incrementAndGet();
            return Optional.of(entry);
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    /**
     * Last stored entry for the key, expired or not.
     */
    public Optional<CacheEntry> peek(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public CacheEntry put(String key, JsonNode payload, Duration ttl) {
        CacheEntry entry = new CacheEntry(key, payload, clock.instant(), ttl);
        entries.put(key, entry);
        return entry;
    }

    public Admission admission(String key) {
        Instant next = nextAllowed.get(key);
        boolean open = next == null || !clock.instant().isBefore(next);
        return new Admission(open, next);
    }

    /**
     * Record a dispatched call. The same key is not admitted again before {@code minInterval} has passed.
     */
    public Instant recordCall(String key, Duration minInterval) {
        Instant next = clock.instant().plus(minInterval);
        nextAllowed.put(key, next);
        return next;
    }

    public Optional<Instant> nextAllowedAt(String key) {
        return Optional.ofNullable(nextAllowed.get(key));
    }

    /**
     * Drop every entry and admission of a method on a layer.
     *
     * @return number of cached entries removed
     */
    public int invalidateMethod(Layer layer, String method) {
        String prefix = CacheKeys.prefix(layer, method);
        int before = entries.size();
        entries.keySet().removeIf(key -> key.startsWith(prefix));
        nextAllowed.keySet().removeIf(key -> key.startsWith(prefix));
        int removed = Math.max(0, before - entries.size());
        if (removed > 0) {
            log.debug("Cache invalidated: layer={}, method={}, entries={}", layer.wireName(), method, removed);
        }
        return removed;
    }

    public void clear() {
        entries.clear();
        nextAllowed.clear();
        hits.set(0);
        misses.set(0);
    }

    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), entries.size());
    }

    /**
     * Remove expired entries and elapsed admissions.
     *
     * @return number of entries removed
     */
    @Scheduled(fixedDelayString = "${payout-engine.gateway.cache-purge-interval:PT5M}")
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isLive(now));
        nextAllowed.values().removeIf(next -> !now.isBefore(next));
        int removed = Math.max(0, before - entries.size());
        if (removed > 0) {
            log.debug("Purged {} expired cache entries", removed);
        }
        return removed;
    }
}
