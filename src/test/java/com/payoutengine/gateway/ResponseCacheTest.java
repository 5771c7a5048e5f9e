package com.payoutengine.gateway;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.payoutengine.credentials.Layer;
import com.payoutengine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResponseCache.
 */
class ResponseCacheTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        cache = new ResponseCache(clock);
    }

    @Test
    void testGet_LiveUntilTtlElapses() {
        String key = CacheKeys.of(Layer.SANDBOX, "get_virtual_account", Map.of("virtual_account", "va-1"));
        cache.put(key, JsonNodeFactory.instance.textNode("payload"), Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(4));
        assertTrue(cache.get(key).isPresent());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(cache.get(key).isEmpty());
        assertTrue(cache.peek(key).isPresent());
    }

    @Test
    void testStats() {
        String key = CacheKeys.of(Layer.SANDBOX, "list_beneficiary", Map.of());
        cache.get(key);
        cache.put(key, JsonNodeFactory.instance.arrayNode(), Duration.ofMinutes(5));
        cache.get(key);
        cache.get(key);

        CacheStats stats = cache.stats();
        assertEquals(2, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getSize());
    }

    @Test
    void testAdmission() {
        String key = CacheKeys.of(Layer.LIVE, "get_payment", Map.of("payment_id", "p-1"));
        assertTrue(cache.admission(key).isOpen());

        Instant next = cache.recordCall(key, Duration.ofMinutes(5));
        assertEquals(START.plus(Duration.ofMinutes(5)), next);

        Admission closed = cache.admission(key);
        assertFalse(closed.isOpen());
        assertEquals(next, closed.getNextAllowedAt());

        clock.set(next);
        assertTrue(cache.admission(key).isOpen());
    }

    @Test
    void testInvalidateMethod_OnlyThatLayerAndMethod() {
        String sandbox = CacheKeys.of(Layer.SANDBOX, "get_virtual_account", Map.of("virtual_account", "va-1"));
        String live = CacheKeys.of(Layer.LIVE, "get_virtual_account", Map.of("virtual_account", "va-1"));
        String other = CacheKeys.of(Layer.SANDBOX, "list_beneficiary", Map.of());
        cache.put(sandbox, JsonNodeFactory.instance.objectNode(), Duration.ofMinutes(5));
        cache.put(live, JsonNodeFactory.instance.objectNode(), Duration.ofMinutes(5));
        cache.put(other, JsonNodeFactory.instance.objectNode(), Duration.ofMinutes(5));
        cache.recordCall(sandbox, Duration.ofMinutes(5));

        assertEquals(1, cache.invalidateMethod(Layer.SANDBOX, "get_virtual_account"));

        assertTrue(cache.peek(sandbox).isEmpty());
        assertTrue(cache.admission(sandbox).isOpen());
        assertTrue(cache.peek(live).isPresent());
        assertTrue(cache.peek(other).isPresent());
    }

    @Test
    void testPurgeExpired() {
        String shortLived = CacheKeys.of(Layer.SANDBOX, "list_virtual_account", Map.of());
        String longLived = CacheKeys.of(Layer.SANDBOX, "list_beneficiary", Map.of());
        cache.put(shortLived, JsonNodeFactory.instance.objectNode(), Duration.ofMinutes(1));
        cache.put(longLived, JsonNodeFactory.instance.objectNode(), Duration.ofMinutes(10));
        cache.recordCall(shortLived, Duration.ofMinutes(1));

        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, cache.purgeExpired());
        assertTrue(cache.peek(shortLived).isEmpty());
        assertTrue(cache.peek(longLived).isPresent());
        assertTrue(cache.nextAllowedAt(shortLived).isEmpty());
    }

    @Test
    void testCacheKeys_IgnoreParamOrder() {
        Map<String, Object> first = new java.util.LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", 2);
        Map<String, Object> second = new java.util.LinkedHashMap<>();
        second.put("b", 2);
        second.put("a", 1);

        assertEquals(CacheKeys.of(Layer.SANDBOX, "echo", first), CacheKeys.of(Layer.SANDBOX, "echo", second));
        assertNotEquals(CacheKeys.of(Layer.SANDBOX, "echo", first), CacheKeys.of(Layer.LIVE, "echo", first));
        assertTrue(CacheKeys.of(Layer.LIVE, "echo", first).startsWith("prod:echo:"));
    }
}
