package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.listener.RemovalCause;
import com.github.rudygunawan.stash.time.FakeTicker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TimedSizedCacheTest {

    private static TimedSizedCache<String, Integer> newCache(int size, FakeTicker ticker) {
        return new TimedSizedCache<>(size, Duration.ofSeconds(2), false, ticker);
    }

    @Test
    void testExpiredEntryIsMissButKept() {
        FakeTicker ticker = new FakeTicker();
        TimedSizedCache<String, Integer> cache = newCache(3, ticker);
        cache.put("a", 1);
        assertEquals(1, cache.getIfPresent("a"));

        ticker.advance(2, TimeUnit.SECONDS);
        assertNull(cache.getIfPresent("a"));
        assertEquals(OptionalLong.of(1), cache.hits());
        assertEquals(OptionalLong.of(1), cache.misses());
        assertEquals(1, cache.size(), "expired entry still occupies its slot");
        assertEquals(List.of(), cache.keyOrder());
    }

    @Test
    void testLeastRecentlyUsedEvictedFirst() {
        FakeTicker ticker = new FakeTicker();
        TimedSizedCache<String, Integer> cache = newCache(3, ticker);
        List<String> evicted = new ArrayList<>();
        cache.setRemovalListener((k, v, cause) -> {
            if (cause == RemovalCause.SIZE) {
                evicted.add(k);
            }
        });
        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("c", 3);
        cache.getIfPresent("a");
        cache.put("d", 4);

        assertEquals(List.of("b"), evicted);
        assertEquals(List.of("d", "a", "c"), cache.keyOrder());
        assertEquals(List.of(4, 1, 3), cache.valueOrder());
        assertEquals(1, cache.evictionCount());
    }

    @Test
    void testKeyOrderSkipsExpired() {
        FakeTicker ticker = new FakeTicker();
        TimedSizedCache<String, Integer> cache = newCache(5, ticker);
        cache.put("a", 1);
        ticker.advance(1, TimeUnit.SECONDS);
        cache.put("b", 2);
        cache.put("c", 3);
        ticker.advance(1, TimeUnit.SECONDS);

        assertEquals(List.of("c", "b"), cache.keyOrder());
        assertEquals(3, cache.size());
    }

    @Test
    void testFlush() {
        FakeTicker ticker = new FakeTicker();
        TimedSizedCache<String, Integer> cache = newCache(5, ticker);
        List<String> expired = new ArrayList<>();
        cache.setRemovalListener((k, v, cause) -> {
            if (cause == RemovalCause.EXPIRED) {
                expired.add(k);
            }
        });
        cache.put("a", 1);
        cache.put("b", 2);
        ticker.advance(1, TimeUnit.SECONDS);
        cache.put("c", 3);
        ticker.advance(1, TimeUnit.SECONDS);

        assertEquals(2, cache.flush());
        assertEquals(1, cache.size());
        assertEquals(2, expired.size());
        assertTrue(expired.containsAll(List.of("a", "b")));
        assertEquals(0, cache.flush());
    }

    @Test
    void testComputeIfAbsentOverwritesExpiredInPlace() {
        FakeTicker ticker = new FakeTicker();
        TimedSizedCache<String, Integer> cache = newCache(2, ticker);
        assertEquals(1, cache.computeIfAbsent("a", k -> 1));
        assertEquals(1, cache.computeIfAbsent("a", k -> 100));

        ticker.advance(3, TimeUnit.SECONDS);
        cache.put("b", 2);
        assertEquals(5, cache.computeIfAbsent("a", k -> 5));

        assertEquals(List.of("a", "b"), cache.keyOrder());
        assertEquals(2, cache.size());
        assertEquals(OptionalLong.of(1), cache.hits());
        assertEquals(OptionalLong.of(2), cache.misses());
        assertEquals(1, cache.evictionCount(), "the replaced entry counts as expired");
    }

    @Test
    void testComputeIfPresentKeepsWriteTime() {
        FakeTicker ticker = new FakeTicker();
        TimedSizedCache<String, Integer> cache = newCache(2, ticker);
        cache.put("a", 1);
        ticker.advance(1, TimeUnit.SECONDS);
        assertEquals(2, cache.computeIfPresent("a", (k, v) -> v + 1));

        ticker.advance(1, TimeUnit.SECONDS);
        assertNull(cache.computeIfPresent("a", (k, v) -> v + 1));
        assertNull(cache.computeIfPresent("missing", (k, v) -> v + 1));
        assertEquals(OptionalLong.of(2), cache.misses());
    }

    @Test
    void testPutRestampsAndReturnsRawPrevious() {
        FakeTicker ticker = new FakeTicker();
        TimedSizedCache<String, Integer> cache = newCache(2, ticker);
        cache.put("a", 1);
        ticker.advance(5, TimeUnit.SECONDS);

        assertEquals(1, cache.put("a", 2));
        assertEquals(2, cache.getIfPresent("a"));
        assertEquals(2, cache.remove("a"));
        assertNull(cache.remove("a"));
    }

    @Test
    void testSetLifespanReinterpretsStoredEntries() {
        FakeTicker ticker = new FakeTicker();
        TimedSizedCache<String, Integer> cache = newCache(2, ticker);
        cache.put("a", 1);
        ticker.advance(3, TimeUnit.SECONDS);
        assertNull(cache.getIfPresent("a"));

        assertEquals(Optional.of(Duration.ofSeconds(2)), cache.setLifespan(Duration.ofSeconds(10)));
        assertEquals(1, cache.getIfPresent("a"));
        assertEquals(Optional.of(Duration.ofSeconds(10)), cache.lifespan());
    }

    @Test
    void testLoaderFailure() {
        FakeTicker ticker = new FakeTicker();
        TimedSizedCache<String, Integer> cache = newCache(1, ticker);
        cache.put("a", 1);

        assertThrows(java.io.IOException.class, () -> cache.get("b", () -> {
            throw new java.io.IOException("unavailable");
        }));
        assertEquals(List.of("a"), cache.keyOrder());
        assertEquals(OptionalLong.of(1), cache.misses());
    }

    @Test
    void testClearAndCapacity() {
        TimedSizedCache<String, Integer> cache =
                TimedSizedCache.withSizeAndLifespan(4, Duration.ofMinutes(1));
        cache.put("a", 1);
        cache.put("b", 2);
        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(OptionalLong.of(4), cache.capacity());

        cache.put("c", 3);
        cache.reset();
        assertEquals(0, cache.size());
        assertThrows(IllegalArgumentException.class,
                () -> TimedSizedCache.withSizeAndLifespan(0, Duration.ofMinutes(1)));
    }
}
