package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.listener.RemovalCause;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class SizedCacheTest {

    @Test
    void testEvictsLeastRecentlyUsed() {
        SizedCache<Integer, Integer> cache = SizedCache.withSize(5);
        assertNull(cache.getIfPresent(1));
        assertEquals(OptionalLong.of(1), cache.misses());

        assertNull(cache.put(1, 100));
        assertNotNull(cache.getIfPresent(1));
        assertEquals(OptionalLong.of(1), cache.hits());
        assertEquals(OptionalLong.of(1), cache.misses());

        for (int key = 2; key <= 5; key++) {
            assertNull(cache.put(key, 100));
        }
        assertEquals(List.of(5, 4, 3, 2, 1), cache.keyOrder());

        assertNull(cache.put(6, 100));
        assertNull(cache.put(7, 100));
        assertEquals(List.of(7, 6, 5, 4, 3), cache.keyOrder());

        assertNull(cache.getIfPresent(2));
        assertNotNull(cache.getIfPresent(3));
        assertEquals(List.of(3, 7, 6, 5, 4), cache.keyOrder());

        assertEquals(OptionalLong.of(2), cache.misses());
        assertEquals(5, cache.size());
        assertEquals(2, cache.evictionCount());
    }

    @Test
    void testReadRefreshesRecency() {
        SizedCache<Integer, String> cache = SizedCache.withSize(5);
        for (int key = 1; key <= 5; key++) {
            cache.put(key, "v" + key);
        }
        cache.getIfPresent(3);
        cache.put(6, "v6");
        cache.put(7, "v7");

        assertEquals(List.of(7, 6, 3, 5, 4), cache.keyOrder());
        assertNull(cache.getIfPresent(1));
        assertNull(cache.getIfPresent(2));
    }

    @Test
    void testWriteDoesNotRefreshRecencyByDefault() {
        SizedCache<String, Integer> cache = SizedCache.withSize(2);
        cache.put("a", 1);
        cache.put("b", 2);
        assertEquals(1, cache.put("a", 10));
        assertEquals(List.of("b", "a"), cache.keyOrder());

        cache.put("c", 3);
        assertNull(cache.getIfPresent("a"), "rewritten key is still the eldest");
        assertEquals(List.of("c", "b"), cache.keyOrder());
    }

    @Test
    void testWriteRefreshesRecencyWhenConfigured() {
        SizedCache<String, Integer> cache = SizedCache.withSize(2, true);
        assertTrue(cache.refreshesRecencyOnWrite());
        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("a", 10);
        assertEquals(List.of("a", "b"), cache.keyOrder());

        cache.put("c", 3);
        assertEquals(10, cache.getIfPresent("a"));
        assertNull(cache.getIfPresent("b"));
    }

    @Test
    void testRacingKeysDoNotDuplicateOrder() {
        SizedCache<Integer, Integer> cache = SizedCache.withSize(2);
        assertNull(cache.put(1, 100));
        assertEquals(100, cache.put(1, 100));
        assertNull(cache.put(2, 100));
        assertNull(cache.put(3, 100));
        assertNull(cache.put(4, 100));
        assertEquals(List.of(4, 3), cache.keyOrder());
        assertEquals(2, cache.size());
    }

    @Test
    void testComputeIfAbsentCountsReuseAsHit() {
        SizedCache<Integer, Integer> cache = SizedCache.withSize(5);
        for (int key = 0; key <= 5; key++) {
            int value = key;
            assertEquals(value, cache.computeIfAbsent(key, k -> value));
        }
        assertEquals(OptionalLong.of(6), cache.misses());

        // 0 was pushed out by 5
        assertEquals(0, cache.computeIfAbsent(0, k -> 0));
        assertEquals(OptionalLong.of(7), cache.misses());

        assertEquals(0, cache.computeIfAbsent(0, k -> 42));
        assertEquals(OptionalLong.of(7), cache.misses());

        // 1 was pushed out by the reload of 0
        assertEquals(1, cache.computeIfAbsent(1, k -> 1));
        assertEquals(OptionalLong.of(8), cache.misses());
    }

    @Test
    void testComputeIfAbsentRefreshesRecency() {
        SizedCache<String, Integer> cache = SizedCache.withSize(2);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.computeIfAbsent("a", k -> 99);
        cache.put("c", 3);

        assertEquals(List.of("c", "a"), cache.keyOrder());
    }

    @Test
    void testLoaderFailureLeavesStoreUntouched() {
        SizedCache<String, Integer> cache = SizedCache.withSize(1);
        cache.put("a", 1);

        assertThrows(IllegalStateException.class, () -> cache.get("b", () -> {
            throw new IllegalStateException("load failed");
        }));
        assertEquals(List.of("a"), cache.keyOrder());
        assertEquals(OptionalLong.of(1), cache.misses());
        assertEquals(0, cache.evictionCount());
    }

    @Test
    void testComputeIfPresent() {
        SizedCache<String, Integer> cache = SizedCache.withSize(3);
        cache.put("a", 1);
        cache.put("b", 2);

        assertEquals(11, cache.computeIfPresent("a", (k, v) -> v + 10));
        assertEquals(List.of("a", "b"), cache.keyOrder());
        assertNull(cache.computeIfPresent("z", (k, v) -> v + 10));
        assertEquals(OptionalLong.of(1), cache.hits());
        assertEquals(OptionalLong.of(1), cache.misses());
    }

    @Test
    void testRemoveFreesSlot() {
        SizedCache<String, Integer> cache = SizedCache.withSize(2);
        cache.put("a", 1);
        cache.put("b", 2);
        assertEquals(1, cache.remove("a"));
        assertNull(cache.remove("a"));

        cache.put("c", 3);
        assertEquals(List.of("c", "b"), cache.keyOrder());
        assertEquals(0, cache.evictionCount());
    }

    @Test
    void testRetain() {
        SizedCache<Integer, Integer> cache = SizedCache.withSize(10);
        for (int i = 0; i < 10; i++) {
            cache.put(i, i * i);
        }
        assertEquals(5, cache.retain((k, v) -> k % 2 == 0));
        assertEquals(List.of(8, 6, 4, 2, 0), cache.keyOrder());
        assertEquals(List.of(64, 36, 16, 4, 0), cache.valueOrder());
    }

    @Test
    void testClearAndReset() {
        SizedCache<Integer, Integer> cache = SizedCache.withSize(3);
        cache.put(1, 1);
        cache.put(2, 2);
        cache.getIfPresent(1);

        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(List.of(), cache.keyOrder());
        assertEquals(OptionalLong.of(1), cache.hits());

        cache.put(3, 3);
        cache.reset();
        assertEquals(0, cache.size());
        for (int i = 0; i < 5; i++) {
            cache.put(i, i);
        }
        assertEquals(List.of(4, 3, 2), cache.keyOrder());
    }

    @Test
    void testCapacity() {
        assertEquals(OptionalLong.of(3), SizedCache.withSize(3).capacity());
        assertThrows(IllegalArgumentException.class, () -> SizedCache.withSize(0));
        assertThrows(IllegalArgumentException.class, () -> SizedCache.withSize(-5));
    }

    @Test
    void testSizeNeverExceedsCapacity() {
        SizedCache<Integer, Integer> cache = SizedCache.withSize(7);
        for (int i = 0; i < 1_000; i++) {
            cache.put(i % 31, i);
            if (i % 3 == 0) {
                cache.getIfPresent(i % 17);
            }
            assertTrue(cache.size() <= 7);
        }
        assertEquals(7, cache.keyOrder().size());
    }

    @Test
    void testEvictionNotifiesListener() {
        SizedCache<String, Integer> cache = SizedCache.withSize(1);
        List<String> evicted = new ArrayList<>();
        cache.setRemovalListener((k, v, cause) -> {
            if (cause == RemovalCause.SIZE) {
                evicted.add(k + "=" + v);
            }
        });
        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("c", 3);
        assertEquals(List.of("a=1", "b=2"), evicted);
        assertEquals(2, cache.stats().evictionCount());
    }
}
