package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.time.FakeTicker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentExpiringCacheTest {

    private static ConcurrentExpiringCache<Integer, String> newCache(FakeTicker ticker) {
        return new ConcurrentExpiringCache<>(
                new ExpiringSizedCache<>(Duration.ofSeconds(1), 64, 8, ticker));
    }

    @Test
    void testConcurrentReadersAndWriters() throws Exception {
        FakeTicker ticker = new FakeTicker();
        ConcurrentExpiringCache<Integer, String> cache = newCache(ticker);
        cache.sizeLimit(50);

        int numThreads = 8;
        int numOperations = 2_000;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        for (int t = 0; t < numThreads; t++) {
            int thread = t;
            executor.submit(() -> {
                try {
                    for (int j = 0; j < numOperations; j++) {
                        int key = (j * 7 + thread) % 100;
                        if (thread % 2 == 0) {
                            cache.insert(key, "value_" + key);
                        } else {
                            String value = cache.getIfPresent(key);
                            if (value != null && !value.equals("value_" + key)) {
                                failures.add(new AssertionError("wrong value for " + key + ": " + value));
                            }
                        }
                        if (j % 500 == 0) {
                            ticker.advance(10, TimeUnit.MILLISECONDS);
                            cache.evict();
                        }
                    }
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(List.of(), failures);
        assertTrue(cache.size() <= 50, "size was " + cache.size());
        assertTrue(cache.tombstoneCount() <= 8);
        assertEquals(numThreads / 2 * numOperations, cache.hitCount() + cache.missCount());
    }

    @Test
    void testLoaderRunsOncePerKey() throws Exception {
        ConcurrentExpiringCache<Integer, String> cache = newCache(new FakeTicker());
        AtomicInteger loadCount = new AtomicInteger();

        int numThreads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch latch = new CountDownLatch(numThreads);
        List<Throwable> failures = new CopyOnWriteArrayList<>();

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    for (int j = 0; j < 100; j++) {
                        int key = j % 10;
                        String value = cache.computeIfAbsent(key, k -> {
                            loadCount.incrementAndGet();
                            return "value_" + k;
                        });
                        assertEquals("value_" + key, value);
                    }
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    latch.countDown();
                }
            });
        }

        assertTrue(latch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(List.of(), failures);
        assertEquals(10, loadCount.get());
        assertEquals(10, cache.size());
        assertEquals(10, cache.missCount());
        assertEquals(numThreads * 100, cache.hitCount() + cache.missCount());
    }

    @Test
    void testDelegatesStoreOperations() throws Exception {
        FakeTicker ticker = new FakeTicker();
        ConcurrentExpiringCache<Integer, String> cache = newCache(ticker);
        assertNull(cache.put(1, "a"));
        assertEquals("a", cache.insertEvict(1, "b", true));
        assertEquals("b", cache.get(1, () -> "c"));
        assertEquals("c2", cache.get(2, () -> "c2"));
        assertEquals("b!", cache.computeIfPresent(1, (k, v) -> v + "!"));

        ticker.advance(2, TimeUnit.SECONDS);
        assertNull(cache.getIfPresent(1));
        assertEquals(2, cache.size());
        assertEquals(2, cache.evict());
        assertEquals(0, cache.size());

        cache.insert(3, "x");
        cache.insert(4, "y");
        assertEquals(1, cache.retainLatest(1, false));
        assertEquals("y", cache.remove(4));
        cache.reserve(10);
        cache.clear();
        assertEquals(0, cache.size());
        cache.reset();
        assertEquals(Duration.ofSeconds(1), cache.lifespan().orElseThrow());
        assertThrows(UnsupportedOperationException.class, () -> cache.setLifespan(Duration.ZERO));
    }

    @Test
    void testLoadCountsSingleMiss() throws Exception {
        ConcurrentExpiringCache<Integer, String> cache = newCache(new FakeTicker());
        assertEquals("a", cache.computeIfAbsent(1, k -> "a"));
        assertEquals(1, cache.missCount());
        assertEquals(0, cache.hitCount());

        assertEquals("b", cache.get(2, () -> "b"));
        assertEquals(2, cache.missCount());

        assertEquals("a", cache.computeIfAbsent(1, k -> "x"));
        assertEquals("b", cache.get(2, () -> "x"));
        assertEquals(2, cache.hitCount());
        assertEquals(2, cache.missCount());
    }
}
