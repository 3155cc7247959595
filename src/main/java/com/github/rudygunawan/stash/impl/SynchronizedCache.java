package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.api.Cached;
import com.github.rudygunawan.stash.metrics.CacheMetrics;
import com.github.rudygunawan.stash.model.CacheStats;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Guards any store with one exclusive lock so it can be shared between threads.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class SynchronizedCache<K, V> implements Cached<K, V>, CacheMetrics {

    private final Cached<K, V> delegate;
    private final ReentrantLock lock = new ReentrantLock();

    public SynchronizedCache(Cached<K, V> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public V getIfPresent(K key) {
        return locked(() -> delegate.getIfPresent(key));
    }

    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
        return locked(() -> delegate.computeIfPresent(key, remappingFunction));
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        return locked(() -> delegate.computeIfAbsent(key, mappingFunction));
    }

    @Override
    public V get(K key, Callable<? extends V> loader) throws Exception {
        lock.lock();
        try {
            return delegate.get(key, loader);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public V put(K key, V value) {
        return locked(() -> delegate.put(key, value));
    }

    @Override
    public V remove(K key) {
        return locked(() -> delegate.remove(key));
    }

    @Override
    public void clear() {
        locked(() -> {
            delegate.clear();
            return null;
        });
    }

    @Override
    public void reset() {
        locked(() -> {
            delegate.reset();
            return null;
        });
    }

    @Override
    public void resetMetrics() {
        locked(() -> {
            delegate.resetMetrics();
            return null;
        });
    }

    @Override
    public long size() {
        return locked(delegate::size);
    }

    @Override
    public OptionalLong hits() {
        return locked(delegate::hits);
    }

    @Override
    public OptionalLong misses() {
        return locked(delegate::misses);
    }

    @Override
    public OptionalLong capacity() {
        return delegate.capacity();
    }

    @Override
    public Optional<Duration> lifespan() {
        return locked(delegate::lifespan);
    }

    @Override
    public Optional<Duration> setLifespan(Duration lifespan) {
        return locked(() -> delegate.setLifespan(lifespan));
    }

    @Override
    public CacheStats stats() {
        return locked(delegate::stats);
    }

    @Override
    public long hitCount() {
        return stats().hitCount();
    }

    @Override
    public long missCount() {
        return stats().missCount();
    }

    @Override
    public long evictionCount() {
        return stats().evictionCount();
    }

    @Override
    public String toString() {
        return "SynchronizedCache{" + locked(delegate::toString) + '}';
    }
}
