package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.api.Cached;
import com.github.rudygunawan.stash.listener.RemovalListener;
import com.github.rudygunawan.stash.metrics.CacheMetrics;
import com.github.rudygunawan.stash.model.CacheStats;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Shares an {@link ExpiringSizedCache} between threads.
 *
 * <p>Lookups take the read lock and run in parallel; every operation that changes the map or the
 * stamp queue takes the write lock. Operations that may load a value hold the write lock while
 * the loader runs, so a key is loaded at most once at a time.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class ConcurrentExpiringCache<K, V> implements Cached<K, V>, CacheMetrics {

    private final ExpiringSizedCache<K, V> delegate;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public ConcurrentExpiringCache(ExpiringSizedCache<K, V> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
    }

    public static <K, V> ConcurrentExpiringCache<K, V> withLifespan(Duration lifespan) {
        return new ConcurrentExpiringCache<>(ExpiringSizedCache.withLifespan(lifespan));
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public V getIfPresent(K key) {
        return read(() -> delegate.getIfPresent(key));
    }

    /**
     * Read-locked fast path for the loading operations. Only a hit is recorded here; on a miss
     * the delegate repeats the lookup under the write lock and records the outcome itself.
     */
    private V peekLive(K key) {
        return read(() -> {
            V value = delegate.peekLive(key);
            if (value != null) {
                delegate.recordHit();
            }
            return value;
        });
    }

    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
        return write(() -> delegate.computeIfPresent(key, remappingFunction));
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        V existing = peekLive(key);
        if (existing != null) {
            return existing;
        }
        return write(() -> delegate.computeIfAbsent(key, mappingFunction));
    }

    @Override
    public V get(K key, Callable<? extends V> loader) throws Exception {
        V existing = peekLive(key);
        if (existing != null) {
            return existing;
        }
        lock.writeLock().lock();
        try {
            return delegate.get(key, loader);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public V put(K key, V value) {
        return write(() -> delegate.insert(key, value));
    }

    /**
     * @see ExpiringSizedCache#insert(Object, Object)
     */
    public V insert(K key, V value) {
        return write(() -> delegate.insert(key, value));
    }

    /**
     * @see ExpiringSizedCache#insertEvict(Object, Object, boolean)
     */
    public V insertEvict(K key, V value, boolean evict) {
        return write(() -> delegate.insertEvict(key, value, evict));
    }

    /**
     * @see ExpiringSizedCache#evict()
     */
    public int evict() {
        return write(delegate::evict);
    }

    /**
     * @see ExpiringSizedCache#retainLatest(int, boolean)
     */
    public int retainLatest(int count, boolean evict) {
        return write(() -> delegate.retainLatest(count, evict));
    }

    @Override
    public V remove(K key) {
        return write(() -> delegate.remove(key));
    }

    @Override
    public void clear() {
        write(() -> {
            delegate.clear();
            return null;
        });
    }

    @Override
    public void reset() {
        write(() -> {
            delegate.reset();
            return null;
        });
    }

    @Override
    public void resetMetrics() {
        delegate.resetMetrics();
    }

    public OptionalInt sizeLimit(int size) {
        return write(() -> delegate.sizeLimit(size));
    }

    public void reserve(int more) {
        write(() -> {
            delegate.reserve(more);
            return null;
        });
    }

    public void setRemovalListener(RemovalListener<? super K, ? super V> removalListener) {
        write(() -> {
            delegate.setRemovalListener(removalListener);
            return null;
        });
    }

    public int tombstoneCount() {
        return read(delegate::tombstoneCount);
    }

    @Override
    public long size() {
        return read(delegate::size);
    }

    @Override
    public OptionalLong capacity() {
        return read(delegate::capacity);
    }

    @Override
    public Optional<Duration> lifespan() {
        return delegate.lifespan();
    }

    @Override
    public Optional<Duration> setLifespan(Duration lifespan) {
        return delegate.setLifespan(lifespan);
    }

    @Override
    public OptionalLong hits() {
        return delegate.hits();
    }

    @Override
    public OptionalLong misses() {
        return delegate.misses();
    }

    @Override
    public long hitCount() {
        return delegate.hitCount();
    }

    @Override
    public long missCount() {
        return delegate.missCount();
    }

    @Override
    public long evictionCount() {
        return delegate.evictionCount();
    }

    @Override
    public CacheStats stats() {
        return delegate.stats();
    }

    @Override
    public String toString() {
        return read(delegate::toString);
    }
}
