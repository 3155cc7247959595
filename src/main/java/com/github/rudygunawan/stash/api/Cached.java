package com.github.rudygunawan.stash.api;

import com.github.rudygunawan.stash.model.CacheStats;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The operations every in-memory store offers. Entries are added with {@link #put(Object, Object)}
 * or computed on demand, and stay until the store's own policy (capacity, lifespan) or the caller
 * removes them.
 *
 * <p>Implementations are <b>not</b> thread-safe unless stated otherwise. A store shared between
 * threads must be placed behind a lock, for example with
 * {@link com.github.rudygunawan.stash.impl.SynchronizedCache}.
 *
 * <p>Keys and values must not be {@code null}. Absent and expired entries are reported as
 * {@code null} results.
 *
 * @param <K> the type of keys maintained by this store
 * @param <V> the type of mapped values
 */
public interface Cached<K, V> {

    /**
     * Returns the live value associated with {@code key}, or {@code null} if there is none.
     *
     * <p>Counts a hit when a live value is returned and a miss otherwise. Depending on the store,
     * a lookup may refresh the entry's recency or physically remove an expired entry.
     *
     * @param key the key whose associated value is to be returned
     * @return the live value, or {@code null}
     */
    V getIfPresent(K key);

    /**
     * Replaces the live value associated with {@code key} by the result of
     * {@code remappingFunction}, in place.
     *
     * <p>This is the mutable-access counterpart of {@link #getIfPresent}: the lookup is accounted
     * exactly like {@code getIfPresent}, and the entry keeps its timestamp. The function is not
     * invoked when there is no live value.
     *
     * <p><b>Example usage:</b>
     * <pre>{@code
     * // Increment a counter kept in the cache
     * cache.computeIfPresent(key, (k, v) -> v + 1);
     * }</pre>
     *
     * @param key the key whose value is to be updated
     * @param remappingFunction computes the replacement from the current value; must not return
     *        {@code null}
     * @return the new value, or {@code null} if there was no live value
     * @throws NullPointerException if the function returns {@code null}
     */
    V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction);

    /**
     * Returns the live value associated with {@code key}, computing and storing it with
     * {@code mappingFunction} when the key is absent or its entry is no longer valid.
     *
     * <p>The function is invoked at most once per call. A hit is counted only when an existing
     * valid entry is reused.
     *
     * <p><b>Example usage:</b>
     * <pre>{@code
     * User user = cache.computeIfAbsent(userId, id -> database.fetchUser(id));
     * }</pre>
     *
     * @param key the key whose value is to be returned
     * @param mappingFunction computes the value; must not return {@code null}
     * @return the existing or newly computed value
     */
    V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction);

    /**
     * Returns the live value associated with {@code key}, obtaining it from {@code loader} when
     * necessary. Unlike {@link #computeIfAbsent}, the loader may fail: its exception propagates
     * and nothing is stored.
     *
     * @param key the key whose value is to be returned
     * @param loader computes the value
     * @return the existing or newly loaded value
     * @throws Exception if the loader throws an exception
     */
    V get(K key, Callable<? extends V> loader) throws Exception;

    /**
     * Associates {@code value} with {@code key}, replacing any previous value.
     *
     * @param key the key with which the value is to be associated
     * @param value the value to store
     * @return the previous value, or {@code null} if there was none
     */
    V put(K key, V value);

    /**
     * Removes the entry for {@code key}.
     *
     * @param key the key whose mapping is to be removed
     * @return the removed value, or {@code null} if there was none
     */
    V remove(K key);

    /**
     * Discards all entries. Hit and miss counters are kept.
     */
    void clear();

    /**
     * Discards all entries and restores the store's initial capacity hint.
     */
    void reset();

    /**
     * Sets the hit, miss and eviction counters back to zero.
     */
    void resetMetrics();

    /**
     * Returns the number of entries currently held. Depending on the store, this may include
     * entries that are logically expired but not yet removed.
     */
    long size();

    /**
     * Returns the number of hits, if this store counts them.
     */
    default OptionalLong hits() {
        return OptionalLong.empty();
    }

    /**
     * Returns the number of misses, if this store counts them.
     */
    default OptionalLong misses() {
        return OptionalLong.empty();
    }

    /**
     * Returns the maximum number of entries, if this store is capacity bounded.
     */
    default OptionalLong capacity() {
        return OptionalLong.empty();
    }

    /**
     * Returns the lifespan of entries, if this store is time bounded.
     */
    default Optional<Duration> lifespan() {
        return Optional.empty();
    }

    /**
     * Changes the lifespan of entries.
     *
     * @param lifespan the new lifespan
     * @return the previous lifespan, or empty if this store is not time bounded
     */
    default Optional<Duration> setLifespan(Duration lifespan) {
        return Optional.empty();
    }

    /**
     * Returns a snapshot of this store's counters.
     */
    default CacheStats stats() {
        return new CacheStats(hits().orElse(0), misses().orElse(0), 0);
    }
}
