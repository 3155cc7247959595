package com.github.rudygunawan.stash.api;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The operations of a store that delegates durability to an external engine (a remote key/value
 * server, an embedded disk store). Every operation may fail with a
 * {@link CacheBackendException}; absent and expired entries are still {@code null} results.
 *
 * <p>Unlike {@link Cached}, implementations are expected to be safe for concurrent use: atomicity
 * is whatever the engine provides for single-key operations.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public interface IoCached<K, V> {

    /**
     * Returns the value associated with {@code key} if present and not expired.
     *
     * @throws CacheBackendException if the engine cannot be read
     */
    V get(K key);

    /**
     * Stores {@code value} under {@code key}.
     *
     * @return the previous value, only if it had not already expired
     * @throws CacheBackendException if the engine cannot be written
     */
    V put(K key, V value);

    /**
     * Removes the entry for {@code key}, expired or not.
     *
     * @return the removed value, or {@code null}
     * @throws CacheBackendException if the engine cannot be written
     */
    V remove(K key);

    /**
     * Returns the lifespan applied to entries, if any.
     */
    Optional<Duration> lifespan();

    /**
     * Changes the lifespan applied to entries.
     *
     * @return the previous lifespan, if any
     */
    Optional<Duration> setLifespan(Duration lifespan);

    /**
     * Returns whether a successful {@link #get} extends the entry's lifetime.
     */
    boolean refresh();

    /**
     * Sets whether a successful {@link #get} extends the entry's lifetime.
     *
     * @return the previous setting
     */
    boolean setRefresh(boolean refresh);

    /**
     * Returns the number of hits, if counted.
     */
    default OptionalLong hits() {
        return OptionalLong.empty();
    }

    /**
     * Returns the number of misses, if counted.
     */
    default OptionalLong misses() {
        return OptionalLong.empty();
    }
}
