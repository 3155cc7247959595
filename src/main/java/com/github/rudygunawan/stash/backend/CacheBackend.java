package com.github.rudygunawan.stash.backend;

import com.github.rudygunawan.stash.api.CacheBackendException;

/**
 * The storage engine behind a {@link BackendCache}: a remote key/value server, an embedded disk
 * store or anything else that can keep a {@link StoredValue} per key.
 *
 * <p>Implementations own their wire and storage formats. They must be safe for concurrent use and
 * report every engine failure as a {@link CacheBackendException} carrying the engine's exception
 * as its cause.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public interface CacheBackend<K, V> {

    /**
     * Returns the record stored under {@code key}, or {@code null}.
     *
     * @throws CacheBackendException if the engine cannot be read
     */
    StoredValue<V> get(K key);

    /**
     * Stores {@code value} under {@code key}.
     *
     * @return the record it replaced, or {@code null}
     * @throws CacheBackendException if the engine cannot be written
     */
    StoredValue<V> put(K key, StoredValue<V> value);

    /**
     * Deletes the record stored under {@code key}.
     *
     * @return the deleted record, or {@code null}
     * @throws CacheBackendException if the engine cannot be written
     */
    StoredValue<V> remove(K key);

    /**
     * Returns a snapshot of the stored keys.
     *
     * @throws CacheBackendException if the engine cannot be read
     */
    Iterable<K> keys();
}
