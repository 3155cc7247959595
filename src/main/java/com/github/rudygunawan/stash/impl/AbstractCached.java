package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.api.Cached;
import com.github.rudygunawan.stash.listener.RemovalCause;
import com.github.rudygunawan.stash.listener.RemovalListener;
import com.github.rudygunawan.stash.metrics.CacheMetrics;
import com.github.rudygunawan.stash.model.CacheStats;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Counters and removal notification shared by the single-owner stores.
 *
 * <p>Counters are plain fields owned by the store instance: the stores are not thread-safe, so
 * they are only ever updated by the thread that holds the store.
 *
 * <p>Logging: stores use java.util.logging. Logger name: "com.github.rudygunawan.stash.Cache"
 * <ul>
 *   <li>WARNING: Errors in removal listeners (operations continue)</li>
 *   <li>FINE: Evictions and expirations</li>
 *   <li>FINER: Entry-level operations (put, remove)</li>
 * </ul>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
abstract class AbstractCached<K, V> implements Cached<K, V>, CacheMetrics {

    static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.stash.Cache");

    private long hits;
    private long misses;
    private long evictions;

    private RemovalListener<? super K, ? super V> removalListener;

    /**
     * Sets the listener notified of every removal, or {@code null} to stop notifications.
     */
    public void setRemovalListener(RemovalListener<? super K, ? super V> removalListener) {
        this.removalListener = removalListener;
    }

    final boolean hasRemovalListener() {
        return removalListener != null;
    }

    final void recordHit() {
        hits++;
    }

    final void recordMiss() {
        misses++;
    }

    /**
     * Accounts for a removal and forwards it to the listener. Exceptions thrown by the listener
     * are logged and swallowed so the store stays consistent.
     */
    final void notifyRemoval(K key, V value, RemovalCause cause) {
        if (cause.wasEvicted()) {
            evictions++;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Evicted entry: key=" + key + ", cause=" + cause);
            }
        }
        if (removalListener != null) {
            try {
                removalListener.onRemoval(key, value, cause);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "RemovalListener threw exception for key: " + key +
                        ", cause: " + cause, e);
            }
        }
    }

    static <T> T requireValue(T value) {
        return Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public OptionalLong hits() {
        return OptionalLong.of(hits);
    }

    @Override
    public OptionalLong misses() {
        return OptionalLong.of(misses);
    }

    @Override
    public long hitCount() {
        return hits;
    }

    @Override
    public long missCount() {
        return misses;
    }

    @Override
    public long evictionCount() {
        return evictions;
    }

    @Override
    public void resetMetrics() {
        hits = 0;
        misses = 0;
        evictions = 0;
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(hits, misses, evictions);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{size=" + size() + ", " + stats() + '}';
    }
}
