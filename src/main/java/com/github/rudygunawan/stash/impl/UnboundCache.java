package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.listener.RemovalCause;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A store with no size limit and no expiry: a {@link HashMap} with hit and miss accounting.
 *
 * <p>Entries stay until they are removed or the store is cleared.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class UnboundCache<K, V> extends AbstractCached<K, V> {
    private static final int UNSET_CAPACITY = -1;

    private final int initialCapacity;
    private HashMap<K, V> store;

    /**
     * Creates an empty store.
     */
    public UnboundCache() {
        this(UNSET_CAPACITY);
    }

    private UnboundCache(int initialCapacity) {
        this.initialCapacity = initialCapacity;
        this.store = newStore(initialCapacity);
    }

    /**
     * Creates an empty store pre-sized for {@code capacity} entries. The capacity is only a
     * hint; the store still grows without limit.
     *
     * @throws IllegalArgumentException if {@code capacity} is negative
     */
    public static <K, V> UnboundCache<K, V> withCapacity(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("initial capacity must not be negative");
        }
        return new UnboundCache<>(capacity);
    }

    private static <K, V> HashMap<K, V> newStore(int capacity) {
        return capacity == UNSET_CAPACITY ? new HashMap<>() : new HashMap<>(capacity);
    }

    @Override
    public V getIfPresent(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        V value = store.get(key);
        if (value == null) {
            recordMiss();
        } else {
            recordHit();
        }
        return value;
    }

    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
        Objects.requireNonNull(remappingFunction, "remappingFunction cannot be null");
        V current = getIfPresent(key);
        if (current == null) {
            return null;
        }
        V updated = requireValue(remappingFunction.apply(key, current));
        store.put(key, updated);
        return updated;
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(mappingFunction, "mappingFunction cannot be null");
        V existing = store.get(key);
        if (existing != null) {
            recordHit();
            return existing;
        }
        recordMiss();
        V value = requireValue(mappingFunction.apply(key));
        store.put(key, value);
        return value;
    }

    @Override
    public V get(K key, Callable<? extends V> loader) throws Exception {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(loader, "loader cannot be null");
        V existing = store.get(key);
        if (existing != null) {
            recordHit();
            return existing;
        }
        recordMiss();
        V value = requireValue(loader.call());
        store.put(key, value);
        return value;
    }

    @Override
    public V put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        requireValue(value);
        V old = store.put(key, value);
        if (old != null) {
            notifyRemoval(key, old, RemovalCause.REPLACED);
        }
        return old;
    }

    @Override
    public V remove(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        V old = store.remove(key);
        if (old != null) {
            notifyRemoval(key, old, RemovalCause.EXPLICIT);
        }
        return old;
    }

    @Override
    public void clear() {
        if (hasRemovalListener()) {
            for (Map.Entry<K, V> entry : store.entrySet()) {
                notifyRemoval(entry.getKey(), entry.getValue(), RemovalCause.EXPLICIT);
            }
        }
        store.clear();
    }

    @Override
    public void reset() {
        clear();
        store = newStore(initialCapacity);
    }

    @Override
    public long size() {
        return store.size();
    }
}
