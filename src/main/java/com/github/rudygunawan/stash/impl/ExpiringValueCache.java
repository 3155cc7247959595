package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.api.CanExpire;
import com.github.rudygunawan.stash.listener.RemovalCause;
import com.github.rudygunawan.stash.model.LookupResult;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * An LRU store for values that know when they are stale, such as tokens carrying their own
 * deadline.
 *
 * <p>An expired value is a miss and is removed when it is looked up.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class ExpiringValueCache<K, V extends CanExpire> extends AbstractCached<K, V> {

    private final SizedCache<K, V> store;

    ExpiringValueCache(int size, boolean refreshRecencyOnWrite) {
        this.store = new SizedCache<>(size, refreshRecencyOnWrite);
        this.store.setRemovalListener(this::notifyRemoval);
    }

    /**
     * Creates a store holding at most {@code size} values.
     *
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public static <K, V extends CanExpire> ExpiringValueCache<K, V> withSize(int size) {
        return new ExpiringValueCache<>(size, false);
    }

    /**
     * Creates a store holding at most {@code size} values.
     *
     * @param refreshRecencyOnWrite whether {@link #put} on an existing key marks it as most
     *                              recently used
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public static <K, V extends CanExpire> ExpiringValueCache<K, V> withSize(int size,
                                                                           boolean refreshRecencyOnWrite) {
        return new ExpiringValueCache<>(size, refreshRecencyOnWrite);
    }

    /**
     * Returns whether the stored value for {@code key} can be served, dropping it when it has
     * expired. Counts a miss when it cannot.
     */
    private boolean servable(K key) {
        V current = store.peek(Objects.requireNonNull(key, "key cannot be null"));
        if (current == null) {
            recordMiss();
            return false;
        }
        if (current.isExpired()) {
            store.invalidate(key, RemovalCause.EXPIRED);
            recordMiss();
            return false;
        }
        recordHit();
        return true;
    }

    private <E extends Exception> V load(K key, SizedCache.ValueLoader<? extends V, E> loader) throws E {
        SizedCache.Lookup<V> lookup = store.getOrLoadIf(key, value -> !value.isExpired(), () -> {
            recordMiss();
            return loader.load();
        });
        if (lookup.reused) {
            recordHit();
        }
        return lookup.value;
    }

    @Override
    public V getIfPresent(K key) {
        return servable(key) ? store.getIf(key, value -> true) : null;
    }

    /**
     * Looks up {@code key} like {@link #getIfPresent}, but hands back an expired value instead of
     * discarding it. The expired value is still removed and the lookup counts as a miss.
     */
    public LookupResult<V> getIfPresentOrExpired(K key) {
        V current = store.peek(Objects.requireNonNull(key, "key cannot be null"));
        if (current != null && current.isExpired()) {
            store.invalidate(key, RemovalCause.EXPIRED);
            recordMiss();
            return LookupResult.expired(current);
        }
        V value = getIfPresent(key);
        return value == null ? LookupResult.absent() : LookupResult.live(value);
    }

    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
        Objects.requireNonNull(remappingFunction, "remappingFunction cannot be null");
        if (!servable(key)) {
            return null;
        }
        return store.computeIf(key, value -> true, value -> remappingFunction.apply(key, value));
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        Objects.requireNonNull(mappingFunction, "mappingFunction cannot be null");
        return load(key, () -> mappingFunction.apply(key));
    }

    @Override
    public V get(K key, Callable<? extends V> loader) throws Exception {
        Objects.requireNonNull(loader, "loader cannot be null");
        return load(key, loader::call);
    }

    @Override
    public V put(K key, V value) {
        return store.put(key, value);
    }

    @Override
    public V remove(K key) {
        return store.remove(key);
    }

    @Override
    public void clear() {
        store.clear();
    }

    @Override
    public void reset() {
        store.reset();
    }

    @Override
    public long size() {
        return store.size();
    }

    @Override
    public OptionalLong capacity() {
        return store.capacity();
    }

    /**
     * Removes every expired value.
     *
     * @return the number of removed values
     */
    public int flush() {
        return store.removeUnless((key, value) -> !value.isExpired(), RemovalCause.EXPIRED);
    }
}
