package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.listener.RemovalCause;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;

/**
 * A capacity-bounded store that evicts the least recently used entry when a new key arrives at
 * capacity.
 *
 * <p>Recency is kept in an {@link ArenaList}: the lookup map holds the arena index of each key, so
 * a hit is a single {@code moveToFront} and an eviction a single {@code remove(back())}.
 *
 * <p>Reads refresh recency. Writes to an existing key replace its value in place and leave its
 * position alone unless the store was created with {@code refreshRecencyOnWrite}. A workload that
 * rewrites a key on every request therefore does not keep that key alive on its own.
 *
 * <p>Instances are not thread-safe; wrap them in a {@link SynchronizedCache} to share one.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class SizedCache<K, V> extends AbstractCached<K, V> {

    private final int capacity;
    private final boolean refreshRecencyOnWrite;
    private final HashMap<K, Integer> index;
    private ArenaList<Node<K, V>> order;

    static final class Node<K, V> {
        final K key;
        final V value;

        Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    /**
     * The result of a guarded lookup: the value now stored and whether it was an existing valid
     * entry rather than a freshly loaded one.
     */
    static final class Lookup<V> {
        final V value;
        final boolean reused;

        Lookup(V value, boolean reused) {
            this.value = value;
            this.reused = reused;
        }
    }

    /**
     * Supplies a replacement value for a guarded lookup.
     */
    @FunctionalInterface
    interface ValueLoader<V, E extends Exception> {
        V load() throws E;
    }

    SizedCache(int capacity, boolean refreshRecencyOnWrite) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be greater than zero, was " + capacity);
        }
        this.capacity = capacity;
        this.refreshRecencyOnWrite = refreshRecencyOnWrite;
        this.index = new HashMap<>(capacity);
        this.order = new ArenaList<>(capacity);
    }

    /**
     * Creates a store holding at most {@code size} entries. Writes do not refresh recency.
     *
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public static <K, V> SizedCache<K, V> withSize(int size) {
        return new SizedCache<>(size, false);
    }

    /**
     * Creates a store holding at most {@code size} entries.
     *
     * @param refreshRecencyOnWrite whether {@link #put} on an existing key marks it as most
     *                              recently used
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public static <K, V> SizedCache<K, V> withSize(int size, boolean refreshRecencyOnWrite) {
        return new SizedCache<>(size, refreshRecencyOnWrite);
    }

    // ---- guarded access used by the composed stores ----

    /**
     * Returns the value for {@code key} when it is present and {@code valid} accepts it, marking
     * it as most recently used. Counters are left to the caller.
     */
    V getIf(K key, Predicate<? super V> valid) {
        Objects.requireNonNull(key, "key cannot be null");
        Integer slot = index.get(key);
        if (slot == null) {
            return null;
        }
        V value = order.get(slot).value;
        if (!valid.test(value)) {
            return null;
        }
        order.moveToFront(slot);
        return value;
    }

    /**
     * Replaces the value for {@code key} with the result of {@code remapping} when it is present
     * and valid. The position is updated exactly as {@link #getIf} does.
     *
     * @return the new value, or {@code null} when the entry is absent or invalid
     */
    V computeIf(K key, Predicate<? super V> valid, Function<? super V, ? extends V> remapping) {
        Objects.requireNonNull(key, "key cannot be null");
        Integer slot = index.get(key);
        if (slot == null) {
            return null;
        }
        Node<K, V> node = order.get(slot);
        if (!valid.test(node.value)) {
            return null;
        }
        order.moveToFront(slot);
        V value = requireValue(remapping.apply(node.value));
        order.set(slot, new Node<>(key, value));
        return value;
    }

    /**
     * Returns the valid value for {@code key} or loads, stores and returns a new one. An entry
     * that is present but invalid is overwritten in place and reported as expired. Nothing is
     * changed when the loader fails.
     */
    <E extends Exception> Lookup<V> getOrLoadIf(K key, Predicate<? super V> valid,
                                                ValueLoader<? extends V, E> loader) throws E {
        Objects.requireNonNull(key, "key cannot be null");
        Integer slot = index.get(key);
        if (slot != null) {
            Node<K, V> node = order.get(slot);
            if (valid.test(node.value)) {
                order.moveToFront(slot);
                return new Lookup<>(node.value, true);
            }
            V loaded = requireValue(loader.load());
            order.set(slot, new Node<>(key, loaded));
            order.moveToFront(slot);
            notifyRemoval(key, node.value, RemovalCause.EXPIRED);
            return new Lookup<>(loaded, false);
        }
        V loaded = requireValue(loader.load());
        insertNew(key, loaded);
        return new Lookup<>(loaded, false);
    }

    /**
     * Returns the value for {@code key} without touching recency or counters.
     */
    V peek(K key) {
        Integer slot = index.get(key);
        return slot == null ? null : order.get(slot).value;
    }

    /**
     * Passes each entry to {@code action}, from the most to the least recently used.
     */
    void forEachInOrder(BiConsumer<? super K, ? super V> action) {
        for (int slot = order.front(); slot != ArenaList.OCCUPIED; slot = order.after(slot)) {
            Node<K, V> node = order.get(slot);
            action.accept(node.key, node.value);
        }
    }

    /**
     * Removes {@code key} and reports the removal with {@code cause}.
     */
    V invalidate(K key, RemovalCause cause) {
        Objects.requireNonNull(key, "key cannot be null");
        Integer slot = index.remove(key);
        if (slot == null) {
            return null;
        }
        V value = order.remove(slot).value;
        notifyRemoval(key, value, cause);
        return value;
    }

    /**
     * Removes every entry for which {@code keep} returns false and reports each removal with
     * {@code cause}.
     *
     * @return the number of removed entries
     */
    int removeUnless(BiPredicate<? super K, ? super V> keep, RemovalCause cause) {
        List<Node<K, V>> doomed = new ArrayList<>();
        for (Node<K, V> node : order) {
            if (!keep.test(node.key, node.value)) {
                doomed.add(node);
            }
        }
        for (Node<K, V> node : doomed) {
            order.remove(index.remove(node.key));
            notifyRemoval(node.key, node.value, cause);
        }
        return doomed.size();
    }

    private void insertNew(K key, V value) {
        if (order.size() >= capacity) {
            evictLeastRecentlyUsed();
        }
        index.put(key, order.pushFront(new Node<>(key, value)));
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer("Put entry: key=" + key);
        }
    }

    private void evictLeastRecentlyUsed() {
        Node<K, V> victim = order.remove(order.back());
        index.remove(victim.key);
        notifyRemoval(victim.key, victim.value, RemovalCause.SIZE);
    }

    // ---- Cached ----

    @Override
    public V getIfPresent(K key) {
        V value = getIf(key, v -> true);
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
        V value = computeIf(key, v -> true, v -> remappingFunction.apply(key, v));
        if (value == null) {
            recordMiss();
        } else {
            recordHit();
        }
        return value;
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        Objects.requireNonNull(mappingFunction, "mappingFunction cannot be null");
        Lookup<V> lookup = getOrLoadIf(key, v -> true, () -> mappingFunction.apply(key));
        countLookup(lookup);
        return lookup.value;
    }

    @Override
    public V get(K key, Callable<? extends V> loader) throws Exception {
        Objects.requireNonNull(loader, "loader cannot be null");
        Integer slot = index.get(Objects.requireNonNull(key, "key cannot be null"));
        if (slot == null) {
            // the miss stands even when the loader fails
            recordMiss();
            V loaded = requireValue(loader.call());
            insertNew(key, loaded);
            return loaded;
        }
        recordHit();
        order.moveToFront(slot);
        return order.get(slot).value;
    }

    private void countLookup(Lookup<V> lookup) {
        if (lookup.reused) {
            recordHit();
        } else {
            recordMiss();
        }
    }

    @Override
    public V put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        requireValue(value);
        Integer slot = index.get(key);
        if (slot == null) {
            insertNew(key, value);
            return null;
        }
        V old = order.set(slot, new Node<>(key, value)).value;
        if (refreshRecencyOnWrite) {
            order.moveToFront(slot);
        }
        notifyRemoval(key, old, RemovalCause.REPLACED);
        return old;
    }

    @Override
    public V remove(K key) {
        return invalidate(key, RemovalCause.EXPLICIT);
    }

    @Override
    public void clear() {
        if (hasRemovalListener()) {
            for (Node<K, V> node : order) {
                notifyRemoval(node.key, node.value, RemovalCause.EXPLICIT);
            }
        }
        index.clear();
        order.clear();
    }

    @Override
    public void reset() {
        clear();
        order = new ArenaList<>(capacity);
    }

    @Override
    public long size() {
        return index.size();
    }

    @Override
    public OptionalLong capacity() {
        return OptionalLong.of(capacity);
    }

    /**
     * Returns whether writes to an existing key refresh its recency.
     */
    public boolean refreshesRecencyOnWrite() {
        return refreshRecencyOnWrite;
    }

    /**
     * Returns the keys from the most to the least recently used.
     */
    public List<K> keyOrder() {
        List<K> keys = new ArrayList<>(order.size());
        forEachInOrder((key, value) -> keys.add(key));
        return keys;
    }

    /**
     * Returns the values from the most to the least recently used.
     */
    public List<V> valueOrder() {
        List<V> values = new ArrayList<>(order.size());
        forEachInOrder((key, value) -> values.add(value));
        return values;
    }

    /**
     * Removes every entry for which {@code keep} returns false.
     *
     * @return the number of removed entries
     */
    public int retain(BiPredicate<? super K, ? super V> keep) {
        Objects.requireNonNull(keep, "keep cannot be null");
        return removeUnless(keep, RemovalCause.EXPLICIT);
    }
}
