package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.listener.RemovalCause;
import com.github.rudygunawan.stash.model.LookupResult;
import com.github.rudygunawan.stash.time.Ticker;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.logging.Level;

/**
 * A store whose entries expire a fixed lifespan after they were written.
 *
 * <p>Expiration is lazy. There is no background sweeper: an entry that has lived for at least the
 * lifespan is removed when it is next looked up, or by {@link #flush()}. Changing the lifespan
 * applies to stored entries as well, since they keep their write time rather than a deadline.
 *
 * <p>With refresh enabled a hit restamps the entry, so the lifespan becomes a time-to-idle.
 *
 * <p>Instances are not thread-safe.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class TimedCache<K, V> extends AbstractCached<K, V> {
    private static final int UNSET_CAPACITY = -1;

    private final int initialCapacity;
    private final Ticker ticker;
    private HashMap<K, Stamped<V>> store;
    private Duration lifespan;
    private long ttlNanos;
    private boolean refresh;

    /**
     * Creates a store.
     *
     * @param lifespan        time an entry stays valid after its write
     * @param refresh         whether a hit restamps the entry
     * @param initialCapacity expected number of entries, or a negative value for the default
     * @param ticker          the clock used to stamp and age entries
     * @throws IllegalArgumentException if {@code lifespan} is negative
     */
    public TimedCache(Duration lifespan, boolean refresh, int initialCapacity, Ticker ticker) {
        Objects.requireNonNull(lifespan, "lifespan cannot be null");
        this.ttlNanos = Stamped.toTtlNanos(lifespan);
        this.lifespan = lifespan;
        this.refresh = refresh;
        this.initialCapacity = initialCapacity < 0 ? UNSET_CAPACITY : initialCapacity;
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.store = newStore(this.initialCapacity);
    }

    public static <K, V> TimedCache<K, V> withLifespan(Duration lifespan) {
        return new TimedCache<>(lifespan, false, UNSET_CAPACITY, Ticker.systemTicker());
    }

    public static <K, V> TimedCache<K, V> withLifespanAndCapacity(Duration lifespan, int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("initial capacity must not be negative");
        }
        return new TimedCache<>(lifespan, false, capacity, Ticker.systemTicker());
    }

    public static <K, V> TimedCache<K, V> withLifespanAndRefresh(Duration lifespan, boolean refresh) {
        return new TimedCache<>(lifespan, refresh, UNSET_CAPACITY, Ticker.systemTicker());
    }

    private static <K, V> HashMap<K, Stamped<V>> newStore(int capacity) {
        return capacity == UNSET_CAPACITY ? new HashMap<>() : new HashMap<>(capacity);
    }

    /**
     * Returns whether hits restamp their entry.
     */
    public boolean refresh() {
        return refresh;
    }

    /**
     * Sets whether hits restamp their entry.
     *
     * @return the previous setting
     */
    public boolean setRefresh(boolean refresh) {
        boolean previous = this.refresh;
        this.refresh = refresh;
        return previous;
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of removed entries
     */
    public int flush() {
        long now = ticker.read();
        int removed = 0;
        Iterator<Map.Entry<K, Stamped<V>>> it = store.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<K, Stamped<V>> entry = it.next();
            if (!entry.getValue().isLive(now, ttlNanos)) {
                it.remove();
                notifyRemoval(entry.getKey(), entry.getValue().value, RemovalCause.EXPIRED);
                removed++;
            }
        }
        if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Flushed " + removed + " expired entries");
        }
        return removed;
    }

    /**
     * Returns the live entry for {@code key} and counts the lookup. An expired entry is removed.
     */
    private Stamped<V> lookup(K key, long now) {
        Objects.requireNonNull(key, "key cannot be null");
        Stamped<V> stamped = store.get(key);
        if (stamped == null) {
            recordMiss();
            return null;
        }
        if (!stamped.isLive(now, ttlNanos)) {
            store.remove(key);
            notifyRemoval(key, stamped.value, RemovalCause.EXPIRED);
            recordMiss();
            return null;
        }
        recordHit();
        if (refresh) {
            stamped.writtenAt = now;
        }
        return stamped;
    }

    @Override
    public V getIfPresent(K key) {
        Stamped<V> stamped = lookup(key, ticker.read());
        return stamped == null ? null : stamped.value;
    }

    /**
     * Looks up {@code key} like {@link #getIfPresent}, but hands back an expired value instead of
     * discarding it. The expired entry is still removed and the lookup counts as a miss.
     */
    public LookupResult<V> getIfPresentOrExpired(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        long now = ticker.read();
        Stamped<V> stamped = store.get(key);
        if (stamped != null && !stamped.isLive(now, ttlNanos)) {
            store.remove(key);
            notifyRemoval(key, stamped.value, RemovalCause.EXPIRED);
            recordMiss();
            return LookupResult.expired(stamped.value);
        }
        stamped = lookup(key, now);
        return stamped == null ? LookupResult.absent() : LookupResult.live(stamped.value);
    }

    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
        Objects.requireNonNull(remappingFunction, "remappingFunction cannot be null");
        Stamped<V> stamped = lookup(key, ticker.read());
        if (stamped == null) {
            return null;
        }
        stamped.value = requireValue(remappingFunction.apply(key, stamped.value));
        return stamped.value;
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        Objects.requireNonNull(mappingFunction, "mappingFunction cannot be null");
        Stamped<V> stamped = lookup(key, ticker.read());
        if (stamped != null) {
            return stamped.value;
        }
        V value = requireValue(mappingFunction.apply(key));
        store.put(key, new Stamped<>(value, ticker.read()));
        return value;
    }

    @Override
    public V get(K key, Callable<? extends V> loader) throws Exception {
        Objects.requireNonNull(loader, "loader cannot be null");
        Stamped<V> stamped = lookup(key, ticker.read());
        if (stamped != null) {
            return stamped.value;
        }
        V value = requireValue(loader.call());
        store.put(key, new Stamped<>(value, ticker.read()));
        return value;
    }

    /**
     * {@inheritDoc}
     *
     * <p>The previous value is returned even if it had already expired.
     */
    @Override
    public V put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        requireValue(value);
        Stamped<V> old = store.put(key, new Stamped<>(value, ticker.read()));
        if (old == null) {
            return null;
        }
        notifyRemoval(key, old.value, RemovalCause.REPLACED);
        return old.value;
    }

    @Override
    public V remove(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        Stamped<V> old = store.remove(key);
        if (old == null) {
            return null;
        }
        notifyRemoval(key, old.value, RemovalCause.EXPLICIT);
        return old.value;
    }

    @Override
    public void clear() {
        if (hasRemovalListener()) {
            for (Map.Entry<K, Stamped<V>> entry : store.entrySet()) {
                notifyRemoval(entry.getKey(), entry.getValue().value, RemovalCause.EXPLICIT);
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

    @Override
    public Optional<Duration> lifespan() {
        return Optional.of(lifespan);
    }

    @Override
    public Optional<Duration> setLifespan(Duration lifespan) {
        Objects.requireNonNull(lifespan, "lifespan cannot be null");
        long nanos = Stamped.toTtlNanos(lifespan);
        Duration previous = this.lifespan;
        this.lifespan = lifespan;
        this.ttlNanos = nanos;
        return Optional.of(previous);
    }
}
