package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.listener.RemovalCause;
import com.github.rudygunawan.stash.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An LRU store whose entries also expire a fixed lifespan after they were written.
 *
 * <p>An expired entry is reported as a miss but stays in place: it still occupies a slot until it
 * is pushed out by capacity pressure, overwritten, cleared or {@linkplain #flush() flushed}. Use
 * {@link TimedCache} when expired entries should be dropped on lookup.
 *
 * <p>Reads do not restamp entries. Instances are not thread-safe.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class TimedSizedCache<K, V> extends AbstractCached<K, V> {

    private final SizedCache<K, Stamped<V>> store;
    private final Ticker ticker;
    private Duration lifespan;
    private long ttlNanos;

    /**
     * Creates a store.
     *
     * @param size                  maximum number of entries
     * @param lifespan              time an entry stays valid after its write
     * @param refreshRecencyOnWrite whether {@link #put} on an existing key marks it as most
     *                              recently used
     * @param ticker                the clock used to stamp and age entries
     * @throws IllegalArgumentException if {@code size} is not positive or {@code lifespan} is
     *                                  negative
     */
    public TimedSizedCache(int size, Duration lifespan, boolean refreshRecencyOnWrite, Ticker ticker) {
        Objects.requireNonNull(lifespan, "lifespan cannot be null");
        this.ttlNanos = Stamped.toTtlNanos(lifespan);
        this.lifespan = lifespan;
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.store = new SizedCache<>(size, refreshRecencyOnWrite);
        this.store.setRemovalListener((key, stamped, cause) -> notifyRemoval(key, stamped.value, cause));
    }

    public static <K, V> TimedSizedCache<K, V> withSizeAndLifespan(int size, Duration lifespan) {
        return new TimedSizedCache<>(size, lifespan, false, Ticker.systemTicker());
    }

    private Predicate<Stamped<V>> liveAt(long now) {
        long ttl = ttlNanos;
        return stamped -> stamped.isLive(now, ttl);
    }

    private <E extends Exception> V load(K key, SizedCache.ValueLoader<? extends V, E> loader) throws E {
        SizedCache.Lookup<Stamped<V>> lookup = store.getOrLoadIf(key, liveAt(ticker.read()), () -> {
            recordMiss();
            return new Stamped<>(requireValue(loader.load()), ticker.read());
        });
        if (lookup.reused) {
            recordHit();
        }
        return lookup.value.value;
    }

    @Override
    public V getIfPresent(K key) {
        Stamped<V> stamped = store.getIf(key, liveAt(ticker.read()));
        if (stamped == null) {
            recordMiss();
            return null;
        }
        recordHit();
        return stamped.value;
    }

    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
        Objects.requireNonNull(remappingFunction, "remappingFunction cannot be null");
        Stamped<V> stamped = store.computeIf(key, liveAt(ticker.read()),
                current -> new Stamped<>(requireValue(remappingFunction.apply(key, current.value)),
                        current.writtenAt));
        if (stamped == null) {
            recordMiss();
            return null;
        }
        recordHit();
        return stamped.value;
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

    /**
     * {@inheritDoc}
     *
     * <p>The previous value is returned even if it had already expired.
     */
    @Override
    public V put(K key, V value) {
        Stamped<V> old = store.put(key, new Stamped<>(requireValue(value), ticker.read()));
        return old == null ? null : old.value;
    }

    @Override
    public V remove(K key) {
        Stamped<V> old = store.remove(key);
        return old == null ? null : old.value;
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

    @Override
    public Optional<Duration> lifespan() {
        return Optional.of(lifespan);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Stored entries keep their write time, so the new lifespan applies to them on their next
     * lookup.
     */
    @Override
    public Optional<Duration> setLifespan(Duration lifespan) {
        Objects.requireNonNull(lifespan, "lifespan cannot be null");
        long nanos = Stamped.toTtlNanos(lifespan);
        Duration previous = this.lifespan;
        this.lifespan = lifespan;
        this.ttlNanos = nanos;
        return Optional.of(previous);
    }

    /**
     * Returns the keys of unexpired entries from the most to the least recently used.
     */
    public List<K> keyOrder() {
        Predicate<Stamped<V>> live = liveAt(ticker.read());
        List<K> keys = new ArrayList<>();
        store.forEachInOrder((key, stamped) -> {
            if (live.test(stamped)) {
                keys.add(key);
            }
        });
        return keys;
    }

    /**
     * Returns the unexpired values from the most to the least recently used.
     */
    public List<V> valueOrder() {
        Predicate<Stamped<V>> live = liveAt(ticker.read());
        List<V> values = new ArrayList<>();
        store.forEachInOrder((key, stamped) -> {
            if (live.test(stamped)) {
                values.add(stamped.value);
            }
        });
        return values;
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of removed entries
     */
    public int flush() {
        Predicate<Stamped<V>> live = liveAt(ticker.read());
        return store.removeUnless((key, stamped) -> live.test(stamped), RemovalCause.EXPIRED);
    }
}
