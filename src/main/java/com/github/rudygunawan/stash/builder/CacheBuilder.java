package com.github.rudygunawan.stash.builder;

import com.github.rudygunawan.stash.api.CanExpire;
import com.github.rudygunawan.stash.api.Cached;
import com.github.rudygunawan.stash.impl.ConcurrentExpiringCache;
import com.github.rudygunawan.stash.impl.ExpiringSizedCache;
import com.github.rudygunawan.stash.impl.ExpiringValueCache;
import com.github.rudygunawan.stash.impl.SizedCache;
import com.github.rudygunawan.stash.impl.SynchronizedCache;
import com.github.rudygunawan.stash.impl.TimedCache;
import com.github.rudygunawan.stash.impl.TimedSizedCache;
import com.github.rudygunawan.stash.impl.UnboundCache;
import com.github.rudygunawan.stash.listener.RemovalListener;
import com.github.rudygunawan.stash.time.Ticker;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * A builder of the stores in {@code com.github.rudygunawan.stash.impl}.
 *
 * <p>{@link #build()} picks the store from the settings:
 * <ul>
 *   <li>neither a maximum size nor an expiry: {@link UnboundCache}
 *   <li>a maximum size only: {@link SizedCache}
 *   <li>an expiry only: {@link TimedCache}
 *   <li>both: {@link TimedSizedCache}
 * </ul>
 *
 * <p>{@link #buildExpiring()} and {@link #buildConcurrent()} build the tombstone-compacting store,
 * which needs an expiry and treats the maximum size as its size limit.
 *
 * <p>Usage example:
 * <pre>{@code
 * Cached<String, Session> sessions = CacheBuilder.newBuilder()
 *     .maximumSize(10_000)
 *     .expireAfterWrite(30, TimeUnit.MINUTES)
 *     .removalListener((key, session, cause) -> session.close())
 *     .build();
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class CacheBuilder<K, V> {
    private static final int UNSET_INT = -1;

    private int initialCapacity = UNSET_INT;
    private int maximumSize = UNSET_INT;
    private Duration expireAfterWrite;
    private boolean refreshAfterRead = false;
    private boolean refreshRecencyOnWrite = false;
    private int maxTombstones = ExpiringSizedCache.DEFAULT_MAX_TOMBSTONES;
    private Ticker ticker = Ticker.systemTicker();
    private RemovalListener<? super K, ? super V> removalListener;

    private CacheBuilder() {
    }

    /**
     * Constructs a new {@code CacheBuilder} instance with default settings.
     */
    public static CacheBuilder<Object, Object> newBuilder() {
        return new CacheBuilder<>();
    }

    /**
     * Sets the expected number of entries, used to size the backing map.
     *
     * @throws IllegalArgumentException if {@code initialCapacity} is negative
     */
    public CacheBuilder<K, V> initialCapacity(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initial capacity must not be negative");
        }
        this.initialCapacity = initialCapacity;
        return this;
    }

    /**
     * Bounds the number of entries.
     *
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public CacheBuilder<K, V> maximumSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("maximum size must be greater than zero");
        }
        this.maximumSize = size;
        return this;
    }

    /**
     * Expires each entry once {@code duration} has elapsed since its write.
     *
     * @throws IllegalArgumentException if {@code duration} is negative
     */
    public CacheBuilder<K, V> expireAfterWrite(long duration, TimeUnit unit) {
        if (duration < 0) {
            throw new IllegalArgumentException("duration must not be negative");
        }
        this.expireAfterWrite = Duration.ofNanos(unit.toNanos(duration));
        return this;
    }

    /**
     * Expires each entry once {@code duration} has elapsed since its write.
     *
     * @throws IllegalArgumentException if {@code duration} is negative
     */
    public CacheBuilder<K, V> expireAfterWrite(Duration duration) {
        if (duration == null) {
            throw new NullPointerException("duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative");
        }
        this.expireAfterWrite = duration;
        return this;
    }

    /**
     * Restamps an entry on every hit, so it expires after a period without reads. Only the
     * time-bounded store without a size bound supports this.
     */
    public CacheBuilder<K, V> refreshAfterRead() {
        this.refreshAfterRead = true;
        return this;
    }

    /**
     * Makes a write to an existing key mark it as most recently used. By default only reads and
     * first writes do.
     */
    public CacheBuilder<K, V> refreshRecencyOnWrite(boolean refreshRecencyOnWrite) {
        this.refreshRecencyOnWrite = refreshRecencyOnWrite;
        return this;
    }

    /**
     * Sets how many tombstones the tombstone-compacting store tolerates before it compacts.
     *
     * <p>This option is not required; by default the limit is
     * {@value ExpiringSizedCache#DEFAULT_MAX_TOMBSTONES}.
     *
     * @throws IllegalArgumentException if {@code maxTombstones} is negative
     */
    public CacheBuilder<K, V> maxTombstones(int maxTombstones) {
        if (maxTombstones < 0) {
            throw new IllegalArgumentException("maxTombstones must not be negative");
        }
        this.maxTombstones = maxTombstones;
        return this;
    }

    /**
     * Specifies a nanosecond-precision time source for expiry. By default
     * {@link System#nanoTime} is used.
     */
    public CacheBuilder<K, V> ticker(Ticker ticker) {
        if (ticker == null) {
            throw new NullPointerException("ticker cannot be null");
        }
        this.ticker = ticker;
        return this;
    }

    /**
     * Specifies a listener notified each time an entry is removed, replaced, evicted or expires.
     *
     * <p><b>Warning:</b> all exceptions thrown by {@code listener} will be logged and then swallowed.
     */
    public <K1 extends K, V1 extends V> CacheBuilder<K1, V1> removalListener(
            RemovalListener<? super K1, ? super V1> listener) {
        if (listener == null) {
            throw new NullPointerException("removal listener cannot be null");
        }
        @SuppressWarnings("unchecked")
        CacheBuilder<K1, V1> me = (CacheBuilder<K1, V1>) this;
        me.removalListener = listener;
        return me;
    }

    /**
     * Builds a single-owner store having the requested features. The store is not thread-safe.
     *
     * @throws IllegalStateException if refresh on read is combined with a maximum size
     */
    public <K1 extends K, V1 extends V> Cached<K1, V1> build() {
        boolean sized = maximumSize != UNSET_INT;
        boolean timed = expireAfterWrite != null;
        if (refreshAfterRead && (sized || !timed)) {
            throw new IllegalStateException("refreshAfterRead requires expireAfterWrite without maximumSize");
        }
        if (sized && timed) {
            TimedSizedCache<K1, V1> cache =
                    new TimedSizedCache<>(maximumSize, expireAfterWrite, refreshRecencyOnWrite, ticker);
            cache.setRemovalListener(removalListener);
            return cache;
        }
        if (sized) {
            SizedCache<K1, V1> cache = SizedCache.withSize(maximumSize, refreshRecencyOnWrite);
            cache.setRemovalListener(removalListener);
            return cache;
        }
        if (timed) {
            TimedCache<K1, V1> cache =
                    new TimedCache<>(expireAfterWrite, refreshAfterRead, initialCapacity, ticker);
            cache.setRemovalListener(removalListener);
            return cache;
        }
        UnboundCache<K1, V1> cache = initialCapacity == UNSET_INT
                ? new UnboundCache<>()
                : UnboundCache.withCapacity(initialCapacity);
        cache.setRemovalListener(removalListener);
        return cache;
    }

    /**
     * Builds {@link #build()} behind a single lock, for sharing between threads.
     */
    public <K1 extends K, V1 extends V> SynchronizedCache<K1, V1> buildSynchronized() {
        return new SynchronizedCache<>(this.<K1, V1>build());
    }

    /**
     * Builds an LRU store for values that decide themselves when they are stale.
     *
     * @throws IllegalStateException if no maximum size was set
     */
    public <K1 extends K, V1 extends CanExpire> ExpiringValueCache<K1, V1> buildExpiringValues() {
        if (maximumSize == UNSET_INT) {
            throw new IllegalStateException("maximumSize is required");
        }
        ExpiringValueCache<K1, V1> cache = ExpiringValueCache.withSize(maximumSize, refreshRecencyOnWrite);
        @SuppressWarnings("unchecked")
        RemovalListener<? super K1, ? super V1> listener =
                (RemovalListener<? super K1, ? super V1>) (RemovalListener<?, ?>) removalListener;
        cache.setRemovalListener(listener);
        return cache;
    }

    /**
     * Builds the tombstone-compacting store. The maximum size, if any, becomes its size limit.
     *
     * @throws IllegalStateException if no expiry was set
     */
    public <K1 extends K, V1 extends V> ExpiringSizedCache<K1, V1> buildExpiring() {
        if (expireAfterWrite == null) {
            throw new IllegalStateException("expireAfterWrite is required");
        }
        ExpiringSizedCache<K1, V1> cache = new ExpiringSizedCache<>(expireAfterWrite,
                initialCapacity == UNSET_INT ? 16 : initialCapacity, maxTombstones, ticker);
        if (maximumSize != UNSET_INT) {
            cache.sizeLimit(maximumSize);
        }
        cache.setRemovalListener(removalListener);
        return cache;
    }

    /**
     * Builds the tombstone-compacting store behind a read/write lock: lookups run in parallel,
     * writes are exclusive.
     *
     * @throws IllegalStateException if no expiry was set
     */
    public <K1 extends K, V1 extends V> ConcurrentExpiringCache<K1, V1> buildConcurrent() {
        return new ConcurrentExpiringCache<>(this.<K1, V1>buildExpiring());
    }

    public int getInitialCapacity() {
        return initialCapacity;
    }

    public int getMaximumSize() {
        return maximumSize;
    }

    public Duration getExpireAfterWrite() {
        return expireAfterWrite;
    }

    public int getMaxTombstones() {
        return maxTombstones;
    }

    public RemovalListener<? super K, ? super V> getRemovalListener() {
        return removalListener;
    }
}
