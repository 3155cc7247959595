package com.github.rudygunawan.stash.impl;

import com.github.rudygunawan.stash.api.Cached;
import com.github.rudygunawan.stash.api.TimeBoundsException;
import com.github.rudygunawan.stash.listener.RemovalCause;
import com.github.rudygunawan.stash.listener.RemovalListener;
import com.github.rudygunawan.stash.metrics.CacheMetrics;
import com.github.rudygunawan.stash.model.CacheStats;
import com.github.rudygunawan.stash.reference.SharedKey;
import com.github.rudygunawan.stash.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A store with one fixed lifespan and an optional size limit, tuned for many readers and few
 * writers.
 *
 * <p>Every write appends a stamp {@code (expiry, key)} to a queue. Since the lifespan is fixed and
 * the ticker never goes backwards, the queue is always sorted by expiry: the entries to evict first
 * sit at its front and a binary search finds where the expired prefix ends.
 *
 * <p>Removing or overwriting an entry does not touch the queue structurally. The old stamp is only
 * marked as a tombstone, and tombstones are dropped in one pass once there are more than
 * {@code maxTombstones} of them. That pass also rewrites the queue index each map entry keeps.
 *
 * <p>Lookups never modify the store: an expired entry is reported as absent but stays until
 * {@link #evict()} or {@link #retainLatest(int, boolean)} drops it, so {@link #size()} may include
 * expired entries. This makes lookups safe to run concurrently with each other; see
 * {@link ConcurrentExpiringCache}. When the size limit is reached, the entry closest to expiry
 * is dropped, not the least recently used one.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class ExpiringSizedCache<K, V> implements Cached<K, V>, CacheMetrics {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.stash.Cache");

    public static final int DEFAULT_MAX_TOMBSTONES = 50;

    private static final int NO_LIMIT = 0;

    static final class Stamp<K> {
        final long expiry;
        final SharedKey<K> key;
        boolean tombstone;

        Stamp(long expiry, SharedKey<K> key) {
            this.expiry = expiry;
            this.key = key;
        }
    }

    static final class Entry<V> {
        int stampIndex;
        final long expiry;
        V value;

        Entry(int stampIndex, long expiry, V value) {
            this.stampIndex = stampIndex;
            this.expiry = expiry;
            this.value = value;
        }

        boolean isExpired(long now) {
            return expiry < now;
        }
    }

    private final Duration lifespan;
    private final long ttlNanos;
    private final Ticker ticker;
    private final int initialCapacity;

    private HashMap<SharedKey<K>, Entry<V>> map;
    private final ArrayList<Stamp<K>> stamps;
    private int sizeLimit = NO_LIMIT;
    private int tombstoneCount;
    private int maxTombstones;

    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);

    private RemovalListener<? super K, ? super V> removalListener;

    /**
     * Creates a store.
     *
     * @param lifespan        time an entry stays valid after its write
     * @param initialCapacity expected number of entries
     * @param maxTombstones   number of tombstones tolerated before the queue is compacted
     * @param ticker          the clock used to compute expiries
     * @throws IllegalArgumentException if {@code lifespan}, {@code initialCapacity} or
     *                                  {@code maxTombstones} is negative
     */
    public ExpiringSizedCache(Duration lifespan, int initialCapacity, int maxTombstones, Ticker ticker) {
        Objects.requireNonNull(lifespan, "lifespan cannot be null");
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initial capacity must not be negative");
        }
        this.ttlNanos = Stamped.toTtlNanos(lifespan);
        this.lifespan = lifespan;
        this.initialCapacity = initialCapacity;
        this.maxTombstones = checkMaxTombstones(maxTombstones);
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.map = new HashMap<>(initialCapacity);
        this.stamps = new ArrayList<>(initialCapacity);
    }

    public static <K, V> ExpiringSizedCache<K, V> withLifespan(Duration lifespan) {
        return new ExpiringSizedCache<>(lifespan, 16, DEFAULT_MAX_TOMBSTONES, Ticker.systemTicker());
    }

    public static <K, V> ExpiringSizedCache<K, V> withLifespanAndCapacity(Duration lifespan, int capacity) {
        return new ExpiringSizedCache<>(lifespan, capacity, DEFAULT_MAX_TOMBSTONES, Ticker.systemTicker());
    }

    private static int checkMaxTombstones(int maxTombstones) {
        if (maxTombstones < 0) {
            throw new IllegalArgumentException("maxTombstones must not be negative");
        }
        return maxTombstones;
    }

    public void setRemovalListener(RemovalListener<? super K, ? super V> removalListener) {
        this.removalListener = removalListener;
    }

    // ---- configuration ----

    /**
     * Limits the number of entries. Whenever an insert leaves more entries than the limit, the
     * entries closest to expiry are dropped until it holds again. Overwriting a key at the limit
     * drops nothing. A lowered limit takes effect on the next insert.
     *
     * @return the previous limit, if one was set
     * @throws IllegalArgumentException if {@code size} is not positive
     */
    public OptionalInt sizeLimit(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size limit must be greater than zero, was " + size);
        }
        OptionalInt previous = sizeLimit == NO_LIMIT ? OptionalInt.empty() : OptionalInt.of(sizeLimit);
        sizeLimit = size;
        return previous;
    }

    /**
     * Grows the backing structures so {@code more} further entries fit without resizing.
     */
    public void reserve(int more) {
        if (more <= 0) {
            return;
        }
        int target = map.size() + more;
        HashMap<SharedKey<K>, Entry<V>> grown = new HashMap<>((int) (target / 0.75f) + 1);
        grown.putAll(map);
        map = grown;
        stamps.ensureCapacity(stamps.size() + more);
    }

    /**
     * Sets how many tombstones are tolerated before the stamp queue is compacted.
     *
     * @return the previous threshold
     */
    public int setMaxTombstones(int maxTombstones) {
        int previous = this.maxTombstones;
        this.maxTombstones = checkMaxTombstones(maxTombstones);
        compactIfNeeded();
        return previous;
    }

    public int maxTombstones() {
        return maxTombstones;
    }

    /**
     * Returns the number of stamps currently marked as tombstones.
     */
    public int tombstoneCount() {
        return tombstoneCount;
    }

    // ---- writes ----

    /**
     * Stores {@code value} under {@code key} with an expiry of now plus the lifespan, without an
     * eviction pass. The size limit is still enforced.
     *
     * @return the replaced value if it had not expired, otherwise {@code null}
     * @throws TimeBoundsException if the expiry overflows the ticker's range
     */
    public V insert(K key, V value) {
        return insertEvict(key, value, false);
    }

    /**
     * Like {@link #insert}, and when {@code evict} is set also drops every expired entry first.
     *
     * @return the replaced value if it had not expired, otherwise {@code null}
     * @throws TimeBoundsException if the expiry overflows the ticker's range; the store is left
     *                             unchanged
     */
    public V insertEvict(K key, V value, boolean evict) {
        Objects.requireNonNull(value, "value cannot be null");
        SharedKey<K> sharedKey = SharedKey.of(key);
        long now = ticker.read();
        long expiry = expiryFrom(now);

        if (evict) {
            evict();
        }

        stamps.add(new Stamp<>(expiry, sharedKey));
        Entry<V> old = map.remove(sharedKey);
        map.put(sharedKey, new Entry<>(stamps.size() - 1, expiry, value));
        if (old != null) {
            bury(old.stampIndex);
            notifyRemoval(key, old.value, RemovalCause.REPLACED);
        }
        // the new stamp expires last, so trimming never drops the entry just written
        if (sizeLimit != NO_LIMIT && map.size() > sizeLimit) {
            retainLatest(sizeLimit, false);
        }
        compactIfNeeded();
        return old == null || old.isExpired(now) ? null : old.value;
    }

    private long expiryFrom(long now) {
        try {
            return Math.addExact(now, ttlNanos);
        } catch (ArithmeticException e) {
            throw new TimeBoundsException(now, lifespan, e);
        }
    }

    /**
     * Drops every expired entry.
     *
     * @return the number of entries removed from the map; stamps that were already tombstones do
     *         not count
     */
    public int evict() {
        long now = ticker.read();
        int boundary = firstUnexpired(now);
        int removed = 0;
        for (int i = 0; i < boundary; i++) {
            if (drop(stamps.get(i), RemovalCause.EXPIRED)) {
                removed++;
            }
        }
        compactIfNeeded();
        if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Evicted " + removed + " expired entries");
        }
        return removed;
    }

    /**
     * Keeps only the {@code count} entries expiring last, dropping the others in expiry order.
     *
     * @param evict whether to also drop every expired entry, even if fewer than {@code count}
     *              entries are live
     * @return the number of entries removed from the map
     */
    public int retainLatest(int count, boolean evict) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        long now = ticker.read();
        int expiredBoundary = evict ? firstUnexpired(now) : 0;
        int toDrop = Math.max(0, map.size() - count);
        int removed = 0;
        for (int i = 0; i < stamps.size(); i++) {
            if (i >= expiredBoundary && removed >= toDrop) {
                break;
            }
            Stamp<K> stamp = stamps.get(i);
            RemovalCause cause = stamp.expiry < now ? RemovalCause.EXPIRED : RemovalCause.SIZE;
            if (drop(stamp, cause)) {
                removed++;
            }
        }
        compactIfNeeded();
        if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Retained latest " + count + " entries, dropped " + removed);
        }
        return removed;
    }

    /**
     * Tombstones {@code stamp} and removes its entry from the map.
     *
     * @return whether an entry was removed
     */
    private boolean drop(Stamp<K> stamp, RemovalCause cause) {
        if (stamp.tombstone) {
            return false;
        }
        stamp.tombstone = true;
        tombstoneCount++;
        Entry<V> entry = map.remove(stamp.key);
        notifyRemoval(stamp.key.get(), entry.value, cause);
        return true;
    }

    private void bury(int stampIndex) {
        Stamp<K> stamp = stamps.get(stampIndex);
        if (!stamp.tombstone) {
            stamp.tombstone = true;
            tombstoneCount++;
        }
    }

    /**
     * Returns the index of the first stamp that has not expired at {@code now}, or the queue
     * length when all have.
     */
    int firstUnexpired(long now) {
        int low = 0;
        int high = stamps.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (stamps.get(mid).expiry < now) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private void compactIfNeeded() {
        if (tombstoneCount > maxTombstones) {
            compact();
        }
    }

    private void compact() {
        int before = stamps.size();
        int write = 0;
        for (int read = 0; read < before; read++) {
            Stamp<K> stamp = stamps.get(read);
            if (stamp.tombstone) {
                continue;
            }
            map.get(stamp.key).stampIndex = write;
            stamps.set(write++, stamp);
        }
        stamps.subList(write, before).clear();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Compacted " + tombstoneCount + " tombstones, " + write + " stamps remain");
        }
        tombstoneCount = 0;
    }

    private void notifyRemoval(K key, V value, RemovalCause cause) {
        if (cause.wasEvicted()) {
            evictionCount.incrementAndGet();
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

    // ---- Cached ----

    /**
     * Returns the live value for {@code key} without recording a hit or a miss.
     */
    V peekLive(K key) {
        Entry<V> entry = map.get(SharedKey.of(key));
        return entry == null || entry.isExpired(ticker.read()) ? null : entry.value;
    }

    void recordHit() {
        hitCount.incrementAndGet();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Never modifies the store. An expired entry is a miss but is kept until the next eviction.
     */
    @Override
    public V getIfPresent(K key) {
        Entry<V> entry = map.get(SharedKey.of(key));
        if (entry == null || entry.isExpired(ticker.read())) {
            missCount.incrementAndGet();
            return null;
        }
        hitCount.incrementAndGet();
        return entry.value;
    }

    /**
     * {@inheritDoc}
     *
     * <p>The entry keeps its expiry.
     */
    @Override
    public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
        Objects.requireNonNull(remappingFunction, "remappingFunction cannot be null");
        Entry<V> entry = map.get(SharedKey.of(key));
        if (entry == null || entry.isExpired(ticker.read())) {
            missCount.incrementAndGet();
            return null;
        }
        hitCount.incrementAndGet();
        entry.value = Objects.requireNonNull(remappingFunction.apply(key, entry.value),
                "value cannot be null");
        return entry.value;
    }

    @Override
    public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
        Objects.requireNonNull(mappingFunction, "mappingFunction cannot be null");
        V existing = getIfPresent(key);
        if (existing != null) {
            return existing;
        }
        V value = Objects.requireNonNull(mappingFunction.apply(key), "value cannot be null");
        insert(key, value);
        return value;
    }

    @Override
    public V get(K key, Callable<? extends V> loader) throws Exception {
        Objects.requireNonNull(loader, "loader cannot be null");
        V existing = getIfPresent(key);
        if (existing != null) {
            return existing;
        }
        V value = Objects.requireNonNull(loader.call(), "value cannot be null");
        insert(key, value);
        return value;
    }

    /**
     * Same as {@link #insert}.
     */
    @Override
    public V put(K key, V value) {
        return insert(key, value);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The value is returned whether or not it had expired; call {@link #evict()} first to
     * exclude expired entries.
     */
    @Override
    public V remove(K key) {
        Entry<V> entry = map.remove(SharedKey.of(key));
        if (entry == null) {
            return null;
        }
        bury(entry.stampIndex);
        notifyRemoval(key, entry.value, RemovalCause.EXPLICIT);
        compactIfNeeded();
        return entry.value;
    }

    @Override
    public void clear() {
        if (removalListener != null) {
            for (Map.Entry<SharedKey<K>, Entry<V>> entry : map.entrySet()) {
                notifyRemoval(entry.getKey().get(), entry.getValue().value, RemovalCause.EXPLICIT);
            }
        }
        map.clear();
        stamps.clear();
        tombstoneCount = 0;
    }

    @Override
    public void reset() {
        clear();
        map = new HashMap<>(initialCapacity);
        stamps.trimToSize();
        stamps.ensureCapacity(initialCapacity);
    }

    /**
     * Returns the number of entries in the map, including expired ones not yet evicted.
     */
    @Override
    public long size() {
        return map.size();
    }

    /**
     * Same as {@link #size()}.
     */
    public int len() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Override
    public OptionalLong capacity() {
        return sizeLimit == NO_LIMIT ? OptionalLong.empty() : OptionalLong.of(sizeLimit);
    }

    @Override
    public Optional<Duration> lifespan() {
        return Optional.of(lifespan);
    }

    /**
     * Not supported: a single fixed lifespan is what keeps the stamp queue sorted.
     *
     * @throws UnsupportedOperationException always
     */
    @Override
    public Optional<Duration> setLifespan(Duration lifespan) {
        throw new UnsupportedOperationException("the lifespan of an ExpiringSizedCache is fixed");
    }

    @Override
    public OptionalLong hits() {
        return OptionalLong.of(hitCount.get());
    }

    @Override
    public OptionalLong misses() {
        return OptionalLong.of(missCount.get());
    }

    @Override
    public long hitCount() {
        return hitCount.get();
    }

    @Override
    public long missCount() {
        return missCount.get();
    }

    @Override
    public long evictionCount() {
        return evictionCount.get();
    }

    @Override
    public void resetMetrics() {
        hitCount.set(0);
        missCount.set(0);
        evictionCount.set(0);
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(hitCount.get(), missCount.get(), evictionCount.get());
    }

    /**
     * Returns the number of stamps in the queue, tombstones included.
     */
    int stampCount() {
        return stamps.size();
    }

    /**
     * Counts tombstoned stamps by walking the queue.
     */
    int countTombstones() {
        int count = 0;
        for (Stamp<K> stamp : stamps) {
            if (stamp.tombstone) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "ExpiringSizedCache{size=" + map.size() + ", stamps=" + stamps.size()
                + ", tombstones=" + tombstoneCount + ", " + stats() + '}';
    }
}
