package com.github.rudygunawan.stash.model;

import java.util.Objects;

/**
 * Statistics about the performance of a {@code Cached} store. Instances of this class are
 * immutable.
 *
 * <p>Cache statistics are incremented according to the following rules:
 *
 * <ul>
 *   <li>When a lookup finds a live (non-expired) entry, {@code hitCount} is incremented.
 *   <li>When a lookup finds no entry, or only an expired one, {@code missCount} is incremented.
 *   <li>When an entry is removed by the store's own policy (capacity or expiry),
 *       {@code evictionCount} is incremented.
 * </ul>
 */
public class CacheStats {
    private static final CacheStats EMPTY = new CacheStats(0, 0, 0);

    private final long hitCount;
    private final long missCount;
    private final long evictionCount;

    /**
     * Constructs a new {@code CacheStats} instance.
     */
    public CacheStats(long hitCount, long missCount, long evictionCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.evictionCount = evictionCount;
    }

    /**
     * Returns a snapshot with every counter at zero.
     */
    public static CacheStats empty() {
        return EMPTY;
    }

    /**
     * Returns the number of lookups. This is defined as {@code hitCount + missCount}.
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * Returns the number of lookups that returned a cached value.
     */
    public long hitCount() {
        return hitCount;
    }

    /**
     * Returns the ratio of lookups which were hits, or {@code 1.0} when no lookup happened.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
    }

    /**
     * Returns the number of lookups that found nothing usable.
     */
    public long missCount() {
        return missCount;
    }

    /**
     * Returns the ratio of lookups which were misses, or {@code 0.0} when no lookup happened.
     */
    public double missRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
    }

    /**
     * Returns the number of times an entry has been evicted.
     */
    public long evictionCount() {
        return evictionCount;
    }

    /**
     * Returns a new {@code CacheStats} representing the difference between this {@code CacheStats}
     * and {@code other}.
     */
    public CacheStats minus(CacheStats other) {
        return new CacheStats(
                Math.max(0, hitCount - other.hitCount),
                Math.max(0, missCount - other.missCount),
                Math.max(0, evictionCount - other.evictionCount));
    }

    /**
     * Returns a new {@code CacheStats} representing the sum of this {@code CacheStats} and
     * {@code other}.
     */
    public CacheStats plus(CacheStats other) {
        return new CacheStats(
                hitCount + other.hitCount,
                missCount + other.missCount,
                evictionCount + other.evictionCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, missCount, evictionCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CacheStats)) {
            return false;
        }
        CacheStats other = (CacheStats) obj;
        return hitCount == other.hitCount
                && missCount == other.missCount
                && evictionCount == other.evictionCount;
    }

    @Override
    public String toString() {
        return "CacheStats{"
                + "hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", evictionCount=" + evictionCount
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}
