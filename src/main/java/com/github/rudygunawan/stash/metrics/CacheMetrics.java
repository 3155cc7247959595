package com.github.rudygunawan.stash.metrics;

/**
 * Counters a store exposes for monitoring. Used by {@link MicrometerCacheMetrics} to collect and
 * expose metrics.
 */
public interface CacheMetrics {

    /**
     * Returns the current number of entries in the store.
     */
    long size();

    /**
     * Returns the total number of hits.
     */
    long hitCount();

    /**
     * Returns the total number of misses.
     */
    long missCount();

    /**
     * Returns the total number of evictions (capacity or expiry driven removals).
     */
    long evictionCount();

    /**
     * Returns the ratio of lookups that were hits, or {@code 1.0} before the first lookup.
     */
    default double hitRatio() {
        long requests = hitCount() + missCount();
        return requests == 0 ? 1.0 : (double) hitCount() / requests;
    }
}
