package com.github.rudygunawan.stash.metrics;

import com.github.rudygunawan.stash.api.Cached;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for store metrics.
 * Binds store counters to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics, all tagged with {@code cache=<name>}:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.hits - Total number of hits
 *   <li>cache.misses - Total number of misses
 *   <li>cache.evictions - Total number of evictions
 *   <li>cache.hit.ratio - Hit rate (0.0 to 1.0)
 * </ul>
 *
 * <p>The meters read the store's counters lazily, so a store that is not thread-safe must be
 * scraped from the thread that owns it or behind the same lock that guards it.
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * SizedCache<String, User> cache = SizedCache.withSize(1000);
 *
 * MicrometerCacheMetrics.monitor(registry, cache, "userCache");
 * }</pre>
 */
public class MicrometerCacheMetrics implements MeterBinder {

    private final CacheMetrics cache;
    private final String cacheName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheMetrics instance.
     *
     * @param cache the store to monitor
     * @param cacheName the name of the store for metric tags
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheMetrics(CacheMetrics cache, String cacheName, Iterable<Tag> tags) {
        this.cache = cache;
        this.cacheName = cacheName;
        this.tags = tags;
    }

    /**
     * Convenience method to monitor a store with Micrometer.
     *
     * @param registry the meter registry
     * @param cache the store to monitor
     * @param cacheName the name of the store
     * @param <C> the store type
     * @return the store (for chaining)
     */
    public static <C extends Cached<?, ?> & CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName) {
        return monitor(registry, cache, cacheName, Collections.emptyList());
    }

    /**
     * Convenience method to monitor a store with Micrometer with additional tags.
     *
     * @param registry the meter registry
     * @param cache the store to monitor
     * @param cacheName the name of the store
     * @param tags additional tags
     * @param <C> the store type
     * @return the store (for chaining)
     */
    public static <C extends Cached<?, ?> & CacheMetrics> C monitor(
            MeterRegistry registry, C cache, String cacheName, Iterable<Tag> tags) {
        new MicrometerCacheMetrics(cache, cacheName, tags).bindTo(registry);
        return cache;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", cacheName).and(tags);

        Gauge.builder("cache.size", cache, CacheMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the cache")
                .register(registry);

        FunctionCounter.builder("cache.hits", cache, CacheMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("cache.misses", cache, CacheMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("cache.evictions", cache, CacheMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of cache evictions")
                .register(registry);

        Gauge.builder("cache.hit.ratio", cache, CacheMetrics::hitRatio)
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);
    }
}
