package com.github.rudygunawan.stash.backend;

import com.github.rudygunawan.stash.api.CacheBackendException;
import com.github.rudygunawan.stash.api.IoCached;
import com.github.rudygunawan.stash.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A store that keeps its entries in a {@link CacheBackend} and applies an optional lifespan on top
 * of it.
 *
 * <p>Expired records are deleted from the backend when they are read. With refresh enabled a hit
 * writes the record back with a new write time, so the lifespan counts from the last read.
 * Atomicity is whatever the backend provides for a single key.
 *
 * <p>Logging: Logger name "com.github.rudygunawan.stash.Backend"
 * <ul>
 *   <li>WARNING: Backend failures (the exception is rethrown)</li>
 *   <li>FINE: Expired records deleted</li>
 * </ul>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class BackendCache<K, V> implements IoCached<K, V> {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.stash.Backend");

    private final String name;
    private final CacheBackend<K, V> backend;
    private final Ticker ticker;
    private volatile Duration lifespan;
    private volatile boolean refresh;

    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);

    private BackendCache(Builder<K, V> builder) {
        this.name = builder.name;
        this.backend = builder.backend;
        this.ticker = builder.ticker;
        this.lifespan = builder.lifespan;
        this.refresh = builder.refresh;
    }

    public static <K, V> Builder<K, V> builder(String name, CacheBackend<K, V> backend) {
        return new Builder<>(name, backend);
    }

    private boolean isLive(StoredValue<V> stored, long now) {
        Duration ttl = lifespan;
        return ttl == null || Duration.ofNanos(now - stored.getWrittenAtNanos()).compareTo(ttl) < 0;
    }

    private <T> T call(String operation, K key, Supplier<T> action) {
        try {
            return action.get();
        } catch (CacheBackendException e) {
            LOGGER.log(Level.WARNING, "Backend " + operation + " failed for cache '" + name
                    + "', key: " + key, e);
            throw e;
        }
    }

    @Override
    public V get(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        return call("get", key, () -> {
            StoredValue<V> stored = backend.get(key);
            long now = ticker.read();
            if (stored == null) {
                missCount.incrementAndGet();
                return null;
            }
            if (!isLive(stored, now)) {
                backend.remove(key);
                missCount.incrementAndGet();
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine("Deleted expired record: cache=" + name + ", key=" + key);
                }
                return null;
            }
            if (refresh) {
                backend.put(key, stored.restamp(now));
            }
            hitCount.incrementAndGet();
            return stored.getValue();
        });
    }

    @Override
    public V put(K key, V value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        return call("put", key, () -> {
            long now = ticker.read();
            StoredValue<V> previous = backend.put(key, new StoredValue<>(value, now));
            return previous != null && isLive(previous, now) ? previous.getValue() : null;
        });
    }

    @Override
    public V remove(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        return call("remove", key, () -> {
            StoredValue<V> previous = backend.remove(key);
            return previous == null ? null : previous.getValue();
        });
    }

    /**
     * Deletes every record that has outlived the lifespan. Does nothing without a lifespan.
     *
     * @return the number of deleted records
     * @throws CacheBackendException if the engine cannot be read or written
     */
    public int removeExpiredEntries() {
        if (lifespan == null) {
            return 0;
        }
        List<K> keys = new ArrayList<>();
        call("keys", null, backend::keys).forEach(keys::add);
        int removed = 0;
        for (K key : keys) {
            StoredValue<V> stored = call("get", key, () -> backend.get(key));
            if (stored != null && !isLive(stored, ticker.read())) {
                call("remove", key, () -> backend.remove(key));
                removed++;
            }
        }
        if (removed > 0 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Deleted " + removed + " expired records from cache '" + name + "'");
        }
        return removed;
    }

    public String getName() {
        return name;
    }

    @Override
    public Optional<Duration> lifespan() {
        return Optional.ofNullable(lifespan);
    }

    @Override
    public Optional<Duration> setLifespan(Duration lifespan) {
        Optional<Duration> previous = Optional.ofNullable(this.lifespan);
        this.lifespan = checkLifespan(Objects.requireNonNull(lifespan, "lifespan cannot be null"));
        return previous;
    }

    private static Duration checkLifespan(Duration lifespan) {
        if (lifespan.isNegative()) {
            throw new IllegalArgumentException("lifespan must not be negative: " + lifespan);
        }
        return lifespan;
    }

    @Override
    public boolean refresh() {
        return refresh;
    }

    @Override
    public boolean setRefresh(boolean refresh) {
        boolean previous = this.refresh;
        this.refresh = refresh;
        return previous;
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
    public String toString() {
        return "BackendCache{name=" + name + ", lifespan=" + lifespan + ", refresh=" + refresh
                + ", hits=" + hitCount.get() + ", misses=" + missCount.get() + '}';
    }

    /**
     * Configures a {@link BackendCache}. Entries never expire unless a lifespan is set.
     */
    public static final class Builder<K, V> {
        private final String name;
        private final CacheBackend<K, V> backend;
        private Duration lifespan;
        private boolean refresh;
        private Ticker ticker = Ticker.systemTicker();

        private Builder(String name, CacheBackend<K, V> backend) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
            this.backend = Objects.requireNonNull(backend, "backend cannot be null");
        }

        public Builder<K, V> lifespan(Duration lifespan) {
            this.lifespan = checkLifespan(Objects.requireNonNull(lifespan, "lifespan cannot be null"));
            return this;
        }

        public Builder<K, V> refresh(boolean refresh) {
            this.refresh = refresh;
            return this;
        }

        public Builder<K, V> ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
            return this;
        }

        public BackendCache<K, V> build() {
            return new BackendCache<>(this);
        }
    }
}
