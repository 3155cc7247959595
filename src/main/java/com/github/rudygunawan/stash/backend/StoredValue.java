package com.github.rudygunawan.stash.backend;

import java.util.Objects;

/**
 * A value as it is handed to a {@link CacheBackend}: the value together with the ticker reading
 * of its write.
 *
 * @param <V> the type of the value
 */
public final class StoredValue<V> {

    private final V value;
    private final long writtenAtNanos;

    public StoredValue(V value, long writtenAtNanos) {
        this.value = Objects.requireNonNull(value, "value cannot be null");
        this.writtenAtNanos = writtenAtNanos;
    }

    public V getValue() {
        return value;
    }

    public long getWrittenAtNanos() {
        return writtenAtNanos;
    }

    /**
     * Returns a copy stamped with a new write time.
     */
    public StoredValue<V> restamp(long writtenAtNanos) {
        return new StoredValue<>(value, writtenAtNanos);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StoredValue<?> other)) return false;
        return writtenAtNanos == other.writtenAtNanos && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, writtenAtNanos);
    }

    @Override
    public String toString() {
        return "StoredValue{value=" + value + ", writtenAtNanos=" + writtenAtNanos + '}';
    }
}
