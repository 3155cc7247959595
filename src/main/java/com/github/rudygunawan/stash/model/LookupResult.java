package com.github.rudygunawan.stash.model;

import java.util.Objects;

/**
 * The outcome of a lookup that also hands back expired values. Instances are immutable.
 *
 * <p>An expired value is still returned so a caller can fall back to it, for example when
 * reloading fails. The store has already dropped it and counted the lookup as a miss.
 *
 * @param <V> the type of the value
 */
public final class LookupResult<V> {
    private static final LookupResult<?> ABSENT = new LookupResult<>(null, false);

    private final V value;
    private final boolean expired;

    private LookupResult(V value, boolean expired) {
        this.value = value;
        this.expired = expired;
    }

    @SuppressWarnings("unchecked")
    public static <V> LookupResult<V> absent() {
        return (LookupResult<V>) ABSENT;
    }

    public static <V> LookupResult<V> live(V value) {
        return new LookupResult<>(Objects.requireNonNull(value, "value cannot be null"), false);
    }

    public static <V> LookupResult<V> expired(V value) {
        return new LookupResult<>(Objects.requireNonNull(value, "value cannot be null"), true);
    }

    /**
     * Returns the value found, live or expired, or {@code null} when there was none.
     */
    public V value() {
        return value;
    }

    public boolean isPresent() {
        return value != null;
    }

    /**
     * Returns whether the value had expired.
     */
    public boolean isExpired() {
        return expired;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LookupResult)) {
            return false;
        }
        LookupResult<?> that = (LookupResult<?>) o;
        return expired == that.expired && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, expired);
    }

    @Override
    public String toString() {
        if (value == null) {
            return "LookupResult{absent}";
        }
        return "LookupResult{value=" + value + ", expired=" + expired + '}';
    }
}
