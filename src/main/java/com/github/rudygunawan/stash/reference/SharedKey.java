package com.github.rudygunawan.stash.reference;

import java.util.Objects;

/**
 * An immutable handle around a cache key, held at the same time by a store's lookup map and by
 * its ordering structure so the key itself is never copied.
 *
 * <p>The hash code is computed once at construction; equality is forwarded to the wrapped keys.
 * A handle compares equal to any other handle wrapping an equal key, so a short-lived
 * {@link #of(Object) probe} can be used to look up a stored handle.
 *
 * @param <K> the type of the key
 */
public final class SharedKey<K> {

    private final K key;
    private final int hashCode;

    private SharedKey(K key) {
        this.key = key;
        this.hashCode = key.hashCode();
    }

    /**
     * Wraps {@code key}.
     *
     * @param key the key to wrap
     * @param <K> the type of the key
     * @return a handle for the key
     * @throws NullPointerException if {@code key} is null
     */
    public static <K> SharedKey<K> of(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        return new SharedKey<>(key);
    }

    /**
     * Returns the wrapped key.
     */
    public K get() {
        return key;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SharedKey<?> other)) return false;
        return hashCode == other.hashCode && key.equals(other.key);
    }

    @Override
    public String toString() {
        return String.valueOf(key);
    }
}
