package com.github.rudygunawan.stash.impl;

import java.time.Duration;

/**
 * A value paired with the ticker reading of its last write.
 */
final class Stamped<V> {
    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    V value;
    long writtenAt;

    Stamped(V value, long writtenAt) {
        this.value = value;
        this.writtenAt = writtenAt;
    }

    /**
     * Returns whether less than {@code ttlNanos} has elapsed since the write.
     */
    boolean isLive(long now, long ttlNanos) {
        return now - writtenAt < ttlNanos;
    }

    /**
     * Converts a lifespan to nanoseconds, saturating at {@link Long#MAX_VALUE}.
     *
     * @throws IllegalArgumentException if {@code lifespan} is negative
     */
    static long toTtlNanos(Duration lifespan) {
        if (lifespan.isNegative()) {
            throw new IllegalArgumentException("lifespan must not be negative: " + lifespan);
        }
        return lifespan.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : lifespan.toNanos();
    }
}
