package com.github.rudygunawan.stash.listener;

/**
 * The reason why a cached entry was removed.
 */
public enum RemovalCause {
    /**
     * The entry was manually removed by the caller using {@code remove} or {@code clear}.
     */
    EXPLICIT,

    /**
     * The entry was removed because its value was replaced by a new value.
     */
    REPLACED,

    /**
     * The entry was removed because the store reached its capacity or size limit.
     */
    SIZE,

    /**
     * The entry's lifespan has elapsed, or the value itself reported that it expired.
     */
    EXPIRED;

    /**
     * Returns {@code true} if the removal was caused by eviction (either SIZE or EXPIRED),
     * rather than manual removal or replacement.
     */
    public boolean wasEvicted() {
        return this == SIZE || this == EXPIRED;
    }
}
