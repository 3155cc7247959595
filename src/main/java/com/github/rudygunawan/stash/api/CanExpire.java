package com.github.rudygunawan.stash.api;

/**
 * A value that knows by itself whether it is stale, for example a token carrying its own
 * expiry timestamp.
 *
 * @see com.github.rudygunawan.stash.impl.ExpiringValueCache
 */
@FunctionalInterface
public interface CanExpire {

    /**
     * Returns whether this value has expired and must no longer be served.
     */
    boolean isExpired();
}
