package com.github.rudygunawan.stash.api;

import java.time.Duration;

/**
 * Thrown when computing an expiry time ({@code now + ttl}) falls outside the ticker's
 * representable range.
 *
 * <p>The store is left unchanged when this is thrown. The caller decides whether to retry with a
 * smaller lifespan or to skip the operation.
 */
public class TimeBoundsException extends CacheException {

    private static final long serialVersionUID = 1L;

    private final long nowNanos;
    private final transient Duration ttl;

    public TimeBoundsException(long nowNanos, Duration ttl, ArithmeticException cause) {
        super("expiry of " + ttl + " from ticker reading " + nowNanos
                + " overflows the ticker's range", cause);
        this.nowNanos = nowNanos;
        this.ttl = ttl;
    }

    /**
     * Returns the ticker reading the expiry was computed from.
     */
    public long getNowNanos() {
        return nowNanos;
    }

    /**
     * Returns the lifespan that could not be added.
     */
    public Duration getTtl() {
        return ttl;
    }
}
