package com.github.rudygunawan.stash.api;

/**
 * Base class of the typed failures a store can report.
 *
 * <p>Lookups never fail with this exception: an absent or expired entry is a {@code null}
 * result. It is only thrown when an operation cannot be carried out at all.
 */
public class CacheException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
