package com.github.rudygunawan.stash.api;

/**
 * Failure reported by an external storage engine behind an {@link IoCached} store, such as a
 * lost connection or a value that could not be serialized. The engine's own exception is kept
 * as the cause.
 */
public class CacheBackendException extends CacheException {

    private static final long serialVersionUID = 1L;

    public CacheBackendException(String message, Throwable cause) {
        super(message, cause);
    }

    public CacheBackendException(String message) {
        super(message);
    }
}
