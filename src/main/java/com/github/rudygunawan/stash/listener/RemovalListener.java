package com.github.rudygunawan.stash.listener;

/**
 * A listener that receives notification when an entry is removed from a store.
 *
 * <p>Usage example:
 * <pre>{@code
 * SizedCache<String, Session> sessions = SizedCache.withSize(1_000);
 * sessions.setRemovalListener((key, value, cause) -> {
 *     if (cause.wasEvicted()) {
 *         value.close();
 *     }
 * });
 * }</pre>
 *
 * <p>The listener is called synchronously by the thread performing the mutation, while the
 * store is still inside that operation. It must not call back into the same store. Exceptions
 * thrown by the listener are logged and swallowed.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    /**
     * Notifies the listener that an entry was removed.
     *
     * @param key the key of the removed entry
     * @param value the value of the removed entry
     * @param cause the reason for the removal
     */
    void onRemoval(K key, V value, RemovalCause cause);
}
