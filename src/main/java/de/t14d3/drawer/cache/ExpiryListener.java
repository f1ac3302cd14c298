package de.t14d3.drawer.cache;

/**
 * Notified when a TTL entry with cascading delete expires.
 *
 * Called after the store has released its own lock, so implementations may touch storage.
 */
@FunctionalInterface
public interface ExpiryListener {
    void expired(String key);
}
