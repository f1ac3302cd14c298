package de.t14d3.drawer.cache;

/**
 * One cached key/value pair with its bookkeeping timestamps (epoch millis).
 *
 * The value may be {@code null}: a stored JSON null is still a cache hit.
 */
public final class CacheEntry {
    static final long NO_EXPIRY = Long.MAX_VALUE;

    private final String key;
    private final Object value;
    private final long expiresAtMillis;
    private volatile long lastAccessMillis;

    CacheEntry(String key, Object value, long nowMillis, long expiresAtMillis) {
        this.key = key;
        this.value = value;
        this.lastAccessMillis = nowMillis;
        this.expiresAtMillis = expiresAtMillis;
    }

    public String key() {
        return key;
    }

    public Object value() {
        return value;
    }

    public long lastAccessMillis() {
        return lastAccessMillis;
    }

    /**
     * @return expiry instant in epoch millis, or {@link Long#MAX_VALUE} when the entry never expires
     */
    public long expiresAtMillis() {
        return expiresAtMillis;
    }

    boolean isExpired(long nowMillis) {
        return expiresAtMillis != NO_EXPIRY && nowMillis >= expiresAtMillis;
    }

    void touch(long nowMillis) {
        lastAccessMillis = nowMillis;
    }
}
