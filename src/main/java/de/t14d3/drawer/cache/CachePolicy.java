package de.t14d3.drawer.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable eviction policy of one cache namespace.
 *
 * Only the fields relevant to the strategy are meaningful: {@code capacity} for LRU,
 * {@code ttl} and {@code cascadeDelete} for TTL.
 */
public final class CachePolicy {
    private static final CachePolicy UNBOUNDED = new CachePolicy(CacheStrategy.UNBOUNDED, 0, null, false);

    private final CacheStrategy strategy;
    private final int capacity;
    private final Duration ttl;
    private final boolean cascadeDelete;

    private CachePolicy(CacheStrategy strategy, int capacity, Duration ttl, boolean cascadeDelete) {
        this.strategy = strategy;
        this.capacity = capacity;
        this.ttl = ttl;
        this.cascadeDelete = cascadeDelete;
    }

    public static CachePolicy unbounded() {
        return UNBOUNDED;
    }

    public static CachePolicy lru(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("LRU capacity must be > 0, got " + capacity);
        }
        return new CachePolicy(CacheStrategy.LRU, capacity, null, false);
    }

    public static CachePolicy ttl(Duration ttl, boolean cascadeDelete) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive, got " + ttl);
        }
        return new CachePolicy(CacheStrategy.TTL, 0, ttl, cascadeDelete);
    }

    /**
     * Build a policy from loose settings, as read from options or properties.
     */
    public static CachePolicy of(CacheStrategy strategy, Integer capacity, Duration ttl, boolean cascadeDelete) {
        Objects.requireNonNull(strategy, "strategy");
        return switch (strategy) {
            case UNBOUNDED -> unbounded();
            case LRU -> {
                if (capacity == null) {
                    throw new IllegalArgumentException("LRU strategy requires a cache capacity");
                }
                yield lru(capacity);
            }
            case TTL -> {
                if (ttl == null) {
                    throw new IllegalArgumentException("TTL strategy requires a cache ttl");
                }
                yield ttl(ttl, cascadeDelete);
            }
        };
    }

    public CacheStrategy strategy() {
        return strategy;
    }

    public int capacity() {
        return capacity;
    }

    public Duration ttl() {
        return ttl;
    }

    public boolean cascadeDelete() {
        return cascadeDelete;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CachePolicy other)) return false;
        return capacity == other.capacity
                && cascadeDelete == other.cascadeDelete
                && strategy == other.strategy
                && Objects.equals(ttl, other.ttl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, capacity, ttl, cascadeDelete);
    }

    @Override
    public String toString() {
        return switch (strategy) {
            case UNBOUNDED -> "Unbounded";
            case LRU -> "LRU(" + capacity + ")";
            case TTL -> "TTL(" + ttl + (cascadeDelete ? ", cascade" : "") + ")";
        };
    }
}
