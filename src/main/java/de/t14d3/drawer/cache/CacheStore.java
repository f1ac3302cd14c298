package de.t14d3.drawer.cache;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory namespace of key to {@link CacheEntry} governed by one {@link CachePolicy}.
 *
 * The store never talks to storage: on a miss the owner reads through and calls {@link #put}.
 * For TTL policies with cascading delete, expired keys are reported to the
 * {@link ExpiryListener} once the store lock has been released.
 *
 * All methods are thread-safe.
 */
public final class CacheStore {
    private final CachePolicy policy;
    private final Clock clock;
    private final ExpiryListener expiryListener;
    private final LinkedHashMap<String, CacheEntry> entries;

    public CacheStore(CachePolicy policy) {
        this(policy, Clock.systemUTC(), null);
    }

    public CacheStore(CachePolicy policy, Clock clock, ExpiryListener expiryListener) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.expiryListener = expiryListener;
        // access order keeps the least recently used entry first
        this.entries = new LinkedHashMap<>(16, 0.75f, policy.strategy() == CacheStrategy.LRU);
    }

    public CachePolicy policy() {
        return policy;
    }

    /**
     * @return the live entry for {@code key}, or {@code null} on a miss (absent or expired)
     */
    public CacheEntry lookup(String key) {
        CacheEntry hit = null;
        boolean expired = false;
        synchronized (this) {
            CacheEntry entry = entries.get(key);
            if (entry != null) {
                long now = clock.millis();
                if (isLive(entry, now)) {
                    entry.touch(now);
                    hit = entry;
                } else {
                    entries.remove(key);
                    expired = true;
                }
            }
        }
        if (expired) {
            notifyExpired(List.of(key));
        }
        return hit;
    }

    /**
     * Insert or replace an entry, then apply the eviction rule. The key just written is never evicted.
     */
    public void put(String key, Object value) {
        Objects.requireNonNull(key, "key");
        synchronized (this) {
            long now = clock.millis();
            entries.put(key, new CacheEntry(key, value, now, expiryFor(now)));
            trimToCapacity(key);
        }
    }

    public boolean remove(String key) {
        synchronized (this) {
            return entries.remove(key) != null;
        }
    }

    public void removeAll(Collection<String> keys) {
        synchronized (this) {
            for (String key : keys) {
                entries.remove(key);
            }
        }
    }

    /**
     * Same as {@code lookup(key) != null}; counts as an access.
     */
    public boolean contains(String key) {
        return lookup(key) != null;
    }

    /**
     * Apply the eviction rule eagerly: LRU trims to capacity, TTL sweeps every expired entry.
     *
     * @return number of entries removed
     */
    public int evictIfNeeded() {
        List<String> expired = new ArrayList<>();
        int removed;
        synchronized (this) {
            removed = switch (policy.strategy()) {
                case UNBOUNDED -> 0;
                case LRU -> trimToCapacity(null);
                case TTL -> {
                    long now = clock.millis();
                    Iterator<CacheEntry> it = entries.values().iterator();
                    while (it.hasNext()) {
                        CacheEntry entry = it.next();
                        if (entry.isExpired(now)) {
                            it.remove();
                            expired.add(entry.key());
                        }
                    }
                    yield expired.size();
                }
            };
        }
        notifyExpired(expired);
        return removed;
    }

    public void clear() {
        synchronized (this) {
            entries.clear();
        }
    }

    public int size() {
        synchronized (this) {
            return entries.size();
        }
    }

    /**
     * Keys currently held, expired or not, without touching access order.
     */
    public Set<String> keys() {
        synchronized (this) {
            return new LinkedHashSet<>(entries.keySet());
        }
    }

    /**
     * Copy of the live key/value pairs, without touching access order.
     */
    public Map<String, Object> snapshot() {
        synchronized (this) {
            long now = clock.millis();
            Map<String, Object> copy = new LinkedHashMap<>();
            for (CacheEntry entry : entries.values()) {
                if (isLive(entry, now)) {
                    copy.put(entry.key(), entry.value());
                }
            }
            return copy;
        }
    }

    private boolean isLive(CacheEntry entry, long now) {
        return switch (policy.strategy()) {
            case UNBOUNDED, LRU -> true;
            case TTL -> !entry.isExpired(now);
        };
    }

    private long expiryFor(long now) {
        return switch (policy.strategy()) {
            case UNBOUNDED, LRU -> CacheEntry.NO_EXPIRY;
            case TTL -> now + policy.ttl().toMillis();
        };
    }

    // caller holds the monitor
    private int trimToCapacity(String keep) {
        if (policy.strategy() != CacheStrategy.LRU) {
            return 0;
        }
        int removed = 0;
        Iterator<String> it = entries.keySet().iterator();
        while (entries.size() > policy.capacity() && it.hasNext()) {
            String candidate = it.next();
            if (!candidate.equals(keep)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private void notifyExpired(List<String> keys) {
        if (keys.isEmpty() || expiryListener == null || !policy.cascadeDelete()) {
            return;
        }
        for (String key : keys) {
            expiryListener.expired(key);
        }
    }
}
