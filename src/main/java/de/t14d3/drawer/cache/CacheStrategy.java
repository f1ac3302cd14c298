package de.t14d3.drawer.cache;

/**
 * Eviction rule governing which cached entries are discarded.
 */
public enum CacheStrategy {
    UNBOUNDED,
    LRU,
    TTL
}
