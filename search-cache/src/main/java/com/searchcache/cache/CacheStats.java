package com.searchcache.cache;

/**
 * Point-in-time cache counters.
 *
 * @param hits      lookups that returned a live entry
 * @param misses    lookups for unknown or expired keys
 * @param evictions entries dropped to make room for a new key
 * @param size      live entry count
 */
public record CacheStats(long hits, long misses, long evictions, int size) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
