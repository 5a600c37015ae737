package com.searchcache.cache;

final class CacheEntry<V> {

    private final V value;
    private final long expiresAt;

    CacheEntry(V value, long now, long ttlMillis) {
        this.value = value;
        this.expiresAt = ttlMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMillis;
    }

    V value() {
        return value;
    }

    // ttl=0 must be stale on the very next read, so the boundary instant counts as expired.
    boolean isExpired(long now) {
        return now >= expiresAt;
    }
}
