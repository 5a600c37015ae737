package com.searchcache.cache;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory key/value cache with bounded capacity and time-to-live expiry.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface Cache<K, V> {

    /**
     * Looks up a live entry and marks it most-recently-used.
     *
     * @param key the cache key
     * @return the value, or empty when the key is unknown or expired
     */
    Optional<V> get(K key);

    /**
     * Stores a value, replacing any previous entry for the key and restarting its TTL.
     *
     * @param key   the cache key
     * @param value the value to cache
     */
    void put(K key, V value);

    /**
     * Removes every entry whose key matches the predicate.
     *
     * @return number of entries removed
     */
    int removeIf(Predicate<? super K> keyPredicate);

    /**
     * Drops all entries and resets the statistics counters.
     */
    void clear();

    CacheStats stats();
}
