package com.searchcache.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.Predicate;

/**
 * {@link Cache} backed by an access-ordered {@link LinkedHashMap}, giving O(1) lookup, insert and
 * least-recently-used eviction. Expiry is checked lazily on read; stale entries that are never read
 * again are reclaimed from the least-recently-used end when the cache runs out of room.
 *
 * <p>All operations hold a single per-instance lock, so one cache can be shared by concurrent
 * requests.
 */
public class LruTtlCache<K, V> implements Cache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(LruTtlCache.class);
    private static final int EXPIRY_SCAN_LIMIT = 8;

    private final int maxSize;
    private final long ttlMillis;
    private final LongSupplier clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, CacheEntry<V>> entries;

    private long hits;
    private long misses;
    private long evictions;

    public LruTtlCache(int maxSize, long ttlMillis) {
        this(maxSize, ttlMillis, System::currentTimeMillis);
    }

    public LruTtlCache(int maxSize, long ttlMillis, LongSupplier clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be a positive integer, got " + maxSize);
        }
        if (ttlMillis < 0) {
            throw new IllegalArgumentException("ttl must not be negative, got " + ttlMillis);
        }
        this.maxSize = maxSize;
        this.ttlMillis = ttlMillis;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(Math.min(maxSize, 1024), 0.75f, true);
    }

    @Override
    public Optional<V> get(K key) {
        lock.lock();
        try {
            long now = clock.getAsLong();
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(K key, V value) {
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            long now = clock.getAsLong();
            // Re-inserting an existing key must land it at the most-recently-used end.
            CacheEntry<V> previous = entries.remove(key);
            if (previous == null && entries.size() >= maxSize) {
                makeRoom(now);
            }
            entries.put(key, new CacheEntry<>(value, now, ttlMillis));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int removeIf(Predicate<? super K> keyPredicate) {
        lock.lock();
        try {
            int removed = 0;
            Iterator<K> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (keyPredicate.test(it.next())) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            entries.clear();
            hits = 0;
            misses = 0;
            evictions = 0;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            long now = clock.getAsLong();
            int live = 0;
            for (CacheEntry<V> entry : entries.values()) {
                if (!entry.isExpired(now)) {
                    live++;
                }
            }
            return new CacheStats(hits, misses, evictions, live);
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }

    public long ttlMillis() {
        return ttlMillis;
    }

    // Caller holds the lock. Only the eldest few entries are inspected so a full cache still evicts in
    // constant time; any expired ones among them are reclaimed instead of a live entry.
    private void makeRoom(long now) {
        Iterator<CacheEntry<V>> eldest = entries.values().iterator();
        int reclaimed = 0;
        for (int scanned = 0; scanned < EXPIRY_SCAN_LIMIT && eldest.hasNext(); scanned++) {
            if (eldest.next().isExpired(now)) {
                eldest.remove();
                reclaimed++;
            }
        }
        if (reclaimed > 0) {
            log.debug("event=cache_expired_reclaim removed={} max_size={}", reclaimed, maxSize);
            return;
        }
        Iterator<Map.Entry<K, CacheEntry<V>>> victim = entries.entrySet().iterator();
        if (victim.hasNext()) {
            victim.next();
            victim.remove();
            evictions++;
        }
    }
}
