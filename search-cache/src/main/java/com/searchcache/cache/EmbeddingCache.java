package com.searchcache.cache;

import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Query text to embedding vector. Vectors are copied on the way in and out so callers cannot
 * mutate a cached embedding.
 */
public class EmbeddingCache {

    private final LruTtlCache<String, float[]> store;

    public EmbeddingCache(int maxSize, long ttlMillis) {
        this(maxSize, ttlMillis, System::currentTimeMillis);
    }

    public EmbeddingCache(int maxSize, long ttlMillis, LongSupplier clock) {
        this.store = new LruTtlCache<>(maxSize, ttlMillis, clock);
    }

    public Optional<float[]> get(String query) {
        return store.get(CacheKeys.normalizeQuery(query)).map(float[]::clone);
    }

    public void set(String query, float[] embedding) {
        if (embedding == null) {
            throw new IllegalArgumentException("embedding must not be null");
        }
        store.put(CacheKeys.normalizeQuery(query), embedding.clone());
    }

    public CacheStats getStats() {
        return store.stats();
    }

    public void clear() {
        store.clear();
    }

    public int maxSize() {
        return store.maxSize();
    }

    public long ttlMillis() {
        return store.ttlMillis();
    }
}
