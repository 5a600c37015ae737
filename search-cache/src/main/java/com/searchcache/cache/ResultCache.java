package com.searchcache.cache;

import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Ranked result lists keyed by tenant and query. A tenant's entries can be dropped in bulk when its
 * document corpus changes.
 *
 * @param <T> result item type; never inspected by the cache
 */
public class ResultCache<T> {

    private static final char TENANT_SEPARATOR = '|';

    private final LruTtlCache<String, List<T>> store;

    public ResultCache(int maxSize, long ttlMillis) {
        this(maxSize, ttlMillis, System::currentTimeMillis);
    }

    public ResultCache(int maxSize, long ttlMillis, LongSupplier clock) {
        this.store = new LruTtlCache<>(maxSize, ttlMillis, clock);
    }

    /**
     * Builds {@code <tenant length>:<tenant>|<normalized query>}. The length prefix keeps the tenant
     * boundary unambiguous whatever characters the tenant id or query contain.
     */
    public String generateKey(String tenantId, String query) {
        return tenantPrefix(requireTenant(tenantId)) + CacheKeys.normalizeQuery(query);
    }

    public Optional<List<T>> get(String tenantId, String query) {
        return store.get(generateKey(tenantId, query));
    }

    public void set(String tenantId, String query, List<T> results) {
        if (results == null) {
            throw new IllegalArgumentException("results must not be null");
        }
        store.put(generateKey(tenantId, query), List.copyOf(results));
    }

    /**
     * Removes every cached result list belonging to the tenant; other tenants are untouched even
     * when they cached the same query text.
     *
     * @return number of entries removed
     */
    public int invalidateAgent(String tenantId) {
        String prefix = tenantPrefix(requireTenant(tenantId));
        return store.removeIf(key -> key.startsWith(prefix));
    }

    public int maxSize() {
        return store.maxSize();
    }

    public long ttlMillis() {
        return store.ttlMillis();
    }

    public CacheStats getStats() {
        return store.stats();
    }

    public void clear() {
        store.clear();
    }

    private static String tenantPrefix(String tenantId) {
        return tenantId.length() + ":" + tenantId + TENANT_SEPARATOR;
    }

    private static String requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        return tenantId;
    }
}
