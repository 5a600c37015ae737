package com.searchcache.cache;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.function.Supplier;

/**
 * Publishes a cache's {@link CacheStats} as Micrometer meters tagged {@code cache=<name>}.
 */
public class CacheMetrics implements MeterBinder {

    private final String cacheName;
    private final Supplier<CacheStats> stats;

    public CacheMetrics(String cacheName, Supplier<CacheStats> stats) {
        this.cacheName = cacheName;
        this.stats = stats;
    }

    public static CacheMetrics of(EmbeddingCache cache) {
        return new CacheMetrics("embedding", cache::getStats);
    }

    public static CacheMetrics of(ResultCache<?> cache) {
        return new CacheMetrics("result", cache::getStats);
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("search_cache_size", stats, s -> s.get().size())
                .tag("cache", cacheName)
                .register(registry);
        Gauge.builder("search_cache_hit_rate", stats, s -> s.get().hitRate())
                .tag("cache", cacheName)
                .register(registry);
        FunctionCounter.builder("search_cache_hits_total", stats, s -> s.get().hits())
                .tag("cache", cacheName)
                .register(registry);
        FunctionCounter.builder("search_cache_misses_total", stats, s -> s.get().misses())
                .tag("cache", cacheName)
                .register(registry);
        FunctionCounter.builder("search_cache_evictions_total", stats, s -> s.get().evictions())
                .tag("cache", cacheName)
                .register(registry);
    }
}
