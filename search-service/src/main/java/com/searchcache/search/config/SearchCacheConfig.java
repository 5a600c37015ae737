package com.searchcache.search.config;

import com.searchcache.cache.CacheMetrics;
import com.searchcache.cache.EmbeddingCache;
import com.searchcache.cache.ResultCache;
import com.searchcache.search.model.SearchHit;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide caches and the search worker pool. Each is created once here and injected wherever
 * it is needed.
 */
@Configuration
public class SearchCacheConfig {

    @Bean
    public EmbeddingCache embeddingCache(
            @Value("${search.cache.embedding.max-size:1000}") int maxSize,
            @Value("${search.cache.embedding.ttl-ms:3600000}") long ttlMs
    ) {
        return new EmbeddingCache(maxSize, ttlMs);
    }

    @Bean
    public ResultCache<SearchHit> resultCache(
            @Value("${search.cache.result.max-size:500}") int maxSize,
            @Value("${search.cache.result.ttl-ms:1800000}") long ttlMs
    ) {
        return new ResultCache<>(maxSize, ttlMs);
    }

    @Bean
    public CacheMetrics embeddingCacheMetrics(EmbeddingCache embeddingCache) {
        return CacheMetrics.of(embeddingCache);
    }

    @Bean
    public CacheMetrics resultCacheMetrics(ResultCache<SearchHit> resultCache) {
        return CacheMetrics.of(resultCache);
    }

    /**
     * Keeps {@code pool-size} threads warm and grows up to {@code max-pool-size} under load. There is
     * no queue: a search either starts at once or is rejected.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(
            @Value("${search.parallel.pool-size:8}") int poolSize,
            @Value("${search.parallel.max-pool-size:256}") int maxPoolSize
    ) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "search-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        int core = Math.max(1, poolSize);
        return new ThreadPoolExecutor(
                core,
                Math.max(core, maxPoolSize),
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                threadFactory
        );
    }

    @Bean
    public RestTemplate restTemplate() {
        return new RestTemplate();
    }
}
