package com.searchcache.search.config;

import com.searchcache.cache.EmbeddingCache;
import com.searchcache.search.embedding.BatchEmbeddingProcessor;
import com.searchcache.search.embedding.EmbeddingBatchException;
import com.searchcache.search.embedding.EmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EmbeddingWarmupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingWarmupRunner.class);

    private final EmbeddingCache embeddingCache;
    private final BatchEmbeddingProcessor batchProcessor;
    private final EmbeddingProvider embeddingProvider;
    private final boolean warmupEnabled;
    private final List<String> warmupQueries;
    private final int warmupAttempts;
    private final long warmupDelayMs;

    public EmbeddingWarmupRunner(
            EmbeddingCache embeddingCache,
            BatchEmbeddingProcessor batchProcessor,
            EmbeddingProvider embeddingProvider,
            @Value("${search.warmup.enabled:false}") boolean warmupEnabled,
            @Value("${search.warmup.queries:}") List<String> warmupQueries,
            @Value("${search.warmup.attempts:2}") int warmupAttempts,
            @Value("${search.warmup.delay-ms:2000}") long warmupDelayMs
    ) {
        this.embeddingCache = embeddingCache;
        this.batchProcessor = batchProcessor;
        this.embeddingProvider = embeddingProvider;
        this.warmupEnabled = warmupEnabled;
        this.warmupQueries = warmupQueries == null ? List.of() : warmupQueries.stream()
                .filter(q -> q != null && !q.isBlank())
                .toList();
        this.warmupAttempts = Math.max(1, warmupAttempts);
        this.warmupDelayMs = Math.max(0L, warmupDelayMs);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!warmupEnabled || warmupQueries.isEmpty()) {
            return;
        }

        for (int attempt = 1; attempt <= warmupAttempts; attempt++) {
            try {
                List<float[]> vectors = batchProcessor.generateBatch(warmupQueries, embeddingProvider);
                for (int i = 0; i < warmupQueries.size(); i++) {
                    embeddingCache.set(warmupQueries.get(i), vectors.get(i));
                }
                log.info("embedding warmup completed attempt={} queries={}", attempt, warmupQueries.size());
                return;
            } catch (EmbeddingBatchException ex) {
                log.warn("embedding warmup attempt={} failed: {}", attempt, ex.getMessage());
            }
            if (attempt < warmupAttempts && warmupDelayMs > 0) {
                try {
                    Thread.sleep(warmupDelayMs);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
