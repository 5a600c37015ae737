package com.searchcache.search.embedding;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
public class BatchEmbeddingProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchEmbeddingProcessor.class);
    private static final int DEFAULT_MAX_BATCH_SIZE = 100;

    private final int maxBatchSize;
    private final MeterRegistry meterRegistry;

    public BatchEmbeddingProcessor() {
        this(DEFAULT_MAX_BATCH_SIZE, null);
    }

    @Autowired
    public BatchEmbeddingProcessor(
            @Value("${search.embedding.max-batch-size:100}") int maxBatchSize,
            MeterRegistry meterRegistry
    ) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive, got " + maxBatchSize);
        }
        this.maxBatchSize = maxBatchSize;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Embeds every query, one provider call per chunk of at most the effective batch size. The
     * returned list has the same length and order as {@code queries}. Any chunk failure aborts the
     * whole batch with {@link EmbeddingBatchException}.
     */
    public List<float[]> generateBatch(List<String> queries, EmbeddingProvider provider) {
        if (queries == null || queries.isEmpty()) {
            return List.of();
        }
        int batchSize = effectiveBatchSize(provider);
        List<float[]> vectors = new ArrayList<>(queries.size());
        for (int offset = 0; offset < queries.size(); offset += batchSize) {
            List<String> chunk = queries.subList(offset, Math.min(offset + batchSize, queries.size()));
            vectors.addAll(embedChunk(chunk, offset, provider));
        }
        log.debug("event=embedding_batch_complete queries={} chunks={} batch_size={}",
                queries.size(), chunkCount(queries.size(), batchSize), batchSize);
        return vectors;
    }

    public int effectiveBatchSize(EmbeddingProvider provider) {
        int providerLimit = provider.maxBatchSize();
        return providerLimit > 0 ? Math.min(providerLimit, maxBatchSize) : maxBatchSize;
    }

    static int chunkCount(int queryCount, int batchSize) {
        return (queryCount + batchSize - 1) / batchSize;
    }

    private List<float[]> embedChunk(List<String> chunk, int offset, EmbeddingProvider provider) {
        long start = System.nanoTime();
        List<float[]> embedded;
        try {
            incrementCounter("embedding_provider_calls_total");
            embedded = provider.embed(List.copyOf(chunk));
        } catch (Exception ex) {
            incrementCounter("embedding_batch_failure_total");
            log.warn("event=embedding_chunk_failed offset={} size={} cause={}", offset, chunk.size(), ex.toString());
            throw new EmbeddingBatchException(
                    "Embedding provider rejected chunk at offset " + offset, offset, chunk.size(), ex);
        } finally {
            recordTimer("embedding_provider_latency_ms", start);
        }
        if (embedded == null || embedded.size() != chunk.size()) {
            incrementCounter("embedding_batch_failure_total");
            int returned = embedded == null ? 0 : embedded.size();
            throw new EmbeddingBatchException(
                    "Embedding provider returned " + returned + " vectors for " + chunk.size() + " queries",
                    offset,
                    chunk.size()
            );
        }
        return embedded;
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }
}
