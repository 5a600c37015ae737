package com.searchcache.search.config;

import com.searchcache.cache.EmbeddingCache;
import com.searchcache.search.embedding.BatchEmbeddingProcessor;
import com.searchcache.search.embedding.EmbeddingProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddingWarmupRunnerTest {

    @Test
    void testWarmupFillsEmbeddingCache() {
        EmbeddingCache cache = new EmbeddingCache(10, 60_000L);
        FlakyProvider provider = new FlakyProvider(0);
        EmbeddingWarmupRunner runner = new EmbeddingWarmupRunner(cache, new BatchEmbeddingProcessor(), provider,
                true, List.of("condo price", " ", "amenities"), 2, 0L);

        runner.run(null);

        assertThat(provider.calls.get()).isEqualTo(1);
        assertThat(cache.get("condo price")).isPresent();
        assertThat(cache.get("amenities")).isPresent();
    }

    @Test
    void testWarmupRetriesAfterFailure() {
        EmbeddingCache cache = new EmbeddingCache(10, 60_000L);
        FlakyProvider provider = new FlakyProvider(1);
        EmbeddingWarmupRunner runner = new EmbeddingWarmupRunner(cache, new BatchEmbeddingProcessor(), provider,
                true, List.of("condo price"), 3, 0L);

        runner.run(null);

        assertThat(provider.calls.get()).isEqualTo(2);
        assertThat(cache.get("condo price")).isPresent();
    }

    @Test
    void testDisabledWarmupDoesNothing() {
        EmbeddingCache cache = new EmbeddingCache(10, 60_000L);
        FlakyProvider provider = new FlakyProvider(0);
        EmbeddingWarmupRunner runner = new EmbeddingWarmupRunner(cache, new BatchEmbeddingProcessor(), provider,
                false, List.of("condo price"), 2, 0L);

        runner.run(null);

        assertThat(provider.calls.get()).isZero();
    }

    private static class FlakyProvider implements EmbeddingProvider {
        final AtomicInteger calls = new AtomicInteger();
        private final int failures;

        FlakyProvider(int failures) {
            this.failures = failures;
        }

        @Override
        public List<float[]> embed(List<String> queries) {
            if (calls.incrementAndGet() <= failures) {
                throw new IllegalStateException("ollama warming up");
            }
            List<float[]> vectors = new ArrayList<>();
            for (int i = 0; i < queries.size(); i++) {
                vectors.add(new float[]{i});
            }
            return vectors;
        }

        @Override
        public int maxBatchSize() {
            return 10;
        }
    }
}
