package com.searchcache.cache;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheMetricsTest {

    @Test
    void testPublishesStatsPerCache() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EmbeddingCache embeddingCache = new EmbeddingCache(10, 60_000L);
        ResultCache<String> resultCache = new ResultCache<>(10, 60_000L);
        CacheMetrics.of(embeddingCache).bindTo(registry);
        CacheMetrics.of(resultCache).bindTo(registry);

        embeddingCache.set("q", new float[]{1f});
        embeddingCache.get("q");
        embeddingCache.get("other");
        resultCache.get("agent", "q");

        assertThat(registry.get("search_cache_hits_total").tag("cache", "embedding").functionCounter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("search_cache_misses_total").tag("cache", "embedding").functionCounter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("search_cache_size").tag("cache", "embedding").gauge().value())
                .isEqualTo(1.0);
        assertThat(registry.get("search_cache_hit_rate").tag("cache", "embedding").gauge().value())
                .isEqualTo(0.5);
        assertThat(registry.get("search_cache_misses_total").tag("cache", "result").functionCounter().count())
                .isEqualTo(1.0);
    }

    @Test
    void testCacheKeysSanitizeLongQueries() {
        String longQuery = "word ".repeat(60);

        assertThat(CacheKeys.sanitizeForLog(longQuery)).hasSize(123).endsWith("...");
        assertThat(CacheKeys.sanitizeForLog(null)).isEmpty();
        assertThat(List.of(CacheKeys.normalizeQuery("  A\tB  "))).containsExactly("a b");
    }
}
