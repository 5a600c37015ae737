package com.searchcache.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeout;

class LruTtlCacheTest {

    private final AtomicLong clock = new AtomicLong(1_000L);

    @Test
    void rejectsNonPositiveMaxSize() {
        assertThatThrownBy(() -> new LruTtlCache<String, String>(0, 1000L, clock::get))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxSize");
        assertThatThrownBy(() -> new LruTtlCache<String, String>(-3, 1000L, clock::get))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeTtl() {
        assertThatThrownBy(() -> new LruTtlCache<String, String>(10, -1L, clock::get))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ttl");
    }

    @Test
    void overwriteResetsTtl() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(10, 100L, clock::get);
        cache.put("k", "v1");
        clock.addAndGet(80L);
        cache.put("k", "v2");
        clock.addAndGet(80L);

        assertThat(cache.get("k")).contains("v2");
    }

    @Test
    void overwriteOfExistingKeyNeverEvicts() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(2, 1000L, clock::get);
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("a", "3");

        assertThat(cache.get("a")).contains("3");
        assertThat(cache.get("b")).contains("2");
        assertThat(cache.stats().evictions()).isZero();
    }

    @Test
    void setMarksEntryMostRecentlyUsed() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(2, 1000L, clock::get);
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("a", "1b");
        cache.put("c", "3");

        assertThat(cache.get("b")).isEmpty();
        assertThat(cache.get("a")).contains("1b");
        assertThat(cache.get("c")).contains("3");
    }

    @Test
    void expiredEntriesAreReclaimedBeforeLiveOnes() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(2, 100L, clock::get);
        cache.put("old", "1");
        clock.addAndGet(60L);
        cache.put("fresh", "2");
        clock.addAndGet(60L);

        cache.put("new", "3");

        assertThat(cache.get("fresh")).contains("2");
        assertThat(cache.get("new")).contains("3");
        assertThat(cache.stats().evictions()).isZero();
    }

    @Test
    void expiredEntriesAmongEldestAreReclaimedEvenIfTouched() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(3, 100L, clock::get);
        cache.put("a", "1");
        cache.put("b", "2");
        clock.addAndGet(50L);
        cache.put("c", "3");
        clock.addAndGet(40L);
        cache.get("a");
        clock.addAndGet(30L);

        cache.put("d", "4");

        assertThat(cache.stats().evictions()).isZero();
        assertThat(cache.get("c")).contains("3");
        assertThat(cache.get("d")).contains("4");
    }

    @Test
    void fullCacheEvictsEldestWithoutSweepingWholeMap() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(21, 100L, clock::get);
        cache.put("early", "0");
        clock.addAndGet(50L);
        for (int i = 1; i <= 20; i++) {
            cache.put("live-" + i, "v" + i);
        }
        clock.addAndGet(40L);
        cache.get("early");
        clock.addAndGet(30L);

        cache.put("new", "x");

        assertThat(cache.stats().evictions()).isEqualTo(1);
        assertThat(cache.get("live-1")).isEmpty();
        assertThat(cache.get("live-2")).contains("v2");
        assertThat(cache.get("early")).isEmpty();
    }

    @Test
    void putAtCapacityStaysCheapForLargeCaches() {
        LruTtlCache<Integer, Integer> cache = new LruTtlCache<>(100_000, 3_600_000L, clock::get);
        for (int i = 0; i < 100_000; i++) {
            cache.put(i, i);
        }

        assertTimeout(Duration.ofSeconds(2), () -> {
            for (int i = 100_000; i < 120_000; i++) {
                cache.put(i, i);
            }
        });
        assertThat(cache.stats().evictions()).isEqualTo(20_000);
    }

    @Test
    void exactlyOneLiveEntryEvictedWhenFull() {
        LruTtlCache<String, Integer> cache = new LruTtlCache<>(3, 1000L, clock::get);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.put("c", 3);
        cache.put("d", 4);

        CacheStats stats = cache.stats();
        assertThat(stats.size()).isEqualTo(3);
        assertThat(stats.evictions()).isEqualTo(1);
        assertThat(cache.get("a")).isEmpty();
    }

    @Test
    void removeIfDropsMatchingKeysOnly() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(10, 1000L, clock::get);
        cache.put("x:1", "a");
        cache.put("x:2", "b");
        cache.put("y:1", "c");

        int removed = cache.removeIf(key -> key.startsWith("x:"));

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("y:1")).contains("c");
        assertThat(cache.stats().evictions()).isZero();
    }

    @Test
    void clearResetsEntriesAndCounters() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(10, 1000L, clock::get);
        cache.put("k", "v");
        cache.get("k");
        cache.get("missing");

        cache.clear();

        assertThat(cache.stats()).isEqualTo(CacheStats.empty());
    }

    @Test
    void sizeCountsOnlyLiveEntries() {
        LruTtlCache<String, String> cache = new LruTtlCache<>(10, 100L, clock::get);
        cache.put("a", "1");
        clock.addAndGet(50L);
        cache.put("b", "2");
        clock.addAndGet(60L);

        assertThat(cache.stats().size()).isEqualTo(1);
    }

    @Test
    void concurrentAccessKeepsCountersConsistent() throws Exception {
        LruTtlCache<String, Integer> cache = new LruTtlCache<>(50, 60_000L);
        int threads = 8;
        int opsPerThread = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int seed = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < opsPerThread; i++) {
                        String key = "q" + ((i * 31 + seed) % 120);
                        if (cache.get(key).isEmpty()) {
                            cache.put(key, i);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        CacheStats stats = cache.stats();
        assertThat(stats.hits() + stats.misses()).isEqualTo((long) threads * opsPerThread);
        assertThat(stats.size()).isLessThanOrEqualTo(50);
    }
}
