package com.searchcache.search.service;

import com.searchcache.cache.CacheKeys;
import com.searchcache.cache.EmbeddingCache;
import com.searchcache.cache.ResultCache;
import com.searchcache.search.backend.SearchBackend;
import com.searchcache.search.classifier.SmartQueryFilter;
import com.searchcache.search.embedding.BatchEmbeddingProcessor;
import com.searchcache.search.embedding.EmbeddingBatchException;
import com.searchcache.search.embedding.EmbeddingProvider;
import com.searchcache.search.model.ResultSource;
import com.searchcache.search.model.SearchHit;
import com.searchcache.search.model.SearchResponse;
import com.searchcache.search.parallel.ParallelEmbeddingSearch;
import com.searchcache.search.parallel.SearchTask;
import com.searchcache.search.parallel.TaskOutcome;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class SearchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    private static final int DEFAULT_TOP_K = 5;
    private static final int DEFAULT_MAX_TOP_K = 50;

    private final SmartQueryFilter queryFilter;
    private final EmbeddingCache embeddingCache;
    private final ResultCache<SearchHit> resultCache;
    private final BatchEmbeddingProcessor batchProcessor;
    private final EmbeddingProvider embeddingProvider;
    private final SearchBackend searchBackend;
    private final ParallelEmbeddingSearch parallelSearch;
    private final MeterRegistry meterRegistry;
    private final SearchLogService searchLogService;
    private final int defaultTopK;
    private final int maxTopK;
    private final ConcurrentHashMap<String, Object> inFlightLocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicLong> tenantGenerations = new ConcurrentHashMap<>();

    public SearchOrchestrator(
            SmartQueryFilter queryFilter,
            EmbeddingCache embeddingCache,
            ResultCache<SearchHit> resultCache,
            BatchEmbeddingProcessor batchProcessor,
            EmbeddingProvider embeddingProvider,
            SearchBackend searchBackend,
            ParallelEmbeddingSearch parallelSearch
    ) {
        this(
                queryFilter,
                embeddingCache,
                resultCache,
                batchProcessor,
                embeddingProvider,
                searchBackend,
                parallelSearch,
                null,
                null,
                DEFAULT_TOP_K,
                DEFAULT_MAX_TOP_K
        );
    }

    @Autowired
    public SearchOrchestrator(
            SmartQueryFilter queryFilter,
            EmbeddingCache embeddingCache,
            ResultCache<SearchHit> resultCache,
            BatchEmbeddingProcessor batchProcessor,
            EmbeddingProvider embeddingProvider,
            SearchBackend searchBackend,
            ParallelEmbeddingSearch parallelSearch,
            MeterRegistry meterRegistry,
            SearchLogService searchLogService,
            @Value("${search.default-top-k:5}") int defaultTopK,
            @Value("${search.max-top-k:50}") int maxTopK
    ) {
        this.queryFilter = queryFilter;
        this.embeddingCache = embeddingCache;
        this.resultCache = resultCache;
        this.batchProcessor = batchProcessor;
        this.embeddingProvider = embeddingProvider;
        this.searchBackend = searchBackend;
        this.parallelSearch = parallelSearch;
        this.meterRegistry = meterRegistry;
        this.searchLogService = searchLogService;
        this.maxTopK = Math.max(1, maxTopK);
        this.defaultTopK = Math.min(Math.max(1, defaultTopK), this.maxTopK);
    }

    public SearchResponse search(String tenantId, String query, Integer topK) {
        return search(tenantId, query, topK, UUID.randomUUID().toString());
    }

    /**
     * Classify, then result cache, then embedding cache, then provider. The provider is only called
     * when both caches miss. Provider or backend failures degrade to an empty answer.
     */
    public SearchResponse search(String tenantId, String query, Integer topK, String traceId) {
        validate(tenantId, query);
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        long start = System.nanoTime();
        int resolvedTopK = resolveTopK(topK);
        log.info("trace_id={} event=search_start tenant_id={} query=\"{}\" top_k={}",
                effectiveTraceId, tenantId, CacheKeys.sanitizeForLog(query), resolvedTopK);

        if (!queryFilter.needsEmbeddingSearch(query)) {
            SearchResponse filtered = SearchResponse.filtered(tenantId, query, queryFilter.getDefaultResponse(query));
            record(effectiveTraceId, start, filtered);
            return filtered;
        }

        String lockKey = resultCache.generateKey(tenantId, query);
        Object lock = inFlightLocks.computeIfAbsent(lockKey, ignored -> new Object());
        try {
            synchronized (lock) {
                return complete(effectiveTraceId, start, resolvedTopK,
                        resolveUncached(tenantId, query, resolvedTopK, effectiveTraceId));
            }
        } finally {
            inFlightLocks.remove(lockKey, lock);
        }
    }

    /**
     * Answers several queries for one tenant. Queries that miss both caches are embedded together
     * in one batched provider call, then all searches run in parallel. Responses follow input order.
     */
    public List<SearchResponse> searchBatch(String tenantId, List<String> queries, Integer topK) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (queries == null || queries.isEmpty()) {
            return List.of();
        }
        String traceId = UUID.randomUUID().toString();
        long start = System.nanoTime();
        int resolvedTopK = resolveTopK(topK);
        long generation = generationOf(tenantId).get();
        SearchResponse[] responses = new SearchResponse[queries.size()];
        Map<Integer, ResultSource> pendingSources = new LinkedHashMap<>();
        Map<String, float[]> vectors = new HashMap<>();
        Map<String, String> toEmbed = new LinkedHashMap<>();

        for (int i = 0; i < queries.size(); i++) {
            String query = queries.get(i);
            if (query == null || query.isBlank()) {
                responses[i] = SearchResponse.degraded(tenantId, query, queryFilter.getDefaultResponse(query));
                continue;
            }
            if (!queryFilter.needsEmbeddingSearch(query)) {
                responses[i] = SearchResponse.filtered(tenantId, query, queryFilter.getDefaultResponse(query));
                continue;
            }
            Optional<List<SearchHit>> cached = resultCache.get(tenantId, query);
            if (cached.isPresent()) {
                responses[i] = SearchResponse.of(tenantId, query, ResultSource.RESULT_CACHE,
                        limit(cached.get(), resolvedTopK));
                continue;
            }
            String key = CacheKeys.normalizeQuery(query);
            if (vectors.containsKey(key) || toEmbed.containsKey(key)) {
                pendingSources.put(i, vectors.containsKey(key) ? ResultSource.EMBEDDING_CACHE : ResultSource.NO_CACHE);
                continue;
            }
            Optional<float[]> cachedVector = embeddingCache.get(query);
            if (cachedVector.isPresent()) {
                vectors.put(key, cachedVector.get());
                pendingSources.put(i, ResultSource.EMBEDDING_CACHE);
            } else {
                toEmbed.put(key, query);
                pendingSources.put(i, ResultSource.NO_CACHE);
            }
        }

        if (!toEmbed.isEmpty()) {
            List<String> batch = new ArrayList<>(toEmbed.values());
            try {
                List<float[]> embedded = batchProcessor.generateBatch(batch, embeddingProvider);
                for (int i = 0; i < batch.size(); i++) {
                    embeddingCache.set(batch.get(i), embedded.get(i));
                    vectors.put(CacheKeys.normalizeQuery(batch.get(i)), embedded.get(i));
                }
            } catch (EmbeddingBatchException ex) {
                log.warn("trace_id={} event=batch_embedding_failed tenant_id={} queries={} cause={}",
                        traceId, tenantId, batch.size(), ex.toString());
            }
        }

        Map<String, List<Integer>> positionsByKey = new LinkedHashMap<>();
        for (Map.Entry<Integer, ResultSource> pending : pendingSources.entrySet()) {
            String query = queries.get(pending.getKey());
            String key = CacheKeys.normalizeQuery(query);
            if (!vectors.containsKey(key)) {
                responses[pending.getKey()] = SearchResponse.degraded(tenantId, query, queryFilter.getDefaultResponse(query));
                continue;
            }
            positionsByKey.computeIfAbsent(key, ignored -> new ArrayList<>()).add(pending.getKey());
        }

        List<String> searchKeys = new ArrayList<>(positionsByKey.keySet());
        List<SearchTask> tasks = new ArrayList<>(searchKeys.size());
        for (String key : searchKeys) {
            tasks.add(new SearchTask(tenantId, queries.get(positionsByKey.get(key).get(0)), maxTopK));
        }

        List<TaskOutcome<SearchHit>> outcomes = parallelSearch.searchMultipleDetailed(tasks,
                (tenant, query, k) -> searchBackend.search(tenant, vectors.get(CacheKeys.normalizeQuery(query)), k));
        for (int i = 0; i < outcomes.size(); i++) {
            TaskOutcome<SearchHit> outcome = outcomes.get(i);
            if (outcome.isSuccess()) {
                cacheIfCurrent(tenantId, tasks.get(i).query(), outcome.results(), generation, traceId);
            }
            for (int index : positionsByKey.get(searchKeys.get(i))) {
                String query = queries.get(index);
                responses[index] = outcome.isSuccess()
                        ? SearchResponse.of(tenantId, query, pendingSources.get(index), limit(outcome.results(), resolvedTopK))
                        : SearchResponse.degraded(tenantId, query, queryFilter.getDefaultResponse(query));
            }
        }

        for (SearchResponse response : responses) {
            incrementCounter(response.getSource());
        }
        log.info("trace_id={} event=search_batch_complete tenant_id={} queries={} embedded={} searched={} total_ms={}",
                traceId, tenantId, queries.size(), toEmbed.size(), tasks.size(), elapsedMillis(start));
        return List.of(responses);
    }

    /**
     * Drops the tenant's cached result lists. Searches already in flight for the tenant will not
     * cache what they return.
     */
    public int invalidateTenant(String tenantId) {
        AtomicLong generation = generationOf(tenantId);
        int removed;
        synchronized (generation) {
            generation.incrementAndGet();
            removed = resultCache.invalidateAgent(tenantId);
        }
        log.info("event=result_cache_invalidated tenant_id={} entries={}", tenantId, removed);
        return removed;
    }

    private SearchResponse resolveUncached(String tenantId, String query, int topK, String traceId) {
        Optional<List<SearchHit>> cached = resultCache.get(tenantId, query);
        if (cached.isPresent()) {
            return SearchResponse.of(tenantId, query, ResultSource.RESULT_CACHE, limit(cached.get(), topK));
        }

        long generation = generationOf(tenantId).get();
        ResultSource source = ResultSource.EMBEDDING_CACHE;
        float[] embedding = embeddingCache.get(query).orElse(null);
        if (embedding == null) {
            source = ResultSource.NO_CACHE;
            try {
                embedding = batchProcessor.generateBatch(List.of(query), embeddingProvider).get(0);
            } catch (EmbeddingBatchException ex) {
                log.warn("trace_id={} event=embedding_failed tenant_id={} cause={}", traceId, tenantId, ex.toString());
                return SearchResponse.degraded(tenantId, query, queryFilter.getDefaultResponse(query));
            }
            embeddingCache.set(query, embedding);
        }

        // Fetched at maxTopK so the cached list can answer any later topK for this query.
        List<SearchHit> results;
        try {
            results = searchBackend.search(tenantId, embedding, maxTopK);
        } catch (Exception ex) {
            log.warn("trace_id={} event=vector_search_failed tenant_id={} cause={}", traceId, tenantId, ex.toString());
            return SearchResponse.degraded(tenantId, query, queryFilter.getDefaultResponse(query));
        }
        List<SearchHit> safeResults = results == null ? List.of() : results;
        cacheIfCurrent(tenantId, query, safeResults, generation, traceId);
        return SearchResponse.of(tenantId, query, source, limit(safeResults, topK));
    }

    private void cacheIfCurrent(String tenantId, String query, List<SearchHit> results, long generation, String traceId) {
        AtomicLong current = generationOf(tenantId);
        synchronized (current) {
            if (current.get() == generation) {
                resultCache.set(tenantId, query, results);
                return;
            }
        }
        log.info("trace_id={} event=result_cache_write_skipped tenant_id={} reason=invalidated", traceId, tenantId);
    }

    private AtomicLong generationOf(String tenantId) {
        return tenantGenerations.computeIfAbsent(tenantId, ignored -> new AtomicLong());
    }

    private SearchResponse complete(String traceId, long startNanos, int topK, SearchResponse response) {
        double totalMs = record(traceId, startNanos, response);
        if (searchLogService != null) {
            searchLogService.write(response.getTenantId(), response.getQuery(), topK, totalMs, response.getSource().name());
        }
        return response;
    }

    private double record(String traceId, long startNanos, SearchResponse response) {
        incrementCounter(response.getSource());
        double totalMs = elapsedMillis(startNanos);
        log.info("trace_id={} event=search_complete source={} results={} total_ms={}",
                traceId, response.getSource().label(), response.getResults().size(), totalMs);
        return totalMs;
    }

    private int resolveTopK(Integer topK) {
        if (topK == null || topK <= 0) {
            return defaultTopK;
        }
        return Math.min(topK, maxTopK);
    }

    private static void validate(String tenantId, String query) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
    }

    private static List<SearchHit> limit(List<SearchHit> results, int topK) {
        return results.size() <= topK ? results : List.copyOf(results.subList(0, topK));
    }

    private void incrementCounter(ResultSource source) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter("search_request_total", "source", source.label()).increment();
    }

    private static double elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
