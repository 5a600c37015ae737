package com.searchcache.search.controller;

import com.searchcache.cache.CacheStats;
import com.searchcache.cache.EmbeddingCache;
import com.searchcache.cache.ResultCache;
import com.searchcache.search.model.SearchHit;
import com.searchcache.search.service.SearchOrchestrator;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/cache")
public class CacheController {

    private final EmbeddingCache embeddingCache;
    private final ResultCache<SearchHit> resultCache;
    private final SearchOrchestrator searchOrchestrator;

    public CacheController(
            EmbeddingCache embeddingCache,
            ResultCache<SearchHit> resultCache,
            SearchOrchestrator searchOrchestrator
    ) {
        this.embeddingCache = embeddingCache;
        this.resultCache = resultCache;
        this.searchOrchestrator = searchOrchestrator;
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("embeddingCache", describe(embeddingCache.getStats(), embeddingCache.maxSize(), embeddingCache.ttlMillis()));
        body.put("resultCache", describe(resultCache.getStats(), resultCache.maxSize(), resultCache.ttlMillis()));
        return body;
    }

    @DeleteMapping("/tenants/{tenantId}")
    public Map<String, Object> invalidateTenant(@PathVariable("tenantId") String tenantId) {
        int removed = searchOrchestrator.invalidateTenant(tenantId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tenantId", tenantId);
        body.put("invalidated", removed);
        return body;
    }

    @DeleteMapping
    public String clear() {
        embeddingCache.clear();
        resultCache.clear();
        return "Caches cleared";
    }

    private static Map<String, Object> describe(CacheStats stats, int maxSize, long ttlMs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("hits", stats.hits());
        body.put("misses", stats.misses());
        body.put("hitRate", stats.hitRate());
        body.put("size", stats.size());
        body.put("evictions", stats.evictions());
        body.put("maxSize", maxSize);
        body.put("ttlMs", ttlMs);
        return body;
    }
}
