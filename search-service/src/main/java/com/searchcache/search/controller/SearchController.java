package com.searchcache.search.controller;

import com.searchcache.search.model.BatchSearchRequest;
import com.searchcache.search.model.SearchRequest;
import com.searchcache.search.model.SearchResponse;
import com.searchcache.search.service.SearchOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/search")
public class SearchController {

    private final SearchOrchestrator searchOrchestrator;

    public SearchController(SearchOrchestrator searchOrchestrator) {
        this.searchOrchestrator = searchOrchestrator;
    }

    @PostMapping
    public SearchResponse search(
            @RequestBody SearchRequest request,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId
    ) {
        String effectiveTraceId = (traceId == null || traceId.isBlank()) ? UUID.randomUUID().toString() : traceId;
        return searchOrchestrator.search(request.getTenantId(), request.getQuery(), request.getTopK(), effectiveTraceId);
    }

    @PostMapping("/batch")
    public List<SearchResponse> searchBatch(@RequestBody BatchSearchRequest request) {
        return searchOrchestrator.searchBatch(request.getTenantId(), request.getQueries(), request.getTopK());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", ex.getMessage()));
    }
}
