package com.searchcache.search.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

@Service
public class SearchLogService {

    private static final Logger log = LoggerFactory.getLogger(SearchLogService.class);

    private final JdbcTemplate jdbcTemplate;

    public SearchLogService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void write(String tenantId, String query, int topK, double latencyMs, String source) {
        try {
            jdbcTemplate.update(
                    "INSERT INTO search_logs (agent_id, query_text, top_k, latency_ms, source) VALUES (?, ?, ?, ?, ?)",
                    tenantId,
                    query == null ? "" : query,
                    topK,
                    latencyMs,
                    source
            );
        } catch (Exception ex) {
            log.debug("search_logs write skipped: {}", ex.getMessage());
        }
    }
}
