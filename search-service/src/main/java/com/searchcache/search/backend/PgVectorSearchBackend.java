package com.searchcache.search.backend;

import com.searchcache.search.model.SearchHit;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
public class PgVectorSearchBackend implements SearchBackend {

    private static final String NEAREST_NEIGHBORS_SQL = """
            SELECT document_id, COALESCE(content, '') AS content,
                   (1 - (embedding <=> CAST(? AS vector))) AS similarity
            FROM document_embeddings
            WHERE agent_id = ?
            ORDER BY embedding <=> CAST(? AS vector)
            LIMIT ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final MeterRegistry meterRegistry;

    public PgVectorSearchBackend(JdbcTemplate jdbcTemplate, MeterRegistry meterRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public List<SearchHit> search(String tenantId, float[] embedding, int topK) {
        if (embedding == null || embedding.length == 0 || topK <= 0) {
            return List.of();
        }
        String vectorLiteral = toVectorLiteral(embedding);
        long start = System.nanoTime();
        try {
            return jdbcTemplate.query(
                    NEAREST_NEIGHBORS_SQL,
                    (rs, rowNum) -> new SearchHit(
                            rs.getString("document_id"),
                            rs.getString("content"),
                            rs.getDouble("similarity")
                    ),
                    vectorLiteral,
                    tenantId,
                    vectorLiteral,
                    topK
            );
        } finally {
            if (meterRegistry != null) {
                meterRegistry.timer("vector_search_latency_ms")
                        .record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            }
        }
    }

    static String toVectorLiteral(float[] embedding) {
        StringBuilder literal = new StringBuilder(embedding.length * 8).append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                literal.append(',');
            }
            literal.append(embedding[i]);
        }
        return literal.append(']').toString();
    }
}
