package com.searchcache.search.backend;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PgVectorSearchBackendTest {

    @Test
    void testVectorLiteralFormat() {
        assertThat(PgVectorSearchBackend.toVectorLiteral(new float[]{0.5f, -1.0f, 2.25f}))
                .isEqualTo("[0.5,-1.0,2.25]");
        assertThat(PgVectorSearchBackend.toVectorLiteral(new float[]{3f})).isEqualTo("[3.0]");
    }

    @Test
    void testEmptyInputsSkipTheDatabase() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PgVectorSearchBackend backend = new PgVectorSearchBackend(null, registry);

        assertThat(backend.search("agent1", new float[0], 5)).isEmpty();
        assertThat(backend.search("agent1", null, 5)).isEmpty();
        assertThat(backend.search("agent1", new float[]{1f}, 0)).isEmpty();
        assertThat(registry.find("vector_search_latency_ms").timer()).isNull();
    }
}
