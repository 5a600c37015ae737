package com.searchcache.search.embedding;

import java.util.List;

public interface EmbeddingProvider {

    /**
     * Embeds up to {@link #maxBatchSize()} queries in one call; the i-th vector belongs to the
     * i-th query.
     */
    List<float[]> embed(List<String> queries) throws Exception;

    int maxBatchSize();
}
