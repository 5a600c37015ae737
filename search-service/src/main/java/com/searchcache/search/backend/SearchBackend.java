package com.searchcache.search.backend;

import com.searchcache.search.model.SearchHit;

import java.util.List;

public interface SearchBackend {

    /**
     * Returns up to {@code topK} hits from the tenant's corpus, most similar first.
     */
    List<SearchHit> search(String tenantId, float[] embedding, int topK) throws Exception;
}
