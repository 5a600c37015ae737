package com.searchcache.search.parallel;

import java.util.List;

@FunctionalInterface
public interface SearchFunction<T> {
    List<T> search(String tenantId, String query, int topK) throws Exception;
}
