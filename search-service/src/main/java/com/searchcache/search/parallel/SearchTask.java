package com.searchcache.search.parallel;

public record SearchTask(String tenantId, String query, int topK) {
}
