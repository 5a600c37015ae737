package com.searchcache.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {
    private String tenantId;
    private String query;
    private ResultSource source;
    private String defaultResponse;
    private List<SearchHit> results;

    public SearchResponse() {
    }

    public SearchResponse(
            String tenantId,
            String query,
            ResultSource source,
            String defaultResponse,
            List<SearchHit> results
    ) {
        this.tenantId = tenantId;
        this.query = query;
        this.source = source;
        this.defaultResponse = defaultResponse;
        this.results = results == null ? List.of() : results;
    }

    public static SearchResponse filtered(String tenantId, String query, String defaultResponse) {
        return new SearchResponse(tenantId, query, ResultSource.FILTERED, defaultResponse, List.of());
    }

    public static SearchResponse degraded(String tenantId, String query, String defaultResponse) {
        return new SearchResponse(tenantId, query, ResultSource.DEGRADED, defaultResponse, List.of());
    }

    public static SearchResponse of(String tenantId, String query, ResultSource source, List<SearchHit> results) {
        return new SearchResponse(tenantId, query, source, null, results);
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public ResultSource getSource() {
        return source;
    }

    public void setSource(ResultSource source) {
        this.source = source;
    }

    public String getDefaultResponse() {
        return defaultResponse;
    }

    public void setDefaultResponse(String defaultResponse) {
        this.defaultResponse = defaultResponse;
    }

    public List<SearchHit> getResults() {
        return results;
    }

    public void setResults(List<SearchHit> results) {
        this.results = results;
    }
}
