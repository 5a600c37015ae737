package com.searchcache.search.model;

public class SearchHit {
    private String documentId;
    private String content;
    private double similarity;

    public SearchHit() {
    }

    public SearchHit(String documentId, String content, double similarity) {
        this.documentId = documentId;
        this.content = content == null ? "" : content;
        this.similarity = similarity;
    }

    public String getDocumentId() {
        return documentId;
    }

    public void setDocumentId(String documentId) {
        this.documentId = documentId;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public double getSimilarity() {
        return similarity;
    }

    public void setSimilarity(double similarity) {
        this.similarity = similarity;
    }
}
