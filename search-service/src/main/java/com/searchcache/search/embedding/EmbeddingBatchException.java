package com.searchcache.search.embedding;

public class EmbeddingBatchException extends RuntimeException {

    private final int chunkOffset;
    private final int chunkSize;

    public EmbeddingBatchException(String message, int chunkOffset, int chunkSize, Throwable cause) {
        super(message, cause);
        this.chunkOffset = chunkOffset;
        this.chunkSize = chunkSize;
    }

    public EmbeddingBatchException(String message, int chunkOffset, int chunkSize) {
        this(message, chunkOffset, chunkSize, null);
    }

    public int getChunkOffset() {
        return chunkOffset;
    }

    public int getChunkSize() {
        return chunkSize;
    }
}
