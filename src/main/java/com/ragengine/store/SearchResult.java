package com.ragengine.store;

public record SearchResult(long fragmentId, long fileId, int chunkIndex, String content, double score) {
}
