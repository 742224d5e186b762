package com.ragengine.embedding;

public record EmbeddingResult(float[] vector, TokenUsage usage, boolean hasError, String errorMsg) {

    public static EmbeddingResult success(float[] vector, TokenUsage usage) {
        return new EmbeddingResult(vector, usage == null ? TokenUsage.NONE : usage, false, "");
    }

    public static EmbeddingResult failure(String errorMsg) {
        return new EmbeddingResult(new float[0], TokenUsage.NONE, true, errorMsg);
    }

    public boolean isEmpty() {
        return vector == null || vector.length == 0;
    }
}
