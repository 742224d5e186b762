package com.ragengine.embedding;

public record TokenUsage(int inputTokens, int outputTokens, int totalTokens) {
    public static final TokenUsage NONE = new TokenUsage(0, 0, 0);
}
