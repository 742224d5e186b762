package com.ragengine.embedding;

/**
 * Synchronous text-to-vector backend. Implementations report failures through
 * {@link EmbeddingResult#hasError()} instead of throwing.
 */
public interface EmbeddingProvider {
    String id();

    EmbeddingResult embed(String apiKey, String model, String text);

    default boolean requiresCredential() {
        return true;
    }
}
