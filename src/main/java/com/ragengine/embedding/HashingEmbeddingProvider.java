package com.ragengine.embedding;

import java.util.Locale;

public class HashingEmbeddingProvider implements EmbeddingProvider {
    public static final String ID = "local";

    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean requiresCredential() {
        return false;
    }

    public int dimension() {
        return dimension;
    }

    @Override
    public EmbeddingResult embed(String apiKey, String model, String text) {
        if (text == null || text.isBlank()) {
            return EmbeddingResult.failure("Cannot embed blank text");
        }
        float[] vector = new float[dimension];
        int tokenCount = 0;
        for (String token : text.toLowerCase(Locale.ROOT).split("\\W+")) {
            if (token.isBlank()) {
                continue;
            }
            tokenCount++;
            addHashed(vector, "tok:" + token, 1.0f);
            for (int i = 0; i + 3 <= token.length(); i++) {
                addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
            }
        }
        if (tokenCount == 0) {
            return EmbeddingResult.failure("No word tokens to embed");
        }
        normalize(vector);
        return EmbeddingResult.success(vector, new TokenUsage(tokenCount, 0, tokenCount));
    }

    private void addHashed(float[] vector, String key, float weight) {
        vector[Math.floorMod(key.hashCode(), vector.length)] += weight;
    }

    private static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
