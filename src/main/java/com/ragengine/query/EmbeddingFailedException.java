package com.ragengine.query;

public class EmbeddingFailedException extends RuntimeException {
    public EmbeddingFailedException(String message) {
        super(message);
    }
}
