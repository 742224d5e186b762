package com.ragengine.store;

public class RagStoreException extends RuntimeException {
    public RagStoreException(String message) {
        super(message);
    }

    public RagStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
