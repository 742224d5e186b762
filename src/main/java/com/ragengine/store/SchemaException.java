package com.ragengine.store;

public class SchemaException extends RagStoreException {
    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
