package com.ragengine.store;

public class TransactionException extends RagStoreException {
    public TransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
