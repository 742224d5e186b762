package com.ragengine.store;

public class IndexConfigException extends RuntimeException {
    public IndexConfigException(String message) {
        super(message);
    }
}
