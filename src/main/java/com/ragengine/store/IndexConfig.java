package com.ragengine.store;

public record IndexConfig(String providerId, String modelId) {
}
