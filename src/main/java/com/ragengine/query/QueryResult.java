package com.ragengine.query;

import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public record QueryResult(String context, List<RetrievedChunk> results) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public QueryResult {
        results = List.copyOf(results);
    }

    public static QueryResult empty() {
        return new QueryResult("", List.of());
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public String resultsJson() {
        try {
            return MAPPER.writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize query results", e);
        }
    }
}
