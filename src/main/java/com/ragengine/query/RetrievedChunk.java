package com.ragengine.query;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({ "source", "score", "text" })
public record RetrievedChunk(String source, double score, String text) {
}
