package com.ragengine.query;

import java.nio.file.Path;

public record QueryRequest(String queryText, Path dbPath, int maxResults, double minRelevance) {
}
