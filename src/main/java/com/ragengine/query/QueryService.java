package com.ragengine.query;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragengine.embedding.CredentialResolver;
import com.ragengine.embedding.EmbeddingProvider;
import com.ragengine.embedding.EmbeddingProviders;
import com.ragengine.embedding.EmbeddingResult;
import com.ragengine.store.IndexConfig;
import com.ragengine.store.SearchResult;
import com.ragengine.store.SimilaritySearch;

public class QueryService {
    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final EmbeddingProviders providers;
    private final CredentialResolver credentials;

    public QueryService(EmbeddingProviders providers, CredentialResolver credentials) {
        this.providers = providers;
        this.credentials = credentials;
    }

    public QueryResult query(QueryRequest request) {
        if (request.queryText() == null || request.queryText().isBlank()) {
            throw new IllegalArgumentException("Query text is required");
        }
        if (request.dbPath() == null || request.dbPath().toString().isBlank()) {
            throw new IllegalArgumentException("Database path is required");
        }
        if (!Files.isRegularFile(request.dbPath())) {
            throw new IllegalArgumentException("RAG database '" + request.dbPath() + "' does not exist");
        }

        IndexConfig config = SimilaritySearch.getIndexConfig(request.dbPath());
        log.debug("Index {} was built with {}/{}", request.dbPath(), config.providerId(), config.modelId());

        EmbeddingProvider provider = providers.find(config.providerId())
                .orElseThrow(() -> new IllegalStateException(
                        "No embedding backend registered for provider '" + config.providerId() + "'"));
        String apiKey = EmbeddingProviders.resolveApiKey(provider, credentials)
                .orElseThrow(() -> new IllegalStateException(
                        "No API key configured for provider '" + config.providerId() + "'"));

        EmbeddingResult embedding = provider.embed(apiKey, config.modelId(), request.queryText());
        if (embedding.hasError()) {
            throw new EmbeddingFailedException("Failed to embed query: " + embedding.errorMsg());
        }
        if (embedding.isEmpty()) {
            throw new EmbeddingFailedException("Failed to embed query: empty embedding returned");
        }

        List<SearchResult> hits = SimilaritySearch.findMostRelevantChunks(request.dbPath(), embedding.vector(),
                request.maxResults(), request.minRelevance());
        if (hits.isEmpty()) {
            log.info("No fragments matched the query");
            return QueryResult.empty();
        }

        Map<Long, String> sources = SimilaritySearch.resolveSourcePaths(request.dbPath(),
                hits.stream().map(SearchResult::fileId).toList());

        StringBuilder context = new StringBuilder();
        List<RetrievedChunk> retrieved = new ArrayList<>();
        for (SearchResult hit : hits) {
            String label = sources.getOrDefault(hit.fileId(), "file_id=" + hit.fileId());
            context.append(formatBlock(label, hit.score(), hit.content()));
            retrieved.add(new RetrievedChunk(label, hit.score(), hit.content()));
        }
        log.info("Retrieved {} fragments (best score {})", retrieved.size(),
                String.format(Locale.ROOT, "%.4f", hits.get(0).score()));
        return new QueryResult(context.toString(), retrieved);
    }

    static String formatBlock(String label, double score, String content) {
        return String.format(Locale.ROOT, "[Source: %s (Score: %.4f)]", label, score) + "\n" + content + "\n\n";
    }
}
