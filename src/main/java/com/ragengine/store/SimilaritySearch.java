package com.ragengine.store;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SimilaritySearch {
    private static final Logger log = LoggerFactory.getLogger(SimilaritySearch.class);

    static final Comparator<SearchResult> RANKING = Comparator
            .comparingDouble(SearchResult::score).reversed()
            .thenComparingLong(SearchResult::fragmentId);

    private SimilaritySearch() {
    }

    public static IndexConfig getIndexConfig(Path dbPath) {
        List<IndexConfig> pairs = new ArrayList<>();
        try (Connection connection = SqliteConnections.openExisting(dbPath, "rag_index_config");
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT DISTINCT provider, model FROM source_files")) {
            while (rs.next()) {
                pairs.add(new IndexConfig(rs.getString(1), rs.getString(2)));
            }
        } catch (SQLException e) {
            throw new RagStoreException("Failed to query source_files for index configuration: " + e.getMessage(), e);
        }

        if (pairs.isEmpty()) {
            throw new IndexConfigException("RAG index is empty; no source_files rows found in " + dbPath);
        }
        if (pairs.size() > 1) {
            throw new IndexConfigException(
                    "Mixed-model RAG is not supported: multiple provider/model pairs found in source_files " + pairs);
        }
        return pairs.get(0);
    }

    public static double cosineSimilarity(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            double va = a[i];
            double vb = b[i];
            dot += va * vb;
            normA += va * va;
            normB += vb * vb;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double denominator = Math.sqrt(normA) * Math.sqrt(normB);
        double score = dot / denominator;
        if (Double.isNaN(score) || Double.isInfinite(score)) {
            return 0.0;
        }
        return score;
    }

    public static List<SearchResult> findMostRelevantChunks(Path dbPath, float[] queryVector, int limit,
            double minRelevance) {
        if (limit <= 0 || queryVector == null || queryVector.length == 0) {
            return List.of();
        }

        List<SearchResult> results = new ArrayList<>();
        int skipped = 0;
        try (Connection connection = SqliteConnections.openExisting(dbPath, "rag_search");
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(
                        "SELECT id, file_id, chunk_index, content, embedding FROM fragments")) {
            while (rs.next()) {
                float[] embedding = EmbeddingCodec.decode(rs.getBytes(5));
                if (embedding.length != queryVector.length) {
                    skipped++;
                    continue;
                }
                double score = cosineSimilarity(queryVector, embedding);
                if (score < minRelevance) {
                    continue;
                }
                results.add(new SearchResult(rs.getLong(1), rs.getLong(2), rs.getInt(3), rs.getString(4), score));
            }
        } catch (SQLException e) {
            throw new RagStoreException("Failed to query fragments for similarity search: " + e.getMessage(), e);
        }
        if (skipped > 0) {
            log.debug("Skipped {} fragments with malformed or incompatible embeddings", skipped);
        }

        results.sort(RANKING);
        return results.size() > limit ? List.copyOf(results.subList(0, limit)) : List.copyOf(results);
    }

    public static Map<Long, String> resolveSourcePaths(Path dbPath, Collection<Long> fileIds) {
        Map<Long, String> pathsById = new LinkedHashMap<>();
        if (fileIds.isEmpty()) {
            return pathsById;
        }
        try (Connection connection = SqliteConnections.openExisting(dbPath, "rag_sources");
                PreparedStatement statement = connection.prepareStatement(
                        "SELECT file_path FROM source_files WHERE id = ?")) {
            for (Long fileId : fileIds) {
                if (pathsById.containsKey(fileId)) {
                    continue;
                }
                statement.setLong(1, fileId);
                try (ResultSet rs = statement.executeQuery()) {
                    if (rs.next()) {
                        pathsById.put(fileId, rs.getString(1));
                    }
                }
            }
        } catch (SQLException e) {
            throw new RagStoreException("Failed to resolve source file paths: " + e.getMessage(), e);
        }
        return pathsById;
    }
}
