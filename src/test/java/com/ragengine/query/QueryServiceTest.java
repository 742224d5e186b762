package com.ragengine.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragengine.embedding.EmbeddingProvider;
import com.ragengine.embedding.EmbeddingProviders;
import com.ragengine.embedding.EmbeddingResult;
import com.ragengine.embedding.HashingEmbeddingProvider;
import com.ragengine.embedding.StaticCredentialResolver;
import com.ragengine.embedding.TokenUsage;
import com.ragengine.ingest.IndexingRequest;
import com.ragengine.ingest.IndexingService;
import com.ragengine.ingest.IndexingStatus;
import com.ragengine.store.FragmentSchema;
import com.ragengine.store.FragmentWriter;
import com.ragengine.store.IndexConfigException;
import com.ragengine.store.SqliteConnections;

class QueryServiceTest {

    @TempDir
    Path tempDir;

    private Path db;
    private AxisProvider axis;
    private QueryService service;

    @BeforeEach
    void setUp() throws Exception {
        db = tempDir.resolve("rag.db");
        axis = new AxisProvider();
        service = new QueryService(EmbeddingProviders.of(axis), new StaticCredentialResolver(Map.of("axis", "key")));
        try (Connection connection = SqliteConnections.openForWrite(db, "test");
                FragmentWriter writer = new FragmentWriter(connection)) {
            FragmentSchema.ensureSchema(connection);
            long fileId = writer.upsertSourceFile("/docs/axes.txt", "axis", "axis-2d", 0, "{}");
            writer.insertFragment(fileId, 0, "points along x", new float[] { 1, 0 });
            writer.insertFragment(fileId, 1, "points along y", new float[] { 0, 1 });
        }
    }

    @Test
    void shouldFormatContextBlocksInRankOrder() {
        QueryResult result = service.query(new QueryRequest("x", db, 5, 0.0));

        assertEquals("[Source: /docs/axes.txt (Score: 1.0000)]\npoints along x\n\n"
                + "[Source: /docs/axes.txt (Score: 0.0000)]\npoints along y\n\n", result.context());
        assertEquals(2, result.results().size());
        assertEquals(new RetrievedChunk("/docs/axes.txt", 1.0, "points along x"), result.results().get(0));
        assertEquals(List.of("axis-2d"), axis.models);
    }

    @Test
    void shouldApplyLimitAndMinimumRelevance() {
        assertEquals(1, service.query(new QueryRequest("x", db, 1, 0.0)).results().size());
        assertEquals(1, service.query(new QueryRequest("y", db, 5, 0.5)).results().size());

        QueryResult none = service.query(new QueryRequest("x", db, 5, 1.5));
        assertTrue(none.isEmpty());
        assertEquals("", none.context());
        assertEquals("[]", none.resultsJson());
    }

    @Test
    void shouldSerializeResultsAsJson() throws Exception {
        QueryResult result = service.query(new QueryRequest("y", db, 1, 0.0));

        JsonNode json = new ObjectMapper().readTree(result.resultsJson());
        assertTrue(json.isArray());
        assertEquals("/docs/axes.txt", json.get(0).get("source").asText());
        assertEquals(1.0, json.get(0).get("score").asDouble(), 1e-9);
        assertEquals("points along y", json.get(0).get("text").asText());
    }

    @Test
    void shouldFallBackToFileIdLabel() {
        assertEquals("[Source: file_id=7 (Score: 0.8765)]\nbody\n\n", QueryService.formatBlock("file_id=7", 0.87654, "body"));
    }

    @Test
    void shouldValidateRequest() {
        assertThrows(IllegalArgumentException.class, () -> service.query(new QueryRequest(" ", db, 5, 0.0)));
        assertThrows(IllegalArgumentException.class, () -> service.query(new QueryRequest("x", null, 5, 0.0)));
        assertThrows(IllegalArgumentException.class,
                () -> service.query(new QueryRequest("x", tempDir.resolve("absent.db"), 5, 0.0)));
    }

    @Test
    void shouldRejectMixedModelIndex() throws Exception {
        try (Connection connection = SqliteConnections.openExisting(db, "test");
                FragmentWriter writer = new FragmentWriter(connection)) {
            writer.upsertSourceFile("/docs/other.txt", "axis", "axis-3d", 0, "{}");
        }

        IndexConfigException error = assertThrows(IndexConfigException.class,
                () -> service.query(new QueryRequest("x", db, 5, 0.0)));
        assertTrue(error.getMessage().contains("Mixed-model"));
    }

    @Test
    void shouldRejectEmptyIndex() throws Exception {
        try (Connection connection = SqliteConnections.openExisting(db, "test");
                Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM source_files");
        }

        assertThrows(IndexConfigException.class, () -> service.query(new QueryRequest("x", db, 5, 0.0)));
    }

    @Test
    void shouldRequireCredentialAndBackend() {
        QueryService noKey = new QueryService(EmbeddingProviders.of(axis), new StaticCredentialResolver(Map.of()));
        QueryService noBackend = new QueryService(EmbeddingProviders.of(new HashingEmbeddingProvider(8)),
                new StaticCredentialResolver(Map.of("axis", "key")));

        assertThrows(IllegalStateException.class, () -> noKey.query(new QueryRequest("x", db, 5, 0.0)));
        assertThrows(IllegalStateException.class, () -> noBackend.query(new QueryRequest("x", db, 5, 0.0)));
    }

    @Test
    void shouldFailWhenQueryEmbeddingFails() {
        EmbeddingFailedException error = assertThrows(EmbeddingFailedException.class,
                () -> service.query(new QueryRequest("fail", db, 5, 0.0)));
        assertTrue(error.getMessage().contains("quota exceeded"));
    }

    @Test
    void shouldAnswerFromIndexBuiltWithLocalProvider() throws Exception {
        Path docs = tempDir.resolve("docs");
        Files.createDirectories(docs);
        Files.writeString(docs.resolve("sqlite.md"), "SQLite keeps the fragments table and the source files table.");
        Files.writeString(docs.resolve("chunker.md"), "Markdown headers always start a fresh chunk.");
        Path localDb = tempDir.resolve("local.db");
        EmbeddingProviders local = EmbeddingProviders.of(new HashingEmbeddingProvider(256));
        StaticCredentialResolver noKeys = new StaticCredentialResolver(Map.of());

        IndexingService indexer = new IndexingService(local, noKeys);
        assertEquals(IndexingStatus.COMPLETED, indexer.run(
                new IndexingRequest(docs, localDb, "{}", 1000, 200, "", "local", "hash-256", false)).status());

        QueryResult result = new QueryService(local, noKeys).query(
                new QueryRequest("which table holds fragments in sqlite", localDb, 1, 0.0));

        assertEquals(1, result.results().size());
        assertTrue(result.results().get(0).source().endsWith("sqlite.md"));
    }

    private static final class AxisProvider implements EmbeddingProvider {
        final List<String> models = new ArrayList<>();

        @Override
        public String id() {
            return "axis";
        }

        @Override
        public EmbeddingResult embed(String apiKey, String model, String text) {
            models.add(model);
            if ("fail".equals(text)) {
                return EmbeddingResult.failure("quota exceeded");
            }
            float[] vector = "y".equals(text) ? new float[] { 0, 1 } : new float[] { 1, 0 };
            return EmbeddingResult.success(vector, TokenUsage.NONE);
        }
    }
}
