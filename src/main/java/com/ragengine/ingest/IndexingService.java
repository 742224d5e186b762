package com.ragengine.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragengine.embedding.CredentialResolver;
import com.ragengine.embedding.EmbeddingProvider;
import com.ragengine.embedding.EmbeddingProviders;
import com.ragengine.embedding.EmbeddingResult;
import com.ragengine.store.FragmentSchema;
import com.ragengine.store.FragmentWriter;
import com.ragengine.store.RagStoreException;
import com.ragengine.store.SchemaException;
import com.ragengine.store.SqliteConnections;
import com.ragengine.store.TransactionException;

public class IndexingService {
    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    public static final long DEFAULT_PROGRESS_INTERVAL_MS = 10_000;

    private final EmbeddingProviders providers;
    private final CredentialResolver credentials;
    private final Clock clock;
    private final long progressIntervalMs;
    private final Function<Path, Connection> connections;

    public IndexingService(EmbeddingProviders providers, CredentialResolver credentials) {
        this(providers, credentials, Clock.systemUTC(), DEFAULT_PROGRESS_INTERVAL_MS);
    }

    public IndexingService(EmbeddingProviders providers, CredentialResolver credentials, Clock clock,
            long progressIntervalMs) {
        this(providers, credentials, clock, progressIntervalMs,
                dbPath -> SqliteConnections.openForWrite(dbPath, "rag_indexer"));
    }

    IndexingService(EmbeddingProviders providers, CredentialResolver credentials, Clock clock,
            long progressIntervalMs, Function<Path, Connection> connections) {
        this.providers = providers;
        this.credentials = credentials;
        this.clock = clock;
        this.progressIntervalMs = Math.max(0, progressIntervalMs);
        this.connections = connections;
    }

    public IndexingReport run(IndexingRequest request) {
        return run(request, ProgressListener.NONE);
    }

    public CompletableFuture<IndexingReport> runAsync(IndexingRequest request, Executor executor) {
        return runAsync(request, ProgressListener.NONE, executor);
    }

    public CompletableFuture<IndexingReport> runAsync(IndexingRequest request, ProgressListener listener,
            Executor executor) {
        return CompletableFuture.supplyAsync(() -> run(request, listener), executor);
    }

    public IndexingReport run(IndexingRequest request, ProgressListener listener) {
        Optional<String> invalid = validate(request);
        if (invalid.isPresent()) {
            log.error("Indexing request rejected: {}", invalid.get());
            return IndexingReport.aborted(IndexingStatus.VALIDATION_FAILED, invalid.get());
        }

        Optional<EmbeddingProvider> provider = providers.find(request.providerId());
        if (provider.isEmpty()) {
            String message = "No embedding backend registered for provider '" + request.providerId() + "'";
            log.error(message);
            return IndexingReport.aborted(IndexingStatus.CREDENTIAL_MISSING, message);
        }
        Optional<String> apiKey = EmbeddingProviders.resolveApiKey(provider.get(), credentials);
        if (apiKey.isEmpty()) {
            String message = "No API key configured for provider '" + request.providerId() + "'";
            log.error(message);
            return IndexingReport.aborted(IndexingStatus.CREDENTIAL_MISSING, message);
        }

        IndexingReport report = null;
        try (Connection connection = connections.apply(request.dbPath());
                FragmentWriter writer = new FragmentWriter(connection)) {
            report = indexDatabase(request, provider.get(), apiKey.get(), connection, writer, listener);
        } catch (SchemaException e) {
            log.error("Schema setup failed for {}", request.dbPath(), e);
            return IndexingReport.aborted(IndexingStatus.SCHEMA_FAILED, e.getMessage());
        } catch (TransactionException e) {
            log.error("Transaction failed for {}", request.dbPath(), e);
            return IndexingReport.aborted(IndexingStatus.TRANSACTION_FAILED, e.getMessage());
        } catch (RagStoreException e) {
            log.error("Cannot open RAG database {}", request.dbPath(), e);
            return IndexingReport.aborted(IndexingStatus.SCHEMA_FAILED, e.getMessage());
        } catch (SQLException e) {
            log.warn("Failed to release RAG database {} after a settled run: {}", request.dbPath(), e.getMessage());
        }
        return report;
    }

    private IndexingReport indexDatabase(IndexingRequest request, EmbeddingProvider provider, String apiKey,
            Connection connection, FragmentWriter writer, ProgressListener listener) {
        FragmentSchema.ensureSchema(connection);
        if (request.clearDatabase()) {
            writer.clearAll();
            log.info("Cleared RAG database {}", request.dbPath());
        }

        List<Path> files;
        try {
            files = DocumentLoader.scanDirectory(request.directory(),
                    DocumentLoader.parseFilter(request.fileFilter()));
        } catch (IOException e) {
            log.error("Failed to scan {}", request.directory(), e);
            return IndexingReport.aborted(IndexingStatus.SCAN_FAILED,
                    "Failed to scan " + request.directory() + ": " + e.getMessage());
        }
        if (files.isEmpty()) {
            log.info("No files found to index in {}", request.directory());
            return new IndexingReport(IndexingStatus.COMPLETED, 0, 0, 0, 0, "No files found");
        }

        return indexFiles(request, files, provider, apiKey, writer, listener);
    }

    private IndexingReport indexFiles(IndexingRequest request, List<Path> files, EmbeddingProvider provider,
            String apiKey, FragmentWriter writer, ProgressListener listener) {
        ProgressThrottle throttle = new ProgressThrottle(listener);
        int filesIndexed = 0;
        int fragments = 0;
        int failedChunks = 0;

        writer.beginTransaction();
        try {
            for (int fileIndex = 0; fileIndex < files.size(); fileIndex++) {
                Path file = files.get(fileIndex);
                String content = DocumentLoader.readText(file);
                if (content.isEmpty()) {
                    log.debug("Skipping empty or unreadable file {}", file);
                    continue;
                }

                long fileId = writer.upsertSourceFile(file.toString(), request.providerId(), request.modelId(),
                        lastModifiedSeconds(file), request.metadataJson());
                writer.deleteFragments(fileId);
                filesIndexed++;

                FileType fileType = DocumentLoader.classify(file);
                List<String> chunks = TextChunker.split(content, request.chunkSize(), request.chunkOverlap(), fileType);
                log.debug("Indexing {} as {}: {} chunks", file, fileType, chunks.size());

                for (int i = 0; i < chunks.size(); i++) {
                    String chunk = chunks.get(i);
                    throttle.offer(new IndexingProgress(file.toString(), files.size(), fileIndex + 1, i + 1,
                            chunks.size(), fragments));
                    EmbeddingResult result = provider.embed(apiKey, request.modelId(), chunk);
                    if (result.hasError() || result.isEmpty()) {
                        failedChunks++;
                        log.warn("Skipping chunk {} of {}: {}", i, file,
                                result.hasError() ? result.errorMsg() : "empty embedding");
                    } else {
                        writer.insertFragment(fileId, i, chunk, result.vector());
                        fragments++;
                    }
                }
            }
        } catch (SQLException | RuntimeException e) {
            log.error("Indexing failed, rolling back", e);
            rollbackQuietly(writer, e);
            return IndexingReport.aborted(IndexingStatus.TRANSACTION_FAILED, e.getMessage());
        }

        try {
            writer.commit();
        } catch (TransactionException e) {
            log.error("Commit failed, rolling back", e);
            rollbackQuietly(writer, e);
            return IndexingReport.aborted(IndexingStatus.TRANSACTION_FAILED, e.getMessage());
        }

        log.info("Indexed {} fragments from {} of {} files into {} ({} chunks failed)",
                fragments, filesIndexed, files.size(), request.dbPath(), failedChunks);
        return new IndexingReport(IndexingStatus.COMPLETED, files.size(), filesIndexed, fragments, failedChunks,
                "Indexed " + fragments + " fragments");
    }

    static Optional<String> validate(IndexingRequest request) {
        if (request == null) {
            return Optional.of("request is required");
        }
        if (request.directory() == null || request.directory().toString().isBlank()) {
            return Optional.of("directory is required");
        }
        if (!Files.isDirectory(request.directory())) {
            return Optional.of("directory '" + request.directory() + "' does not exist");
        }
        if (request.dbPath() == null || request.dbPath().toString().isBlank()) {
            return Optional.of("database path is required");
        }
        if (request.providerId() == null || request.providerId().isBlank()) {
            return Optional.of("provider is required");
        }
        if (request.modelId() == null || request.modelId().isBlank()) {
            return Optional.of("model is required");
        }
        return Optional.empty();
    }

    private static long lastModifiedSeconds(Path file) {
        try {
            return Files.getLastModifiedTime(file).toMillis() / 1000;
        } catch (IOException e) {
            log.debug("No modification time for {}: {}", file, e.getMessage());
            return 0;
        }
    }

    private static void rollbackQuietly(FragmentWriter writer, Exception cause) {
        try {
            writer.rollback();
        } catch (TransactionException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private final class ProgressThrottle {
        private final ProgressListener listener;
        private long lastEmitted;

        ProgressThrottle(ProgressListener listener) {
            this.listener = listener;
            this.lastEmitted = clock.millis();
        }

        void offer(IndexingProgress progress) {
            long now = clock.millis();
            if (now - lastEmitted < progressIntervalMs) {
                return;
            }
            lastEmitted = now;
            log.info(progress.describe());
            listener.onProgress(progress);
        }
    }
}
