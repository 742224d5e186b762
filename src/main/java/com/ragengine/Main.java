package com.ragengine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ragengine.embedding.CredentialResolver;
import com.ragengine.embedding.EmbeddingProviders;
import com.ragengine.embedding.EnvironmentCredentialResolver;
import com.ragengine.ingest.IndexingReport;
import com.ragengine.ingest.IndexingRequest;
import com.ragengine.ingest.IndexingService;
import com.ragengine.query.EmbeddingFailedException;
import com.ragengine.query.QueryRequest;
import com.ragengine.query.QueryResult;
import com.ragengine.query.QueryService;
import com.ragengine.runtime.AppConfig;
import com.ragengine.store.IndexConfig;
import com.ragengine.store.IndexConfigException;
import com.ragengine.store.RagStoreException;
import com.ragengine.store.SimilaritySearch;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "rag-engine",
        mixinStandardHelpOptions = true,
        version = "rag-engine 0.1.0",
        description = "Indexes source trees into a SQLite RAG store and answers similarity queries against it.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    static final int EXIT_RUNTIME_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "query")
    Mode mode;

    @Option(names = "--dir", description = "Directory to index")
    Path directory;

    @Option(names = "--db", description = "Path of the SQLite RAG database")
    Path dbPath;

    @Option(names = "--metadata", description = "JSON metadata stored with every indexed file", defaultValue = "{}")
    String metadata;

    @Option(names = "--chunk-size", description = "Maximum chunk length in characters")
    Integer chunkSize;

    @Option(names = "--chunk-overlap", description = "Characters shared between consecutive chunks")
    Integer chunkOverlap;

    @Option(names = "--file-filter", description = "Semicolon separated glob patterns, e.g. \"*.cpp;*.h\"")
    String fileFilter;

    @Option(names = "--provider", description = "Embedding provider id (openai, local)")
    String provider;

    @Option(names = "--model", description = "Embedding model id")
    String model;

    @Option(names = "--clear", description = "Delete every indexed file before indexing", defaultValue = "false")
    boolean clear;

    @Option(names = "--query", description = "Query text used in query mode")
    String query;

    @Option(names = "--max-results", description = "Maximum number of fragments to retrieve")
    Integer maxResults;

    @Option(names = "--min-relevance", description = "Minimum cosine similarity of retrieved fragments")
    Double minRelevance;

    @Option(names = "--json", description = "Print query results as a JSON array", defaultValue = "false")
    boolean json;

    private final EmbeddingProviders providers;
    private final CredentialResolver credentials;

    enum Mode {
        index,
        query,
        inspect
    }

    public Main() {
        this(null, null);
    }

    Main(EmbeddingProviders providers, CredentialResolver credentials) {
        this.providers = providers;
        this.credentials = credentials;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        log.info("Starting rag-engine in {} mode", mode);
        log.debug("Using config file: {}", configPath);

        if (dbPath == null) {
            log.error("--db is required");
            return EXIT_USAGE_ERROR;
        }
        EmbeddingProviders activeProviders = providers != null
                ? providers
                : EmbeddingProviders.fromConfig(config.getProviders());
        CredentialResolver activeCredentials = credentials != null
                ? credentials
                : new EnvironmentCredentialResolver(accountsFiles(config));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            return switch (mode) {
                case index -> runIndex(config, activeProviders, activeCredentials, executor);
                case query -> runQuery(config, activeProviders, activeCredentials, executor);
                case inspect -> runInspect();
            };
        } finally {
            executor.shutdownNow();
        }
    }

    private int runIndex(AppConfig config, EmbeddingProviders activeProviders, CredentialResolver activeCredentials,
            ExecutorService executor) throws InterruptedException {
        if (directory == null) {
            log.error("--dir is required in index mode");
            return EXIT_USAGE_ERROR;
        }
        AppConfig.IndexingConfig indexing = config.getIndexing();
        IndexingRequest request = new IndexingRequest(
                directory,
                dbPath,
                metadata,
                chunkSize != null ? chunkSize : indexing.getChunkSize(),
                chunkOverlap != null ? chunkOverlap : indexing.getChunkOverlap(),
                fileFilter != null ? fileFilter : indexing.getFileFilter(),
                provider != null ? provider : indexing.getProvider(),
                model != null ? model : indexing.getModel(),
                clear);

        IndexingService service = new IndexingService(activeProviders, activeCredentials,
                Clock.systemUTC(), indexing.getProgressIntervalMs());
        PrintWriter err = spec.commandLine().getErr();
        IndexingReport report;
        try {
            report = service.runAsync(request, progress -> {
                err.println(progress.describe());
                err.flush();
            }, executor).get();
        } catch (ExecutionException e) {
            log.error("Indexing failed", e.getCause());
            return EXIT_RUNTIME_FAILURE;
        }

        PrintWriter out = spec.commandLine().getOut();
        out.printf("status=%s fragments=%d files=%d/%d failedChunks=%d%n",
                report.status(), report.fragmentCount(), report.filesIndexed(), report.filesScanned(),
                report.failedChunks());
        out.flush();
        return switch (report.status()) {
            case COMPLETED -> 0;
            case VALIDATION_FAILED -> EXIT_USAGE_ERROR;
            default -> EXIT_RUNTIME_FAILURE;
        };
    }

    private int runQuery(AppConfig config, EmbeddingProviders activeProviders, CredentialResolver activeCredentials,
            ExecutorService executor) throws InterruptedException {
        if (query == null || query.isBlank()) {
            log.error("--query is required in query mode");
            return EXIT_USAGE_ERROR;
        }
        QueryRequest request = new QueryRequest(
                query,
                dbPath,
                maxResults != null ? maxResults : config.getQuery().getMaxResults(),
                minRelevance != null ? minRelevance : config.getQuery().getMinRelevance());

        QueryService service = new QueryService(activeProviders, activeCredentials);
        Future<QueryResult> future = executor.submit(() -> service.query(request));
        QueryResult result;
        try {
            result = future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalArgumentException) {
                log.error(cause.getMessage());
                return EXIT_USAGE_ERROR;
            }
            if (cause instanceof IndexConfigException || cause instanceof EmbeddingFailedException
                    || cause instanceof IllegalStateException || cause instanceof RagStoreException) {
                log.error(cause.getMessage());
                return EXIT_RUNTIME_FAILURE;
            }
            log.error("Query failed", cause);
            return EXIT_RUNTIME_FAILURE;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(result.resultsJson());
        } else if (result.isEmpty()) {
            out.println("No relevant fragments found.");
        } else {
            out.print(result.context());
        }
        out.flush();
        return 0;
    }

    private int runInspect() {
        try {
            IndexConfig indexConfig = SimilaritySearch.getIndexConfig(dbPath);
            PrintWriter out = spec.commandLine().getOut();
            out.printf("provider=%s model=%s%n", indexConfig.providerId(), indexConfig.modelId());
            out.flush();
            return 0;
        } catch (IndexConfigException | RagStoreException e) {
            log.error(e.getMessage());
            return EXIT_RUNTIME_FAILURE;
        }
    }

    private static List<Path> accountsFiles(AppConfig config) {
        List<String> configured = config.getCredentials().getAccountsFiles();
        if (configured.isEmpty()) {
            return EnvironmentCredentialResolver.defaultAccountsFiles();
        }
        return configured.stream().map(Path::of).toList();
    }

    private AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
