package com.ragengine.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IndexingConfig indexing = new IndexingConfig();
    private QueryConfig query = new QueryConfig();
    private ProvidersConfig providers = new ProvidersConfig();
    private CredentialsConfig credentials = new CredentialsConfig();

    public IndexingConfig getIndexing() {
        return indexing;
    }

    public void setIndexing(IndexingConfig indexing) {
        this.indexing = indexing == null ? new IndexingConfig() : indexing;
    }

    public QueryConfig getQuery() {
        return query;
    }

    public void setQuery(QueryConfig query) {
        this.query = query == null ? new QueryConfig() : query;
    }

    public ProvidersConfig getProviders() {
        return providers;
    }

    public void setProviders(ProvidersConfig providers) {
        this.providers = providers == null ? new ProvidersConfig() : providers;
    }

    public CredentialsConfig getCredentials() {
        return credentials;
    }

    public void setCredentials(CredentialsConfig credentials) {
        this.credentials = credentials == null ? new CredentialsConfig() : credentials;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexingConfig {
        private int chunkSize = 1000;
        private int chunkOverlap = 200;
        private String fileFilter = "";
        private long progressIntervalMs = 10_000;
        private String provider = "openai";
        private String model = "text-embedding-3-small";

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public int getChunkOverlap() {
            return chunkOverlap;
        }

        public void setChunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
        }

        public String getFileFilter() {
            return fileFilter;
        }

        public void setFileFilter(String fileFilter) {
            this.fileFilter = fileFilter == null ? "" : fileFilter;
        }

        public long getProgressIntervalMs() {
            return progressIntervalMs;
        }

        public void setProgressIntervalMs(long progressIntervalMs) {
            this.progressIntervalMs = progressIntervalMs;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryConfig {
        private int maxResults = 5;
        private double minRelevance = 0.0;

        public int getMaxResults() {
            return maxResults;
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = maxResults;
        }

        public double getMinRelevance() {
            return minRelevance;
        }

        public void setMinRelevance(double minRelevance) {
            this.minRelevance = minRelevance;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProvidersConfig {
        private String openaiBaseUrl = "https://api.openai.com";
        private long connectTimeoutMs = 10_000;
        private long callTimeoutMs = 60_000;
        private int hashingDimension = 256;

        public String getOpenaiBaseUrl() {
            return openaiBaseUrl;
        }

        public void setOpenaiBaseUrl(String openaiBaseUrl) {
            this.openaiBaseUrl = openaiBaseUrl;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getCallTimeoutMs() {
            return callTimeoutMs;
        }

        public void setCallTimeoutMs(long callTimeoutMs) {
            this.callTimeoutMs = callTimeoutMs;
        }

        public int getHashingDimension() {
            return hashingDimension;
        }

        public void setHashingDimension(int hashingDimension) {
            this.hashingDimension = hashingDimension;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CredentialsConfig {
        private List<String> accountsFiles = new ArrayList<>();

        public List<String> getAccountsFiles() {
            return accountsFiles;
        }

        public void setAccountsFiles(List<String> accountsFiles) {
            this.accountsFiles = accountsFiles == null ? new ArrayList<>() : accountsFiles;
        }
    }
}
