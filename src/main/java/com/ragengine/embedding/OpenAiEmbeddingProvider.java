package com.ragengine.embedding;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class OpenAiEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    public static final String ID = "openai";

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;

    public OpenAiEmbeddingProvider(OkHttpClient httpClient, String baseUrl) {
        this.httpClient = httpClient;
        this.endpoint = stripTrailingSlash(baseUrl) + "/v1/embeddings";
    }

    @Override
    public String id() {
        return ID;
    }

    String endpoint() {
        return endpoint;
    }

    @Override
    public EmbeddingResult embed(String apiKey, String model, String text) {
        String payload;
        try {
            payload = mapper.writeValueAsString(Map.of("input", text, "model", model));
        } catch (JsonProcessingException e) {
            return EmbeddingResult.failure("Unable to encode request: " + e.getOriginalMessage());
        }
        Request request = new Request.Builder()
                .url(endpoint)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(payload, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String bodyText = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                log.warn("Embedding request to {} failed with HTTP {}", endpoint, response.code());
            }
            return parseResponse(response.code(), bodyText);
        } catch (InterruptedIOException e) {
            return interruptedFailure(e);
        } catch (IOException e) {
            log.warn("Embedding request to {} failed: {}", endpoint, e.getMessage());
            return EmbeddingResult.failure("Embedding network error: " + e.getMessage());
        }
    }

    EmbeddingResult interruptedFailure(InterruptedIOException e) {
        // OkHttp signals its call timeout with a plain InterruptedIOException("timeout")
        if (e instanceof SocketTimeoutException || "timeout".equals(e.getMessage())) {
            log.warn("Embedding request to {} timed out", endpoint);
            return EmbeddingResult.failure("Embedding API timeout");
        }
        Thread.currentThread().interrupt();
        log.warn("Embedding request to {} was interrupted", endpoint);
        return EmbeddingResult.failure("Embedding request interrupted");
    }

    EmbeddingResult parseResponse(int statusCode, String body) {
        JsonNode root;
        try {
            root = body == null || body.isBlank() ? null : mapper.readTree(body);
        } catch (JsonProcessingException e) {
            if (statusCode / 100 != 2) {
                return EmbeddingResult.failure("HTTP " + statusCode);
            }
            return EmbeddingResult.failure("JSON parse error: " + e.getOriginalMessage());
        }

        if (statusCode / 100 != 2) {
            String message = root == null ? "" : root.path("error").path("message").asText("");
            return EmbeddingResult.failure(message.isBlank() ? "HTTP " + statusCode : message);
        }
        if (root == null || !root.isObject()) {
            return EmbeddingResult.failure("Invalid JSON: root is not an object");
        }
        if (root.has("error")) {
            return EmbeddingResult.failure(root.path("error").path("message").asText("Unknown API error"));
        }

        JsonNode vectorNode = root.path("data").path(0).path("embedding");
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            return EmbeddingResult.failure("Response did not contain an embedding vector");
        }
        float[] vector = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            vector[i] = (float) vectorNode.get(i).asDouble();
        }

        JsonNode usage = root.path("usage");
        int promptTokens = usage.path("prompt_tokens").asInt(0);
        int totalTokens = usage.path("total_tokens").asInt(promptTokens);
        return EmbeddingResult.success(vector, new TokenUsage(promptTokens, 0, totalTokens));
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
