package com.ragengine.embedding;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.ragengine.runtime.AppConfig;

import okhttp3.OkHttpClient;

public final class EmbeddingProviders {
    private final Map<String, EmbeddingProvider> providers;

    public EmbeddingProviders(List<EmbeddingProvider> providers) {
        Map<String, EmbeddingProvider> byId = new LinkedHashMap<>();
        for (EmbeddingProvider provider : providers) {
            byId.put(provider.id().toLowerCase(Locale.ROOT), provider);
        }
        this.providers = Map.copyOf(byId);
    }

    public static EmbeddingProviders of(EmbeddingProvider... providers) {
        return new EmbeddingProviders(List.of(providers));
    }

    public static EmbeddingProviders fromConfig(AppConfig.ProvidersConfig config) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .callTimeout(Duration.ofMillis(config.getCallTimeoutMs()))
                .build();
        return of(
                new OpenAiEmbeddingProvider(httpClient, config.getOpenaiBaseUrl()),
                new HashingEmbeddingProvider(config.getHashingDimension()));
    }

    public Optional<EmbeddingProvider> find(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(providerId.toLowerCase(Locale.ROOT)));
    }

    /**
     * API key for the provider, or an empty string for providers that do not need one. Empty
     * optional means the provider needs a key and none could be resolved.
     */
    public static Optional<String> resolveApiKey(EmbeddingProvider provider, CredentialResolver credentials) {
        if (!provider.requiresCredential()) {
            return Optional.of(credentials.getCredential(provider.id()).orElse(""));
        }
        return credentials.getCredential(provider.id());
    }
}
