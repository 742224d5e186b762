package com.ragengine.embedding;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class StaticCredentialResolver implements CredentialResolver {
    private final Map<String, String> keysByProvider;

    public StaticCredentialResolver(Map<String, String> keysByProvider) {
        this.keysByProvider = keysByProvider.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        entry -> entry.getKey().toLowerCase(Locale.ROOT),
                        Map.Entry::getValue));
    }

    @Override
    public Optional<String> getCredential(String providerId) {
        if (providerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keysByProvider.get(providerId.toLowerCase(Locale.ROOT)))
                .filter(key -> !key.isBlank());
    }
}
