package com.ragengine.embedding;

import java.util.Optional;

@FunctionalInterface
public interface CredentialResolver {
    Optional<String> getCredential(String providerId);
}
