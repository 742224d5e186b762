package com.ragengine.embedding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class EnvironmentCredentialResolver implements CredentialResolver {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentCredentialResolver.class);

    private static final Map<String, List<String>> ENV_KEYS = Map.of(
            "openai", List.of("OPENAI_API_KEY"),
            "google", List.of("GOOGLE_API_KEY", "GOOGLE_GENAI_API_KEY", "GOOGLE_AI_API_KEY"));

    private final Function<String, String> environment;
    private final List<Path> accountsFiles;
    private final ObjectMapper mapper = new ObjectMapper();

    public EnvironmentCredentialResolver(List<Path> accountsFiles) {
        this(System::getenv, accountsFiles);
    }

    public EnvironmentCredentialResolver(Function<String, String> environment, List<Path> accountsFiles) {
        this.environment = environment;
        this.accountsFiles = List.copyOf(accountsFiles);
    }

    public static List<Path> defaultAccountsFiles() {
        String home = System.getProperty("user.home", ".");
        return List.of(
                Path.of(home, ".config", "rag-engine", "accounts.json"),
                Path.of("accounts.json"));
    }

    @Override
    public Optional<String> getCredential(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            return Optional.empty();
        }
        for (String variable : ENV_KEYS.getOrDefault(providerId.toLowerCase(Locale.ROOT), List.of())) {
            String value = environment.apply(variable);
            if (value != null && !value.isBlank()) {
                return Optional.of(value);
            }
        }
        for (Path file : accountsFiles) {
            Optional<String> key = readAccountsFile(file, providerId);
            if (key.isPresent()) {
                return key;
            }
        }
        return Optional.empty();
    }

    private Optional<String> readAccountsFile(Path file, String providerId) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            log.warn("Ignoring unreadable accounts file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            log.warn("Ignoring accounts file {}: root is not a JSON object", file);
            return Optional.empty();
        }
        for (JsonNode account : root.path("accounts")) {
            if (providerId.equalsIgnoreCase(account.path("name").asText())) {
                String key = account.path("api_key").asText("");
                if (!key.isBlank()) {
                    return Optional.of(key);
                }
            }
        }
        return Optional.empty();
    }
}
