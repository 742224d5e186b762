package com.ragengine.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    static final List<String> SUPPORTED_EXTENSIONS = List.of(
            ".cpp", ".h", ".hpp", ".c", ".cs", ".java", ".js", ".ts", ".tsx", ".go", ".rs", ".swift", ".kt",
            ".py",
            ".rexx", ".rex", ".cmd",
            ".sql", ".plsql", ".tsql",
            ".sh", ".bash", ".ps1", ".zsh",
            ".cbl", ".cob", ".copy",
            ".yaml", ".yml", ".tf", ".hcl",
            ".asm", ".s",
            ".md", ".markdown", ".txt", ".json", ".xml", ".cmake");

    private DocumentLoader() {
    }

    public static List<Path> scanDirectory(Path root, List<String> filters) throws IOException {
        List<PathMatcher> matchers = filters == null
                ? List.of()
                : filters.stream()
                        .map(pattern -> FileSystems.getDefault()
                                .getPathMatcher("glob:" + pattern.toLowerCase(Locale.ROOT)))
                        .toList();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(path -> matchers.isEmpty()
                            ? hasSupportedExtension(path)
                            : matchesAny(matchers, path))
                    .map(path -> path.toAbsolutePath().normalize())
                    .sorted()
                    .toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private static boolean matchesAny(List<PathMatcher> matchers, Path path) {
        Path name = Path.of(path.getFileName().toString().toLowerCase(Locale.ROOT));
        return matchers.stream().anyMatch(matcher -> matcher.matches(name));
    }

    public static List<String> parseFilter(String fileFilter) {
        if (fileFilter == null || fileFilter.isBlank()) {
            return List.of();
        }
        return Arrays.stream(fileFilter.split(";"))
                .map(String::strip)
                .filter(pattern -> !pattern.isEmpty())
                .toList();
    }

    public static String readText(Path path) {
        try {
            byte[] bytes = Files.readAllBytes(path);
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.warn("Skipping {}: not valid UTF-8", path);
            return "";
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", path, e.getMessage());
            return "";
        }
    }

    public static FileType classify(Path path) {
        String name = path.getFileName() == null
                ? path.toString().toLowerCase(Locale.ROOT)
                : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (endsWithAny(name, ".rexx", ".rex", ".cmd")) {
            return FileType.REXX;
        }
        if (name.endsWith(".py")) {
            return FileType.PYTHON;
        }
        if (endsWithAny(name, ".sql", ".plsql", ".tsql")) {
            return FileType.SQL;
        }
        if (endsWithAny(name, ".sh", ".bash", ".ps1", ".zsh", ".asm", ".s")) {
            return FileType.SHELL;
        }
        if (endsWithAny(name, ".cbl", ".cob", ".copy")) {
            return FileType.COBOL;
        }
        if (endsWithAny(name, ".yaml", ".yml", ".tf", ".hcl")) {
            return FileType.YAML;
        }
        if (endsWithAny(name, ".md", ".markdown")) {
            return FileType.MARKDOWN;
        }
        if (endsWithAny(name, ".cpp", ".h", ".hpp", ".c", ".cs", ".java", ".js", ".ts", ".tsx", ".go", ".rs",
                ".swift", ".kt")) {
            return FileType.CPP;
        }
        return FileType.PLAIN_TEXT;
    }

    static boolean hasSupportedExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return SUPPORTED_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private static boolean endsWithAny(String name, String... extensions) {
        for (String extension : extensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
