package com.ragengine.ingest;

import java.nio.file.Path;

public record IndexingRequest(
        Path directory,
        Path dbPath,
        String metadataJson,
        int chunkSize,
        int chunkOverlap,
        String fileFilter,
        String providerId,
        String modelId,
        boolean clearDatabase) {
}
