package com.ragengine.ingest;

public record IndexingProgress(
        String filePath,
        int filesTotal,
        int fileIndex,
        int chunkIndex,
        int chunksInFile,
        int chunksTotalCompleted) {

    public String describe() {
        return "Indexing file %d of %d, chunk %d of %d".formatted(fileIndex, filesTotal, chunkIndex, chunksInFile);
    }
}
