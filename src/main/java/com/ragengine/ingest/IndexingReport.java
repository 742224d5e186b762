package com.ragengine.ingest;

public record IndexingReport(
        IndexingStatus status,
        int filesScanned,
        int filesIndexed,
        int fragmentCount,
        int failedChunks,
        String message) {

    static IndexingReport aborted(IndexingStatus status, String message) {
        return new IndexingReport(status, 0, 0, 0, 0, message);
    }

    public boolean isSuccess() {
        return status == IndexingStatus.COMPLETED;
    }
}
