package com.ragengine.ingest;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = progress -> {
    };

    void onProgress(IndexingProgress progress);
}
