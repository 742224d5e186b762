package com.ragengine.ingest;

import java.util.List;

/**
 * Splits documents into overlapping chunks for embedding. Pure and deterministic: the same
 * arguments always yield the same chunks.
 *
 * <p>Every chunk is at most {@code maxSize} characters long, except that Markdown table rows may
 * stretch a chunk by up to 25% so a table is not severed. Consecutive chunks share an overlap of
 * roughly {@code overlap} characters, snapped back to a word boundary when one is near.
 */
public final class TextChunker {

    private TextChunker() {
    }

    public static List<String> split(String text, int maxSize, int overlap, FileType fileType) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (maxSize <= 0 || text.length() <= maxSize) {
            return List.of(text);
        }
        int effectiveOverlap = Math.max(0, Math.min(overlap, maxSize - 1));
        return strategyFor(fileType, maxSize, effectiveOverlap).chunk(text);
    }

    public static List<String> split(String text, int maxSize, int overlap) {
        return split(text, maxSize, overlap, FileType.PLAIN_TEXT);
    }

    static ChunkerStrategy strategyFor(FileType fileType, int maxSize, int overlap) {
        if (fileType == FileType.MARKDOWN) {
            return new MarkdownChunker(maxSize, overlap);
        }
        return new StandardCodeChunker(maxSize, overlap, fileType == null ? FileType.PLAIN_TEXT : fileType);
    }
}
