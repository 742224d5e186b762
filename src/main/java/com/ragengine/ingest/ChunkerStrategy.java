package com.ragengine.ingest;

import java.util.ArrayList;
import java.util.List;

public abstract class ChunkerStrategy {
    static final int BOUNDARY_LOOKBACK = 50;

    protected final int maxChunkSize;
    protected final int chunkOverlap;

    protected ChunkerStrategy(int maxChunkSize, int chunkOverlap) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive: " + maxChunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= maxChunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be in [0, " + maxChunkSize + "): " + chunkOverlap);
        }
        this.maxChunkSize = maxChunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public abstract List<String> chunk(String text);

    static int findWordBoundary(String text, int idealPos, int maxLookback) {
        int searchStart = Math.max(0, idealPos - maxLookback);
        for (int i = idealPos - 1; i >= searchStart; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i + 1;
            }
        }
        return idealPos;
    }

    static String extractOverlap(String chunk, int overlapSize) {
        if (overlapSize <= 0) {
            return "";
        }
        if (chunk.length() <= overlapSize) {
            return chunk;
        }
        int idealStart = chunk.length() - overlapSize;
        int start = findWordBoundary(chunk, idealStart, BOUNDARY_LOOKBACK);
        return chunk.substring(start);
    }

    String overlapFor(String emitted) {
        if (chunkOverlap == 0 || emitted.length() <= chunkOverlap) {
            return "";
        }
        String overlap = extractOverlap(emitted, chunkOverlap);
        if (overlap.length() >= maxChunkSize) {
            return emitted.substring(emitted.length() - chunkOverlap);
        }
        return overlap;
    }

    List<String> splitByCharacters(String text) {
        List<String> pieces = new ArrayList<>();
        int length = text.length();
        int pos = 0;
        String seed = "";
        int iterations = 0;
        while (pos < length) {
            if (++iterations > length + 1) {
                throw new IllegalStateException("Character split made no progress at offset " + pos);
            }
            int room = maxChunkSize - seed.length();
            int idealEnd = pos + room;
            int end;
            if (idealEnd >= length) {
                end = length;
            } else {
                end = findWordBoundary(text, idealEnd, BOUNDARY_LOOKBACK);
                if (end <= pos) {
                    end = idealEnd;
                }
            }
            String piece = seed + text.substring(pos, end);
            pieces.add(piece);
            pos = end;
            seed = pos < length ? overlapFor(piece) : "";
        }
        return pieces;
    }
}
