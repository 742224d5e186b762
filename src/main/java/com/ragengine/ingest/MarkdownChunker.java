package com.ragengine.ingest;

import java.util.ArrayList;
import java.util.List;

public class MarkdownChunker extends ChunkerStrategy {

    public MarkdownChunker(int maxChunkSize, int chunkOverlap) {
        super(maxChunkSize, chunkOverlap);
    }

    int tableChunkLimit() {
        return maxChunkSize + maxChunkSize / 4;
    }

    @Override
    public List<String> chunk(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxChunkSize) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            boolean header = isHeaderLine(line);
            boolean tableRow = isTableRow(line);
            String lineWithNewline = i == lines.length - 1 ? line : line + "\n";

            if (header && current.length() > 0) {
                chunks.add(current.toString());
                current.setLength(0);
            }

            int candidateLength = current.length() + lineWithNewline.length();
            if (candidateLength <= maxChunkSize || (tableRow && candidateLength <= tableChunkLimit())) {
                current.append(lineWithNewline);
                continue;
            }

            String seed = "";
            if (current.length() > 0) {
                String emitted = current.toString();
                chunks.add(emitted);
                current.setLength(0);
                seed = overlapFor(emitted);
            }

            boolean lineFits = lineWithNewline.length() <= maxChunkSize
                    || (tableRow && lineWithNewline.length() <= tableChunkLimit());
            if (!lineFits) {
                chunks.addAll(splitByCharacters(lineWithNewline));
                continue;
            }
            if (!seed.isEmpty() && seed.length() + lineWithNewline.length() <= maxChunkSize) {
                current.append(seed);
            }
            current.append(lineWithNewline);
        }

        if (current.length() > 0) {
            chunks.add(current.toString());
        }
        chunks.removeIf(String::isBlank);
        return List.copyOf(chunks);
    }

    static boolean isHeaderLine(String line) {
        String trimmed = line.strip();
        int hashes = 0;
        while (hashes < trimmed.length() && trimmed.charAt(hashes) == '#') {
            hashes++;
        }
        if (hashes < 1 || hashes > 6) {
            return false;
        }
        return hashes == trimmed.length() || trimmed.charAt(hashes) == ' ';
    }

    static boolean isTableRow(String line) {
        return line.strip().startsWith("|");
    }
}
