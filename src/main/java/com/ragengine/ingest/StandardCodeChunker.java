package com.ragengine.ingest;

import java.util.ArrayList;
import java.util.List;

public class StandardCodeChunker extends ChunkerStrategy {
    private final FileType fileType;

    public StandardCodeChunker(int maxChunkSize, int chunkOverlap, FileType fileType) {
        super(maxChunkSize, chunkOverlap);
        this.fileType = fileType;
    }

    @Override
    public List<String> chunk(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxChunkSize) {
            return List.of(text);
        }
        List<String> chunks = new ArrayList<>(splitRecursive(text, fileType.separators()));
        chunks.removeIf(String::isBlank);
        return List.copyOf(chunks);
    }

    private List<String> splitRecursive(String text, List<String> separators) {
        if (text.length() <= maxChunkSize) {
            return List.of(text);
        }
        if (separators.isEmpty() || separators.get(0).isEmpty()) {
            return splitByCharacters(text);
        }

        String separator = separators.get(0);
        List<String> finer = separators.subList(1, separators.size());
        List<String> parts = splitKeepingEmpty(text, separator);
        if (parts.size() == 1) {
            return splitRecursive(text, finer);
        }

        MergeState state = new MergeState(separator);
        for (String part : parts) {
            List<String> pieces = part.length() > maxChunkSize ? splitRecursive(part, finer) : List.of(part);
            for (int i = 0; i < pieces.size(); i++) {
                state.accept(pieces.get(i), i == 0);
            }
        }
        return state.finish();
    }

    static List<String> splitKeepingEmpty(String text, String separator) {
        List<String> parts = new ArrayList<>();
        int from = 0;
        int at;
        while ((at = text.indexOf(separator, from)) >= 0) {
            parts.add(text.substring(from, at));
            from = at + separator.length();
        }
        parts.add(text.substring(from));
        return parts;
    }

    private boolean isNewlineSeparator(String separator) {
        return "\n".equals(separator) || "\n\n".equals(separator);
    }

    private final class MergeState {
        private final String separator;
        private final boolean commentAware;
        private final List<String> result = new ArrayList<>();
        private String current = "";

        MergeState(String separator) {
            this.separator = separator;
            this.commentAware = isNewlineSeparator(separator) && fileType.hasLineComments();
        }

        void accept(String piece, boolean firstPieceOfPart) {
            if (!firstPieceOfPart) {
                emitCurrent();
                current = piece;
                return;
            }
            if (current.isEmpty()) {
                current = piece;
                return;
            }

            String candidate = current + separator + piece;
            if (candidate.length() <= maxChunkSize) {
                current = candidate;
                return;
            }

            if (commentAware && fileType.isCommentStart(piece)) {
                emitCurrent();
                current = piece;
                return;
            }
            if (commentAware && migrateTrailingComment(piece)) {
                return;
            }

            String emitted = current;
            emitCurrent();
            String seed = overlapFor(emitted);
            if (seed.isEmpty() || piece.startsWith(seed)) {
                current = piece;
                return;
            }
            String seeded = seed + separator + piece;
            current = seeded.length() <= maxChunkSize ? seeded : piece;
        }

        private boolean migrateTrailingComment(String piece) {
            String[] lines = current.split("\n", -1);
            int firstCommentLine = lines.length;
            while (firstCommentLine > 0 && fileType.isCommentStart(lines[firstCommentLine - 1])) {
                firstCommentLine--;
            }
            if (firstCommentLine == lines.length || firstCommentLine == 0) {
                return false;
            }
            int offset = 0;
            for (int i = 0; i < firstCommentLine; i++) {
                offset += lines[i].length() + 1;
            }
            String head = stripTrailingNewlines(current.substring(0, offset));
            String comment = current.substring(offset);
            String moved = comment + separator + piece;
            if (head.isBlank() || moved.length() > maxChunkSize) {
                return false;
            }
            result.add(head);
            current = moved;
            return true;
        }

        private void emitCurrent() {
            if (!current.isEmpty()) {
                result.add(current);
            }
            current = "";
        }

        List<String> finish() {
            emitCurrent();
            return result;
        }
    }

    private static String stripTrailingNewlines(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }
}
