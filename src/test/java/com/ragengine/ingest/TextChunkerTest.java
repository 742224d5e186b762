package com.ragengine.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;

class TextChunkerTest {

    @Test
    void shouldReturnShortTextAsSingleChunk() {
        assertEquals(List.of("hello world"), TextChunker.split("hello world", 100, 20, FileType.PLAIN_TEXT));
        assertEquals(List.of("exactly10!"), TextChunker.split("exactly10!", 10, 3));
    }

    @Test
    void shouldHandleDegenerateArguments() {
        assertTrue(TextChunker.split("", 10, 2).isEmpty());
        assertTrue(TextChunker.split(null, 10, 2).isEmpty());
        assertEquals(List.of("some longer text"), TextChunker.split("some longer text", 0, 2));
        assertEquals(List.of("some longer text"), TextChunker.split("some longer text", -5, 2));

        List<String> clamped = TextChunker.split("aaaa bbbb cccc dddd eeee", 10, 50);
        assertFalse(clamped.isEmpty());
        clamped.forEach(chunk -> assertTrue(chunk.length() <= 10, chunk));

        List<String> negativeOverlap = TextChunker.split("aaaa bbbb cccc dddd eeee", 10, -3);
        assertEquals(List.of("aaaa bbbb", "cccc dddd", "eeee"), negativeOverlap);
    }

    @Test
    void shouldNotRepeatTrailingWordWhenOverlapping() {
        List<String> chunks = TextChunker.split("AAAAA BBBBB CCCCC", 10, 3);

        assertEquals(List.of("AAAAA", "AAA BBBBB", "CCCCC"), chunks);
        for (String chunk : chunks) {
            assertTrue(chunk.indexOf("CCCCC") == chunk.lastIndexOf("CCCCC"), chunk);
        }
    }

    @Test
    void shouldKeepEveryChunkWithinLimitForAllFileTypes() {
        String text = sampleProse(400);
        for (FileType fileType : FileType.values()) {
            if (fileType == FileType.MARKDOWN) {
                continue;
            }
            List<String> chunks = TextChunker.split(text, 120, 30, fileType);
            assertTrue(chunks.size() > 1, fileType.name());
            for (String chunk : chunks) {
                assertTrue(chunk.length() <= 120, fileType + " produced " + chunk.length() + " chars");
                assertFalse(chunk.isBlank(), fileType.name());
            }
        }
    }

    @Test
    void shouldStartOverlappingChunksOnWordBoundaries() {
        String text = sampleProse(300);
        List<String> chunks = TextChunker.split(text, 80, 20);

        for (int i = 1; i < chunks.size(); i++) {
            String chunk = chunks.get(i);
            int at = text.indexOf(chunk);
            assertTrue(at > 0, "chunk is not a contiguous slice: " + chunk);
            assertTrue(Character.isWhitespace(text.charAt(at - 1)), "chunk starts mid-word: " + chunk);
        }
    }

    @Test
    void shouldCoverEveryWordOfTheInput() {
        String text = sampleProse(250);
        List<String> chunks = TextChunker.split(text, 70, 15);
        String joined = String.join(" ", chunks);

        for (String word : text.split(" ")) {
            assertTrue(joined.contains(word), "lost " + word);
        }
    }

    @Test
    void shouldCarryOverlapBetweenConsecutiveChunks() {
        String text = sampleProse(200);
        List<String> chunks = TextChunker.split(text, 60, 15);

        for (int i = 1; i < chunks.size(); i++) {
            String previous = chunks.get(i - 1);
            String next = chunks.get(i);
            String firstWord = next.split(" ")[0];
            assertTrue(previous.contains(firstWord), "no overlap between '" + previous + "' and '" + next + "'");
        }
    }

    @Test
    void shouldForceSplitTextWithoutWhitespace() {
        String text = "x".repeat(250);
        List<String> chunks = TextChunker.split(text, 100, 10);

        assertEquals(3, chunks.size());
        assertEquals(100, chunks.get(0).length());
        assertEquals(100, chunks.get(1).length());
        assertEquals(70, chunks.get(2).length());
    }

    @Test
    void shouldStartNewChunkWithOverflowingComment() {
        String text = "alpha = 1\nbeta = 2\ngamma = 3\n# explains delta\ndelta = 4\nepsilon = 5";
        List<String> chunks = TextChunker.split(text, 40, 0, FileType.PYTHON);

        assertEquals(List.of("alpha = 1\nbeta = 2\ngamma = 3", "# explains delta\ndelta = 4\nepsilon = 5"), chunks);
    }

    @Test
    void shouldMoveTrailingCommentForwardWithFollowingCode() {
        String text = "alpha = 1\nbeta = 2\n# about gamma\ngamma = 333333";
        List<String> chunks = TextChunker.split(text, 40, 0, FileType.PYTHON);

        assertEquals(List.of("alpha = 1\nbeta = 2", "# about gamma\ngamma = 333333"), chunks);
    }

    @Test
    void shouldNotGlueCommentsForPlainText() {
        String text = "alpha = 1\nbeta = 2\n# about gamma\ngamma = 333333";
        List<String> chunks = TextChunker.split(text, 40, 0, FileType.PLAIN_TEXT);

        assertEquals(List.of("alpha = 1\nbeta = 2\n# about gamma", "gamma = 333333"), chunks);
    }

    @Test
    void shouldSplitCppOnClosingBraces() {
        String first = "void first() {\n    call_one();\n    call_two();\n}";
        String second = "void second() {\n    call_three();\n}";
        String text = first + "\n\n" + second + "\n";
        List<String> chunks = TextChunker.split(text, 50, 0, FileType.CPP);

        assertEquals(2, chunks.size());
        assertTrue(chunks.get(0).startsWith("void first()"));
        assertTrue(chunks.get(1).startsWith("void second()"));
    }

    @Test
    void shouldBreakMarkdownBeforeHeaders() {
        String text = "# Title\nintro line one\n## Section\nbody text here";
        List<String> chunks = TextChunker.split(text, 30, 10, FileType.MARKDOWN);

        assertEquals(List.of("# Title\nintro line one\n", "## Section\nbody text here"), chunks);
    }

    @Test
    void shouldLetMarkdownTablesOverflowByAQuarter() {
        String text = "intro paragraph\n| name | value |\n| ---- | ----- |\n| k | v |";
        List<String> chunks = TextChunker.split(text, 40, 0, FileType.MARKDOWN);

        assertEquals(2, chunks.size());
        assertEquals(50, chunks.get(0).length());
        assertTrue(chunks.get(0).contains("| ---- | ----- |"));
        assertEquals("| k | v |", chunks.get(1));
    }

    @Test
    void shouldBeDeterministic() {
        String text = sampleProse(300);
        assertEquals(TextChunker.split(text, 90, 25, FileType.CPP), TextChunker.split(text, 90, 25, FileType.CPP));
    }

    private static String sampleProse(int words) {
        return IntStream.range(0, words)
                .mapToObj(i -> "word" + i)
                .collect(Collectors.joining(" "));
    }
}
