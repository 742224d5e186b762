package com.ragengine.ingest;

import java.util.List;

public enum FileType {
    PLAIN_TEXT(List.of("\n\n", "\n", " ", ""), List.of()),
    CPP(List.of("}\n\n", "}\n", ";\n", "{\n", "\n\n", "\n", " ", ""), List.of("//", "/*")),
    PYTHON(List.of("\nclass ", "\n\n", "\n", " ", ""), List.of("#")),
    // Labels (":\n") come after the line separators so a leading comment and its routine header stay together.
    REXX(List.of(
            "\n::routine", "\n::ROUTINE",
            "\n::method", "\n::METHOD",
            "\n::requires", "\n::REQUIRES",
            " Return\n", " RETURN\n", " return\n",
            " Exit\n", " EXIT\n", " exit\n",
            "\n\n", "\n", ":\n", " ", ""), List.of("--", "/*")),
    SQL(List.of("\n/\n", ";\n\n", ";\n", "\nGO\n", "\n\n", "\n", " ", ""), List.of("--")),
    SHELL(List.of("\nfunction ", "}\n\n", "}\n", ";;\n", "\n\n", "\n", " ", ""), List.of("#")),
    COBOL(List.of("\nDIVISION.", "\nSECTION.", ".\n\n", ".\n", "\n\n", "\n", " ", ""), List.of("*")),
    MARKDOWN(List.of("\n\n", "\n", " ", ""), List.of()),
    YAML(List.of("\nresource ", "\nmodule ", "\n- ", "\n  ", "\n\n", "\n", " ", ""), List.of("#"));

    private final List<String> separators;
    private final List<String> commentMarkers;

    FileType(List<String> separators, List<String> commentMarkers) {
        this.separators = separators;
        this.commentMarkers = commentMarkers;
    }

    public List<String> separators() {
        return separators;
    }

    public boolean hasLineComments() {
        return !commentMarkers.isEmpty();
    }

    public boolean isCommentStart(String line) {
        String trimmed = line.strip();
        for (String marker : commentMarkers) {
            if (trimmed.startsWith(marker)) {
                return true;
            }
        }
        return false;
    }
}
