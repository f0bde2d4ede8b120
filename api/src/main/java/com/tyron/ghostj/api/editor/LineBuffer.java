package com.tyron.ghostj.api.editor;

import java.util.List;
import java.util.Objects;

/**
 * Immutable text of an editor as an ordered list of lines, together with its caret and selections.
 * <p>
 * Every line keeps its terminator, so {@link #content()} is the plain concatenation of {@link #lines()}.
 */
public record LineBuffer(List<String> lines, CursorPosition cursor, List<CursorRange> selections) {

    public LineBuffer {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        Objects.requireNonNull(cursor, "cursor");
        selections = List.copyOf(Objects.requireNonNull(selections, "selections"));
    }

    public LineBuffer(List<String> lines, CursorPosition cursor) {
        this(lines, cursor, List.of());
    }

    public static LineBuffer of(String content, CursorPosition cursor) {
        return new LineBuffer(Lines.split(content), cursor, List.of());
    }

    public String content() {
        return Lines.join(lines);
    }

    public int lineCount() {
        return lines.size();
    }
}
