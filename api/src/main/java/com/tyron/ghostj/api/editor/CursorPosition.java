package com.tyron.ghostj.api.editor;

import org.jetbrains.annotations.NotNull;

/**
 * A caret location inside a line-based buffer.
 * <p>
 * {@code line} is a zero-based index into the buffer's line list, {@code character} is an offset in
 * UTF-16 code units within that line.
 */
public record CursorPosition(int line, int character) implements Comparable<CursorPosition> {

    public static final CursorPosition ZERO = new CursorPosition(0, 0);

    public CursorPosition {
        if (line < 0) {
            throw new IllegalArgumentException("line < 0: " + line);
        }
        if (character < 0) {
            throw new IllegalArgumentException("character < 0: " + character);
        }
    }

    public static CursorPosition of(int line, int character) {
        return new CursorPosition(line, character);
    }

    public CursorPosition withLine(int newLine) {
        return new CursorPosition(newLine, character);
    }

    public boolean isBefore(CursorPosition other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(@NotNull CursorPosition o) {
        int c = Integer.compare(line, o.line);
        return c != 0 ? c : Integer.compare(character, o.character);
    }

    @Override
    public String toString() {
        return "(" + line + ", " + character + ")";
    }
}
