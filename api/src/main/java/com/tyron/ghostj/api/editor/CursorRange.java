package com.tyron.ghostj.api.editor;

import java.util.Objects;

/**
 * A range between two cursor positions, {@code start} inclusive and {@code end} exclusive.
 * Used both for selections and for the part of a document a completion replaces.
 */
public record CursorRange(CursorPosition start, CursorPosition end) {

    public CursorRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("range end " + end + " is before start " + start);
        }
    }

    public static CursorRange of(int startLine, int startCharacter, int endLine, int endCharacter) {
        return new CursorRange(CursorPosition.of(startLine, startCharacter), CursorPosition.of(endLine, endCharacter));
    }

    public static CursorRange empty(CursorPosition position) {
        return new CursorRange(position, position);
    }

    public boolean isEmpty() {
        return start.equals(end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
