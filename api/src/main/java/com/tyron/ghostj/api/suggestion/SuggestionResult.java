package com.tyron.ghostj.api.suggestion;

import com.tyron.ghostj.api.editor.CursorPosition;
import com.tyron.ghostj.api.editor.Lines;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a suggestion operation.
 *
 * @param lines         the buffer after the operation
 * @param modifications what turns the caller's buffer into {@code lines}
 * @param newCursor     where the caret goes
 */
public record SuggestionResult(List<String> lines, List<Modification> modifications, CursorPosition newCursor) {

    public SuggestionResult {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        modifications = List.copyOf(Objects.requireNonNull(modifications, "modifications"));
        Objects.requireNonNull(newCursor, "newCursor");
    }

    public String content() {
        return Lines.join(lines);
    }
}
