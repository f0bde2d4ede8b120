package com.tyron.ghostj.api.suggestion;

import com.tyron.ghostj.api.editor.CursorRange;

import java.util.Objects;

/**
 * One proposed completion.
 *
 * @param text  the text that replaces {@code range}, possibly spanning several lines
 * @param range what the text replaces in the document as it was before any suggestion was shown;
 *              empty for a pure insertion
 */
public record CompletionCandidate(String text, CursorRange range) {

    public CompletionCandidate {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(range, "range");
    }
}
