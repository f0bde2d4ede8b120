package com.tyron.ghostj.core.suggestion;

import com.tyron.ghostj.api.editor.CursorRange;
import com.tyron.ghostj.api.suggestion.CompletionCandidate;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * What a document currently shows.
 *
 * @param candidates        every candidate of the presentation, in cycling order
 * @param currentIndex      the rendered candidate
 * @param anchorLineIndex   first line of the rendered block in the presented buffer
 * @param injectedLineCount number of lines of the rendered block, markers included
 * @param target            the rendered candidate's range, clamped to the buffer it was presented in
 * @param detachedLine      the original last line, if it had no terminator and one had to be added to
 *                          put the block after it
 */
public record PresentationState(List<CompletionCandidate> candidates,
                                int currentIndex,
                                int anchorLineIndex,
                                int injectedLineCount,
                                CursorRange target,
                                @Nullable String detachedLine) {

    public PresentationState {
        candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates"));
        Objects.checkIndex(currentIndex, candidates.size());
        Objects.requireNonNull(target, "target");
        if (anchorLineIndex < 0 || injectedLineCount < 2) {
            throw new IllegalArgumentException("invalid block [" + anchorLineIndex + ", +" + injectedLineCount + ")");
        }
    }

    public CompletionCandidate currentCandidate() {
        return candidates.get(currentIndex);
    }

    public int candidateCount() {
        return candidates.size();
    }
}
