package com.tyron.ghostj.api.suggestion;

import com.tyron.ghostj.api.editor.EditorSnapshot;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Shows completions inline in an editor buffer and resolves them.
 * <p>
 * All methods are synchronous. Calls for the same document must not run concurrently; the caller
 * serialises them. A {@code null} result means there was nothing to do and the buffer must be left
 * as it is.
 */
public interface SuggestionService {

    /**
     * Renders the first candidate inline, replacing any suggestion the document already shows.
     *
     * @return {@code null} if {@code candidates} is empty
     */
    @Nullable
    SuggestionResult presentSuggestions(@NotNull EditorSnapshot snapshot, @NotNull List<CompletionCandidate> candidates);

    /**
     * Like {@link #presentSuggestions(EditorSnapshot, List)} but renders the candidate at {@code index}.
     *
     * @throws IndexOutOfBoundsException if {@code index} does not address a candidate
     */
    @Nullable
    SuggestionResult presentSuggestions(@NotNull EditorSnapshot snapshot,
                                        @NotNull List<CompletionCandidate> candidates,
                                        int index);

    /**
     * Removes the shown suggestion and discards every pending candidate of the document. Suggestion
     * blocks without tracked state are removed as well.
     *
     * @return {@code null} if the document has no presentation and shows no suggestion block
     */
    @Nullable
    SuggestionResult rejectSuggestion(@NotNull EditorSnapshot snapshot);

    /**
     * Commits the shown candidate as real text.
     *
     * @return {@code null} if the document shows no suggestion
     */
    @Nullable
    SuggestionResult acceptSuggestion(@NotNull EditorSnapshot snapshot);

    @Nullable
    SuggestionResult presentNextSuggestion(@NotNull EditorSnapshot snapshot);

    @Nullable
    SuggestionResult presentPreviousSuggestion(@NotNull EditorSnapshot snapshot);

    boolean hasActiveSuggestion(@NotNull String documentId);

    /**
     * Forgets the presentation state of a document that was closed.
     */
    void closeDocument(@NotNull String documentId);
}
