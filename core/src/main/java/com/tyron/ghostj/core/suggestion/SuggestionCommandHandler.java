package com.tyron.ghostj.core.suggestion;

import com.tyron.ghostj.api.concurrent.CancellationToken;
import com.tyron.ghostj.api.editor.EditorSnapshot;
import com.tyron.ghostj.api.suggestion.CompletionCandidate;
import com.tyron.ghostj.api.suggestion.CompletionFetcher;
import com.tyron.ghostj.api.suggestion.SuggestionResult;
import com.tyron.ghostj.api.suggestion.SuggestionService;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for editor commands: fetches candidates for a snapshot and drives the
 * {@link SuggestionService} with them.
 * <p>
 * Cancellation only decides whether fetched candidates are presented; once presentation starts it
 * runs to completion.
 */
public final class SuggestionCommandHandler {

    private static final Logger LOG = Logger.getLogger(SuggestionCommandHandler.class.getName());

    private final CompletionFetcher fetcher;
    private final SuggestionService service;

    public SuggestionCommandHandler(CompletionFetcher fetcher, SuggestionService service) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.service = Objects.requireNonNull(service, "service");
    }

    /**
     * Fetches candidates and presents the first one.
     *
     * @return {@code null} if the fetch was cancelled or returned no candidates
     * @throws IOException if the fetcher failed
     */
    @Nullable
    public SuggestionResult requestSuggestions(EditorSnapshot snapshot, CancellationToken token) throws IOException {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(token, "token");
        if (token.isCancelled()) {
            return null;
        }

        List<CompletionCandidate> candidates = fetcher.fetch(snapshot, token);
        if (token.isCancelled()) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Completion request for '" + snapshot.documentId() + "' was cancelled");
            }
            return null;
        }
        if (candidates == null || candidates.isEmpty()) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("No completions for '" + snapshot.documentId() + "' at " + snapshot.cursorPosition());
            }
            return null;
        }

        return service.presentSuggestions(snapshot, candidates);
    }

    @Nullable
    public SuggestionResult acceptSuggestion(EditorSnapshot snapshot) {
        return service.acceptSuggestion(snapshot);
    }

    @Nullable
    public SuggestionResult rejectSuggestion(EditorSnapshot snapshot) {
        return service.rejectSuggestion(snapshot);
    }

    @Nullable
    public SuggestionResult presentNextSuggestion(EditorSnapshot snapshot) {
        return service.presentNextSuggestion(snapshot);
    }

    @Nullable
    public SuggestionResult presentPreviousSuggestion(EditorSnapshot snapshot) {
        return service.presentPreviousSuggestion(snapshot);
    }
}
