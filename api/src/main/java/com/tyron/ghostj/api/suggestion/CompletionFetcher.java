package com.tyron.ghostj.api.suggestion;

import com.tyron.ghostj.api.concurrent.CancellationToken;
import com.tyron.ghostj.api.editor.EditorSnapshot;

import java.io.IOException;
import java.util.List;

/**
 * Source of completion candidates, usually a remote completion backend.
 */
@FunctionalInterface
public interface CompletionFetcher {

    /**
     * @return candidates ordered by preference, never {@code null}
     * @throws IOException if the backend could not be reached
     */
    List<CompletionCandidate> fetch(EditorSnapshot snapshot, CancellationToken token) throws IOException;
}
