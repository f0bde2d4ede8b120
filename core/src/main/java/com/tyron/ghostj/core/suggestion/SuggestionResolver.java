package com.tyron.ghostj.core.suggestion;

import com.tyron.ghostj.api.editor.CursorPosition;
import com.tyron.ghostj.api.editor.CursorRange;
import com.tyron.ghostj.api.editor.EditorSnapshot;
import com.tyron.ghostj.api.editor.Lines;
import com.tyron.ghostj.api.suggestion.CompletionCandidate;
import com.tyron.ghostj.api.suggestion.LineRange;
import com.tyron.ghostj.api.suggestion.Modification;
import com.tyron.ghostj.api.suggestion.SuggestionResult;
import com.tyron.ghostj.core.patch.PatchApplicator;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ends or advances a presentation: reject, accept and cycle.
 * <p>
 * Every operation works on the snapshot the caller passes in, which may differ from the buffer the
 * suggestion was presented into if the user kept typing.
 */
public final class SuggestionResolver {

    private static final Logger LOG = Logger.getLogger(SuggestionResolver.class.getName());

    private final PresentationStore store;
    private final SuggestionInjector injector;
    private final SuggestionPresenter presenter;

    SuggestionResolver(PresentationStore store, SuggestionInjector injector, SuggestionPresenter presenter) {
        this.store = Objects.requireNonNull(store, "store");
        this.injector = Objects.requireNonNull(injector, "injector");
        this.presenter = Objects.requireNonNull(presenter, "presenter");
    }

    /**
     * Removes the suggestion block and drops every pending candidate of the document.
     * <p>
     * Cursor policy: the cursor line moves up by the number of removed lines at or above it. A cursor
     * inside the block thus lands on the line before the block (line 0 if there is none) at column 0;
     * a cursor below the block keeps its column, a cursor above it stays.
     * <p>
     * Blocks left in the buffer without tracked state (for example after the editor reloaded the
     * document) are removed as well.
     *
     * @return {@code null} if the document neither has a presentation nor shows a block
     */
    @Nullable
    public SuggestionResult reject(EditorSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        String documentId = snapshot.documentId();
        PresentationState state = store.get(documentId);
        if (state == null && injector.findBlock(snapshot.lines()) == null) {
            return null;
        }

        SuggestionInjector.Ejection ejection = injector.ejectAll(snapshot.lines(), snapshot.cursorPosition(), state);
        store.remove(documentId);

        if (LOG.isLoggable(Level.FINE)) {
            if (ejection.block() == null) {
                LOG.fine("Suggestion block of '" + documentId + "' is gone, dropping its state");
            } else {
                LOG.fine("Rejected suggestion block " + ejection.block() + " in '" + documentId + "'");
            }
        }
        return new SuggestionResult(ejection.lines(), ejection.modifications(), ejection.cursor());
    }

    /**
     * Replaces the suggestion block, together with the lines the candidate targets, by the document
     * text with the candidate applied. The cursor goes to the end of the inserted text.
     *
     * @return {@code null} if the document has no presentation
     */
    @Nullable
    public SuggestionResult accept(EditorSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        String documentId = snapshot.documentId();
        PresentationState state = store.get(documentId);
        if (state == null) {
            return null;
        }

        List<String> lines = snapshot.lines();
        SuggestionInjector.Ejection ejection = injector.eject(lines, snapshot.cursorPosition(), state);
        LineRange block = ejection.block();
        if (block == null) {
            store.remove(documentId);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Suggestion block of '" + documentId + "' is gone, nothing to accept");
            }
            return new SuggestionResult(lines, List.of(), snapshot.cursorPosition());
        }

        List<String> restored = ejection.lines();
        int anchor = block.start();
        int drift = anchor - state.anchorLineIndex();
        CursorRange target = BufferPositions.clamp(restored, BufferPositions.shiftLines(state.target(), drift));

        int startLine = Math.min(target.start().line(), anchor);
        int endLine = target.end().line();

        String prefix = "";
        if (startLine < restored.size() && startLine < anchor) {
            String text = Lines.textOf(restored.get(startLine));
            prefix = text.substring(0, Math.min(target.start().character(), text.length()));
        }
        String suffix = "";
        if (endLine < restored.size() && endLine < anchor) {
            String line = restored.get(endLine);
            int from = Math.min(target.end().character(), Lines.textOf(line).length());
            suffix = line.substring(from);
        }

        CompletionCandidate candidate = state.currentCandidate();
        String head = prefix + candidate.text();
        List<String> merged = Lines.split(head + suffix);

        // The block sits right after the target's last line, so [startLine, block end) covers both. Lines
        // before the block are the same in the restored and the current buffer, except for a detached
        // last line, which the merged text covers.
        List<Modification> modifications = List.of(new Modification.Replace(new LineRange(startLine, block.end()), merged));
        List<String> newLines = PatchApplicator.apply(lines, modifications);

        CursorPosition newCursor = BufferPositions.endOf(startLine, head);
        store.remove(documentId);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Accepted suggestion " + (state.currentIndex() + 1) + "/" + state.candidateCount()
                    + " in '" + documentId + "', cursor at " + newCursor);
        }
        return new SuggestionResult(newLines, modifications, newCursor);
    }

    /**
     * Shows the candidate {@code step} places after the current one, wrapping around.
     *
     * @return {@code null} if the document has no presentation
     */
    @Nullable
    public SuggestionResult cycle(EditorSnapshot snapshot, int step) {
        Objects.requireNonNull(snapshot, "snapshot");
        PresentationState state = store.get(snapshot.documentId());
        if (state == null) {
            return null;
        }
        return presenter.cycle(snapshot, state, step);
    }
}
