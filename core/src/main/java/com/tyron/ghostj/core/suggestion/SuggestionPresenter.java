package com.tyron.ghostj.core.suggestion;

import com.tyron.ghostj.api.editor.CursorPosition;
import com.tyron.ghostj.api.editor.EditorSnapshot;
import com.tyron.ghostj.api.editor.Lines;
import com.tyron.ghostj.api.suggestion.CompletionCandidate;
import com.tyron.ghostj.api.suggestion.Modification;
import com.tyron.ghostj.api.suggestion.SuggestionResult;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shows candidates inline and records what was shown.
 */
public final class SuggestionPresenter {

    private static final Logger LOG = Logger.getLogger(SuggestionPresenter.class.getName());

    private final PresentationStore store;
    private final SuggestionInjector injector;

    SuggestionPresenter(PresentationStore store, SuggestionInjector injector) {
        this.store = Objects.requireNonNull(store, "store");
        this.injector = Objects.requireNonNull(injector, "injector");
    }

    /**
     * Renders {@code candidates.get(index)} into the snapshot's buffer.
     * <p>
     * A block the document already shows is taken out first and its state is dropped; the returned
     * modifications then cover both steps.
     *
     * @return {@code null} if there are no candidates, in which case no state is touched
     */
    @Nullable
    public SuggestionResult present(EditorSnapshot snapshot, List<CompletionCandidate> candidates, int index) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(candidates, "candidates");
        if (candidates.isEmpty()) {
            return null;
        }
        Objects.checkIndex(index, candidates.size());

        String documentId = snapshot.documentId();
        List<String> lines = snapshot.lines();

        SuggestionInjector.Ejection previous = injector.ejectAll(lines, snapshot.cursorPosition(), store.get(documentId));
        boolean replaced = previous.block() != null;
        if (replaced && LOG.isLoggable(Level.FINE)) {
            LOG.fine("Replacing suggestion block " + previous.block() + " in '" + documentId + "'");
        }

        SuggestionInjector.Injection injection = injector.inject(previous.lines(), previous.cursor(), candidates, index);

        List<Modification> modifications = replaced
                ? Lines.diff(lines, injection.lines())
                : injection.modifications();

        SuggestionResult result = new SuggestionResult(injection.lines(), modifications, injection.cursor());
        store.put(documentId, injection.state());

        if (LOG.isLoggable(Level.FINE)) {
            PresentationState state = injection.state();
            LOG.fine("Presented suggestion " + (index + 1) + "/" + candidates.size() + " in '" + documentId
                    + "' at line " + state.anchorLineIndex() + " (" + state.injectedLineCount() + " lines)");
        }
        return result;
    }

    /**
     * Re-renders the suggestion of an existing presentation with another candidate.
     */
    SuggestionResult cycle(EditorSnapshot snapshot, PresentationState state, int step) {
        String documentId = snapshot.documentId();
        List<String> lines = snapshot.lines();
        CursorPosition cursor = snapshot.cursorPosition();

        SuggestionInjector.Ejection ejection = injector.eject(lines, cursor, state);
        if (ejection.block() == null) {
            store.remove(documentId);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("Suggestion block of '" + documentId + "' is gone, nothing to cycle");
            }
            return new SuggestionResult(lines, List.of(), cursor);
        }

        int next = Math.floorMod(state.currentIndex() + step, state.candidateCount());
        SuggestionInjector.Injection injection = injector.inject(ejection.lines(), ejection.cursor(), state.candidates(), next);

        SuggestionResult result = new SuggestionResult(injection.lines(), Lines.diff(lines, injection.lines()), injection.cursor());
        store.put(documentId, injection.state());

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Cycled suggestion in '" + documentId + "' to " + (next + 1) + "/" + state.candidateCount());
        }
        return result;
    }
}
