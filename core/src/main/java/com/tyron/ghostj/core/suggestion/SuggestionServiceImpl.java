package com.tyron.ghostj.core.suggestion;

import com.tyron.ghostj.api.editor.EditorSnapshot;
import com.tyron.ghostj.api.suggestion.CompletionCandidate;
import com.tyron.ghostj.api.suggestion.SuggestionResult;
import com.tyron.ghostj.api.suggestion.SuggestionService;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Core implementation of {@link SuggestionService}.
 * <p>
 * All presentation state lives in the injected {@link PresentationStore}; one instance may serve any
 * number of documents.
 */
public final class SuggestionServiceImpl implements SuggestionService {

    private final PresentationStore store;
    private final SuggestionPresenter presenter;
    private final SuggestionResolver resolver;

    public SuggestionServiceImpl() {
        this(new InMemoryPresentationStore(), SuggestionSettings.defaults());
    }

    public SuggestionServiceImpl(PresentationStore store, SuggestionSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        SuggestionInjector injector = new SuggestionInjector(settings);
        this.presenter = new SuggestionPresenter(store, injector);
        this.resolver = new SuggestionResolver(store, injector, presenter);
    }

    @Override
    public @Nullable SuggestionResult presentSuggestions(@NotNull EditorSnapshot snapshot,
                                                         @NotNull List<CompletionCandidate> candidates) {
        return presenter.present(snapshot, candidates, 0);
    }

    @Override
    public @Nullable SuggestionResult presentSuggestions(@NotNull EditorSnapshot snapshot,
                                                         @NotNull List<CompletionCandidate> candidates,
                                                         int index) {
        return presenter.present(snapshot, candidates, index);
    }

    @Override
    public @Nullable SuggestionResult rejectSuggestion(@NotNull EditorSnapshot snapshot) {
        return resolver.reject(snapshot);
    }

    @Override
    public @Nullable SuggestionResult acceptSuggestion(@NotNull EditorSnapshot snapshot) {
        return resolver.accept(snapshot);
    }

    @Override
    public @Nullable SuggestionResult presentNextSuggestion(@NotNull EditorSnapshot snapshot) {
        return resolver.cycle(snapshot, 1);
    }

    @Override
    public @Nullable SuggestionResult presentPreviousSuggestion(@NotNull EditorSnapshot snapshot) {
        return resolver.cycle(snapshot, -1);
    }

    @Override
    public boolean hasActiveSuggestion(@NotNull String documentId) {
        return store.contains(documentId);
    }

    @Override
    public void closeDocument(@NotNull String documentId) {
        store.remove(documentId);
    }
}
