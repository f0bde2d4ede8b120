package com.tyron.ghostj.core.suggestion;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link PresentationStore}.
 *
 * Thread-safety: different documents may be used from different threads; calls for one document are
 * expected to be serialised by the caller.
 */
public final class InMemoryPresentationStore implements PresentationStore {

    private final Map<String, PresentationState> states = new ConcurrentHashMap<>();

    @Override
    public @Nullable PresentationState get(String documentId) {
        return states.get(Objects.requireNonNull(documentId, "documentId"));
    }

    @Override
    public void put(String documentId, PresentationState state) {
        states.put(Objects.requireNonNull(documentId, "documentId"), Objects.requireNonNull(state, "state"));
    }

    @Override
    public @Nullable PresentationState remove(String documentId) {
        return states.remove(Objects.requireNonNull(documentId, "documentId"));
    }

    @Override
    public void clear() {
        states.clear();
    }

    public int size() {
        return states.size();
    }
}
