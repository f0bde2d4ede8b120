package com.tyron.ghostj.core.suggestion;

import org.jetbrains.annotations.Nullable;

/**
 * Holds at most one {@link PresentationState} per open document.
 */
public interface PresentationStore {

    @Nullable
    PresentationState get(String documentId);

    /**
     * Stores {@code state}, replacing whatever the document had.
     */
    void put(String documentId, PresentationState state);

    @Nullable
    PresentationState remove(String documentId);

    default boolean contains(String documentId) {
        return get(documentId) != null;
    }

    void clear();
}
