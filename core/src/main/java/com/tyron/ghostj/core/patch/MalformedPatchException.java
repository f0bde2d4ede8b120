package com.tyron.ghostj.core.patch;

import com.tyron.ghostj.api.suggestion.Modification;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a list of {@link Modification}s cannot be applied to a buffer: a range reaches past the
 * last line, or two modifications overlap.
 * <p>
 * This is a programming error of whoever built the list. The buffer passed to
 * {@link PatchApplicator#apply} is never touched.
 */
public class MalformedPatchException extends RuntimeException {

    private final transient Modification modification;

    public MalformedPatchException(String message, @Nullable Modification modification) {
        super(message);
        this.modification = modification;
    }

    /**
     * @return the modification that was rejected, if a single one is to blame
     */
    @Nullable
    public Modification getModification() {
        return modification;
    }
}
