package com.tyron.ghostj.api.suggestion;

import java.util.List;
import java.util.Objects;

/**
 * A line-granularity edit.
 * <p>
 * Within one list of modifications every range refers to the line indices of the buffer the list is
 * applied to, before any of them ran, and ranges do not overlap. Callers never shift indices to
 * account for earlier modifications of the same list.
 */
public sealed interface Modification permits Modification.Insert, Modification.Delete, Modification.Replace {

    /**
     * The original lines this modification consumes. Zero-width for inserts.
     */
    LineRange range();

    /**
     * The lines emitted in place of {@link #range()}.
     */
    List<String> newLines();

    /**
     * Change in line count once applied.
     */
    default int lineDelta() {
        return newLines().size() - range().length();
    }

    /**
     * Inserts {@code newLines} before the line at {@code atLine}. {@code atLine} may equal the line count
     * to append.
     */
    record Insert(int atLine, List<String> newLines) implements Modification {
        public Insert {
            if (atLine < 0) {
                throw new IllegalArgumentException("atLine < 0: " + atLine);
            }
            newLines = List.copyOf(Objects.requireNonNull(newLines, "newLines"));
        }

        @Override
        public LineRange range() {
            return new LineRange(atLine, atLine);
        }
    }

    /**
     * Removes the lines of {@code range}.
     */
    record Delete(LineRange range) implements Modification {
        public Delete {
            Objects.requireNonNull(range, "range");
        }

        @Override
        public List<String> newLines() {
            return List.of();
        }
    }

    /**
     * Removes the lines of {@code range} and puts {@code newLines} at its start.
     */
    record Replace(LineRange range, List<String> newLines) implements Modification {
        public Replace {
            Objects.requireNonNull(range, "range");
            newLines = List.copyOf(Objects.requireNonNull(newLines, "newLines"));
        }
    }
}
