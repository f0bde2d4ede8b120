package com.tyron.ghostj.core.patch;

import com.tyron.ghostj.api.suggestion.LineRange;
import com.tyron.ghostj.api.suggestion.Modification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies a list of {@link Modification}s to a line array.
 * <p>
 * Ranges in the list refer to the original line indices. The applicator orders a copy of the list by
 * start line and merges it with the original lines in one left-to-right pass, so later modifications
 * land correctly however much earlier ones grew or shrank the buffer.
 * <p>
 * Ordering rules:
 * <ul>
 *   <li>the input does not have to be sorted;</li>
 *   <li>two modifications overlap when one starts before the other ends;</li>
 *   <li>a zero-width modification (an insert) conflicts with any other modification starting at the
 *       same line, since its position relative to that one would be ambiguous.</li>
 * </ul>
 */
public final class PatchApplicator {

    private static final Logger LOG = Logger.getLogger(PatchApplicator.class.getName());

    private static final Comparator<Modification> BY_START = Comparator
            .comparingInt((Modification m) -> m.range().start())
            .thenComparingInt(m -> m.range().length());

    private PatchApplicator() {
    }

    /**
     * @return a new list holding the patched lines; {@code lines} and {@code modifications} are not modified
     * @throws MalformedPatchException if a range is out of bounds or two ranges overlap
     */
    public static List<String> apply(List<String> lines, List<? extends Modification> modifications) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(modifications, "modifications");

        List<Modification> sorted = new ArrayList<>(modifications.size());
        for (Modification m : modifications) {
            sorted.add(Objects.requireNonNull(m, "modification"));
        }
        sorted.sort(BY_START);

        int delta = validate(lines.size(), sorted);

        List<String> out = new ArrayList<>(Math.max(0, lines.size() + delta));
        int next = 0;
        for (Modification m : sorted) {
            LineRange range = m.range();
            out.addAll(lines.subList(next, range.start()));
            out.addAll(m.newLines());
            next = range.end();
        }
        out.addAll(lines.subList(next, lines.size()));
        return out;
    }

    /**
     * @return the total change in line count
     */
    private static int validate(int lineCount, List<Modification> sorted) {
        int delta = 0;
        Modification previous = null;
        for (Modification m : sorted) {
            LineRange range = m.range();
            if (range.end() > lineCount) {
                throw malformed("Modification " + m + " reaches past the last line (lineCount=" + lineCount + ")", m);
            }
            if (previous != null) {
                LineRange prev = previous.range();
                boolean overlaps = range.start() < prev.end()
                        || (prev.isEmpty() && range.start() == prev.start());
                if (overlaps) {
                    throw malformed("Modification " + m + " overlaps " + previous, m);
                }
            }
            delta += m.lineDelta();
            previous = m;
        }
        return delta;
    }

    private static MalformedPatchException malformed(String message, Modification m) {
        if (LOG.isLoggable(Level.WARNING)) {
            LOG.warning(message);
        }
        return new MalformedPatchException(message, m);
    }
}
