package com.tyron.ghostj.core.suggestion;

import com.tyron.ghostj.api.editor.CursorPosition;
import com.tyron.ghostj.api.editor.CursorRange;
import com.tyron.ghostj.api.editor.Lines;
import com.tyron.ghostj.api.suggestion.CompletionCandidate;
import com.tyron.ghostj.api.suggestion.LineRange;
import com.tyron.ghostj.api.suggestion.Modification;
import com.tyron.ghostj.core.patch.PatchApplicator;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Puts a rendered candidate into a line array and takes it out again.
 * <p>
 * A candidate is rendered as a block of whole lines framed by the start and end markers of
 * {@link SuggestionSettings}:
 * <pre>
 * &lt;start marker&gt; 1/3
 * candidate text
 * &lt;end marker&gt;
 * </pre>
 * The block goes right after the last line the candidate's range touches, so the original lines are
 * never altered and taking the block out restores them exactly.
 * <p>
 * This class is stateless; {@link SuggestionPresenter} and {@link SuggestionResolver} decide what is
 * kept in the {@link PresentationStore}.
 */
final class SuggestionInjector {

    record Injection(List<String> lines, List<Modification> modifications, CursorPosition cursor,
                     PresentationState state) {
    }

    /**
     * @param block the block found in the input, or {@code null} if there was none and nothing changed
     */
    record Ejection(List<String> lines, List<Modification> modifications, CursorPosition cursor,
                    @Nullable LineRange block) {
    }

    private final SuggestionSettings settings;

    SuggestionInjector(SuggestionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    Injection inject(List<String> lines, CursorPosition cursor, List<CompletionCandidate> candidates, int index) {
        CompletionCandidate candidate = candidates.get(index);
        String terminator = Lines.detectTerminator(lines);
        List<String> block = render(candidate, index, candidates.size(), terminator);

        int size = lines.size();
        CursorRange target = BufferPositions.clamp(lines, candidate.range());
        int anchor = Math.min(target.end().line() + 1, size);

        String detachedLine = null;
        Modification modification;
        if (anchor == size && size > 0 && !Lines.isTerminated(lines.get(size - 1))) {
            detachedLine = lines.get(size - 1);
            List<String> replacement = new ArrayList<>(block.size() + 1);
            replacement.add(detachedLine + terminator);
            replacement.addAll(block);
            modification = new Modification.Replace(new LineRange(size - 1, size), replacement);
        } else {
            modification = new Modification.Insert(anchor, block);
        }

        List<Modification> modifications = List.of(modification);
        List<String> newLines = PatchApplicator.apply(lines, modifications);

        CursorPosition newCursor = cursor.line() >= anchor
                ? cursor.withLine(cursor.line() + block.size())
                : cursor;

        PresentationState state = new PresentationState(candidates, index, anchor, block.size(), target, detachedLine);
        return new Injection(newLines, modifications, newCursor, state);
    }

    /**
     * Takes the suggestion block out of {@code lines}.
     * <p>
     * The block is looked for where {@code state} says it is; if the buffer drifted since, the first
     * marker-framed block is used instead.
     *
     * @param state what was presented, or {@code null} to strip a stray block nobody tracks
     */
    Ejection eject(List<String> lines, CursorPosition cursor, @Nullable PresentationState state) {
        return strip(lines, cursor, state, false);
    }

    /**
     * Like {@link #eject} but also takes out every other marker-framed block, e.g. blocks left behind
     * by an editor that lost track of its suggestions. {@link Ejection#block()} is the tracked one.
     */
    Ejection ejectAll(List<String> lines, CursorPosition cursor, @Nullable PresentationState state) {
        return strip(lines, cursor, state, true);
    }

    private Ejection strip(List<String> lines, CursorPosition cursor, @Nullable PresentationState state, boolean all) {
        LineRange block = null;
        if (state != null) {
            block = blockAt(lines, state.anchorLineIndex(), state.injectedLineCount());
        }
        if (block == null) {
            block = findBlock(lines, 0);
        }
        if (block == null) {
            return new Ejection(lines, List.of(), cursor, null);
        }

        List<LineRange> blocks = new ArrayList<>();
        blocks.add(block);
        if (all) {
            LineRange other = findBlock(lines, 0);
            while (other != null) {
                if (other.end() <= block.start() || other.start() >= block.end()) {
                    blocks.add(other);
                    other = findBlock(lines, other.end());
                } else {
                    other = findBlock(lines, block.end());
                }
            }
        }

        List<Modification> modifications = new ArrayList<>(blocks.size());
        for (LineRange range : blocks) {
            modifications.add(range == block ? removal(lines, block, state, blocks) : new Modification.Delete(range));
        }
        List<String> restored = PatchApplicator.apply(lines, modifications);

        // Moves up by the deleted lines at or above the cursor; column 0 if the cursor sat in a block.
        int line = cursor.line();
        int removedAbove = 0;
        boolean inside = false;
        for (LineRange range : blocks) {
            if (range.contains(line)) {
                inside = true;
                removedAbove += line - range.start() + 1;
            } else if (line >= range.end()) {
                removedAbove += range.length();
            }
        }
        CursorPosition newCursor = removedAbove == 0
                ? cursor
                : CursorPosition.of(Math.max(0, line - removedAbove), inside ? 0 : cursor.character());

        return new Ejection(restored, List.copyOf(modifications), newCursor, block);
    }

    private static Modification removal(List<String> lines, LineRange block, @Nullable PresentationState state,
                                        List<LineRange> blocks) {
        String detachedLine = state != null ? state.detachedLine() : null;
        if (detachedLine != null && block.end() == lines.size() && block.start() > 0) {
            int before = block.start() - 1;
            String line = lines.get(before);
            boolean free = blocks.stream().noneMatch(range -> range.contains(before));
            if (free && Lines.isTerminated(line) && Lines.textOf(line).equals(detachedLine)) {
                return new Modification.Replace(new LineRange(before, block.end()), List.of(detachedLine));
            }
        }
        return new Modification.Delete(block);
    }

    List<String> render(CompletionCandidate candidate, int index, int count, String terminator) {
        List<String> block = new ArrayList<>();
        block.add(settings.startMarker() + " " + (index + 1) + "/" + count + terminator);
        for (String line : Lines.split(candidate.text())) {
            block.add(Lines.isTerminated(line) ? line : line + terminator);
        }
        block.add(settings.endMarker() + terminator);
        return block;
    }

    boolean isStartLine(String line) {
        return line.startsWith(settings.startMarker());
    }

    boolean isEndLine(String line) {
        return line.startsWith(settings.endMarker());
    }

    @Nullable
    private LineRange blockAt(List<String> lines, int anchor, int count) {
        int end = anchor + count;
        if (end > lines.size()) {
            return null;
        }
        if (!isStartLine(lines.get(anchor)) || !isEndLine(lines.get(end - 1))) {
            return null;
        }
        return new LineRange(anchor, end);
    }

    @Nullable
    LineRange findBlock(List<String> lines) {
        return findBlock(lines, 0);
    }

    /**
     * @return the first block starting at or after {@code from}, or {@code null}
     */
    @Nullable
    private LineRange findBlock(List<String> lines, int from) {
        int start = -1;
        for (int i = from; i < lines.size(); i++) {
            String line = lines.get(i);
            if (start < 0) {
                if (isStartLine(line)) {
                    start = i;
                }
            } else if (isEndLine(line)) {
                return new LineRange(start, i + 1);
            }
        }
        return null;
    }
}
