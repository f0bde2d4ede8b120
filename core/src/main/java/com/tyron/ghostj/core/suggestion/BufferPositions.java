package com.tyron.ghostj.core.suggestion;

import com.tyron.ghostj.api.editor.CursorPosition;
import com.tyron.ghostj.api.editor.CursorRange;
import com.tyron.ghostj.api.editor.Lines;

import java.util.List;

/**
 * Position arithmetic over line arrays.
 */
final class BufferPositions {

    private BufferPositions() {
    }

    /**
     * Moves {@code position} onto the buffer. A line past the end maps to the end of the document, which
     * is {@code (size, 0)} when the last line is terminated and the end of the last line otherwise. A
     * character past the end of its line maps to the end of the line's text.
     */
    static CursorPosition clamp(List<String> lines, CursorPosition position) {
        int size = lines.size();
        if (size == 0) {
            return CursorPosition.ZERO;
        }
        if (position.line() >= size) {
            String last = lines.get(size - 1);
            return Lines.isTerminated(last)
                    ? CursorPosition.of(size, 0)
                    : CursorPosition.of(size - 1, last.length());
        }
        int length = Lines.textOf(lines.get(position.line())).length();
        return position.character() > length ? CursorPosition.of(position.line(), length) : position;
    }

    static CursorRange clamp(List<String> lines, CursorRange range) {
        return new CursorRange(clamp(lines, range.start()), clamp(lines, range.end()));
    }

    static CursorRange shiftLines(CursorRange range, int delta) {
        int startLine = Math.max(0, range.start().line() + delta);
        int endLine = Math.max(startLine, range.end().line() + delta);
        return new CursorRange(range.start().withLine(startLine), range.end().withLine(endLine));
    }

    /**
     * @return where the caret ends up after {@code text} was written starting at column 0 of {@code line}
     */
    static CursorPosition endOf(int line, String text) {
        List<String> parts = Lines.split(text);
        if (parts.isEmpty()) {
            return CursorPosition.of(line, 0);
        }
        String last = parts.get(parts.size() - 1);
        if (Lines.isTerminated(last)) {
            return CursorPosition.of(line + parts.size(), 0);
        }
        return CursorPosition.of(line + parts.size() - 1, last.length());
    }
}
