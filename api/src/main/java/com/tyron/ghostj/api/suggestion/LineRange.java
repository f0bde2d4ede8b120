package com.tyron.ghostj.api.suggestion;

/**
 * Half-open range of line indices {@code [start, end)}.
 */
public record LineRange(int start, int end) {

    public LineRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid line range [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }

    public boolean contains(int line) {
        return line >= start && line < end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
