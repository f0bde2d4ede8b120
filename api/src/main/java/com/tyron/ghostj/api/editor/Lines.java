package com.tyron.ghostj.api.editor;

import com.tyron.ghostj.api.suggestion.LineRange;
import com.tyron.ghostj.api.suggestion.Modification;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the line-array representation of text.
 * <p>
 * A line keeps its own terminator ({@code \n}, {@code \r\n} or {@code \r}); only the last line of a
 * document may lack one. Joining the lines of a split always gives back the original string.
 */
public final class Lines {

    public static final String DEFAULT_TERMINATOR = "\n";

    private Lines() {
    }

    public static List<String> split(String text) {
        List<String> result = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return result;
        }

        int lineStart = 0;
        int i = 0;
        int len = text.length();
        while (i < len) {
            char c = text.charAt(i);
            if (c == '\n') {
                result.add(text.substring(lineStart, i + 1));
                lineStart = ++i;
            } else if (c == '\r') {
                int end = (i + 1 < len && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                result.add(text.substring(lineStart, end));
                lineStart = i = end;
            } else {
                i++;
            }
        }
        if (lineStart < len) {
            result.add(text.substring(lineStart));
        }
        return result;
    }

    public static String join(List<String> lines) {
        return String.join("", lines);
    }

    /**
     * @return the terminator at the end of {@code line}, or an empty string if it has none.
     */
    public static String terminatorOf(String line) {
        if (line.endsWith("\r\n")) return "\r\n";
        if (line.endsWith("\n")) return "\n";
        if (line.endsWith("\r")) return "\r";
        return "";
    }

    public static boolean isTerminated(String line) {
        return !terminatorOf(line).isEmpty();
    }

    /**
     * @return the line without its terminator.
     */
    public static String textOf(String line) {
        return line.substring(0, line.length() - terminatorOf(line).length());
    }

    /**
     * The terminator used by a document: the first one found, or {@link #DEFAULT_TERMINATOR}.
     */
    public static String detectTerminator(List<String> lines) {
        for (String line : lines) {
            String t = terminatorOf(line);
            if (!t.isEmpty()) {
                return t;
            }
        }
        return DEFAULT_TERMINATOR;
    }

    /**
     * Computes the minimal modification list that turns {@code before} into {@code after}.
     * <p>
     * The common prefix and suffix are left alone and the differing middle is expressed as a single
     * insert, delete or replace. Equal inputs produce an empty list.
     */
    public static List<Modification> diff(List<String> before, List<String> after) {
        int max = Math.min(before.size(), after.size());

        int prefix = 0;
        while (prefix < max && before.get(prefix).equals(after.get(prefix))) {
            prefix++;
        }

        int suffix = 0;
        while (suffix < max - prefix
                && before.get(before.size() - 1 - suffix).equals(after.get(after.size() - 1 - suffix))) {
            suffix++;
        }

        int removedEnd = before.size() - suffix;
        List<String> inserted = List.copyOf(after.subList(prefix, after.size() - suffix));

        if (prefix == removedEnd && inserted.isEmpty()) {
            return List.of();
        }
        if (prefix == removedEnd) {
            return List.of(new Modification.Insert(prefix, inserted));
        }
        LineRange range = new LineRange(prefix, removedEnd);
        if (inserted.isEmpty()) {
            return List.of(new Modification.Delete(range));
        }
        return List.of(new Modification.Replace(range, inserted));
    }
}
