package com.tyron.ghostj.api.editor;

import java.util.List;
import java.util.Objects;

/**
 * What the editor integration hands to the suggestion engine for one call: the document it belongs
 * to, the current buffer and the indentation settings of the editor.
 *
 * @param documentId key of the open document, used to look up its presentation state
 */
public record EditorSnapshot(String documentId,
                             LineBuffer buffer,
                             int tabSize,
                             int indentSize,
                             boolean usesTabsForIndentation) {

    public EditorSnapshot {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(buffer, "buffer");
    }

    public EditorSnapshot(String documentId, LineBuffer buffer) {
        this(documentId, buffer, 4, 4, false);
    }

    /**
     * Creates a snapshot from both representations of the text, as editors usually report them.
     *
     * @throws IllegalArgumentException if {@code content} is not the concatenation of {@code lines}
     */
    public static EditorSnapshot of(String documentId,
                                    String content,
                                    List<String> lines,
                                    CursorPosition cursor,
                                    List<CursorRange> selections,
                                    int tabSize,
                                    int indentSize,
                                    boolean usesTabsForIndentation) {
        Objects.requireNonNull(content, "content");
        if (!content.equals(Lines.join(lines))) {
            throw new IllegalArgumentException("content and lines of document '" + documentId + "' are out of sync");
        }
        return new EditorSnapshot(documentId, new LineBuffer(lines, cursor, selections),
                tabSize, indentSize, usesTabsForIndentation);
    }

    public String content() {
        return buffer.content();
    }

    public List<String> lines() {
        return buffer.lines();
    }

    public CursorPosition cursorPosition() {
        return buffer.cursor();
    }

    public List<CursorRange> selections() {
        return buffer.selections();
    }
}
