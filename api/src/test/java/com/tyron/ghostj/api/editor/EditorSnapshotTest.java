package com.tyron.ghostj.api.editor;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class EditorSnapshotTest {

    @Test
    public void contentAndLinesMustAgree() {
        List<String> lines = List.of("a\n", "b");

        EditorSnapshot snapshot = EditorSnapshot.of("doc", "a\nb", lines, CursorPosition.of(1, 1), List.of(), 2, 2, true);

        assertEquals("a\nb", snapshot.content());
        assertEquals(lines, snapshot.lines());
        assertEquals(CursorPosition.of(1, 1), snapshot.cursorPosition());
        assertTrue(snapshot.usesTabsForIndentation());

        assertThrows(IllegalArgumentException.class,
                () -> EditorSnapshot.of("doc", "a\nc", lines, CursorPosition.ZERO, List.of(), 4, 4, false));
    }

    @Test
    public void bufferIsACopy() {
        List<String> lines = new ArrayList<>(List.of("a\n"));
        LineBuffer buffer = new LineBuffer(lines, CursorPosition.ZERO);

        lines.add("b\n");

        assertThat(buffer.lines()).containsExactly("a\n");
        assertThrows(UnsupportedOperationException.class, () -> buffer.lines().add("c\n"));
    }

    @Test
    public void snapshotDefaults() {
        EditorSnapshot snapshot = new EditorSnapshot("doc", LineBuffer.of("x\ny", CursorPosition.of(1, 0)));

        assertEquals(4, snapshot.tabSize());
        assertEquals(4, snapshot.indentSize());
        assertEquals(2, snapshot.buffer().lineCount());
        assertThat(snapshot.selections()).isEmpty();
    }

    @Test
    public void positionsAndRanges() {
        assertThrows(IllegalArgumentException.class, () -> CursorPosition.of(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> CursorPosition.of(0, -1));
        assertThrows(IllegalArgumentException.class, () -> CursorRange.of(1, 0, 0, 5));

        assertTrue(CursorPosition.of(0, 9).isBefore(CursorPosition.of(1, 0)));
        assertTrue(CursorRange.empty(CursorPosition.of(2, 3)).isEmpty());
        assertFalse(CursorRange.of(0, 0, 0, 1).isEmpty());
    }
}
