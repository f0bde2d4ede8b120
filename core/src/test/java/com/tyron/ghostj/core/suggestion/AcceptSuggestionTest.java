package com.tyron.ghostj.core.suggestion;

import com.tyron.ghostj.api.editor.CursorPosition;
import com.tyron.ghostj.api.suggestion.CompletionCandidate;
import com.tyron.ghostj.api.suggestion.SuggestionResult;
import com.tyron.ghostj.testFramework.BaseSuggestionTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class AcceptSuggestionTest extends BaseSuggestionTest {

    private SuggestionResult presentAndAccept(List<String> lines, CursorPosition cursor, CompletionCandidate candidate) {
        SuggestionResult presented = service.presentSuggestions(snapshot(lines, cursor.line(), cursor.character()), List.of(candidate));
        List<String> shown = check(lines, presented);

        SuggestionResult accepted = service.acceptSuggestion(
                snapshot(shown, presented.newCursor().line(), presented.newCursor().character()));
        check(shown, accepted);
        assertFalse(service.hasActiveSuggestion(DOCUMENT));
        return accepted;
    }

    @Test
    public void insertsTextAtTheCursor() {
        SuggestionResult accepted = presentAndAccept(
                List.of("foo(\n", "bar\n"), CursorPosition.of(0, 4), insertion("x)", 0, 4));

        assertThat(accepted.lines()).containsExactly("foo(x)\n", "bar\n").inOrder();
        assertEquals(CursorPosition.of(0, 6), accepted.newCursor());
    }

    @Test
    public void replacesTheTargetRange() {
        SuggestionResult accepted = presentAndAccept(
                List.of("let value = fo\n", "print(value)\n"), CursorPosition.of(0, 14), candidate("foo()", 0, 12, 0, 14));

        assertThat(accepted.lines()).containsExactly("let value = foo()\n", "print(value)\n").inOrder();
        assertEquals(CursorPosition.of(0, 17), accepted.newCursor());
    }

    @Test
    public void multiLineTextSplitsTheTargetLine() {
        SuggestionResult accepted = presentAndAccept(
                List.of("func a() {\n", "}\n"), CursorPosition.of(0, 10), insertion("\n    return 1", 0, 10));

        assertThat(accepted.lines()).containsExactly("func a() {\n", "    return 1\n", "}\n").inOrder();
        assertEquals(CursorPosition.of(1, 12), accepted.newCursor());
    }

    @Test
    public void targetPastTheEndAppendsToTheDocument() {
        SuggestionResult accepted = presentAndAccept(
                List.of("struct Cat {}\n", "\n"), CursorPosition.ZERO, candidate("\nstruct Dog {}", 7, 0, 7, 12));

        assertThat(accepted.lines()).containsExactly("struct Cat {}\n", "\n", "\n", "struct Dog {}").inOrder();
        assertEquals("struct Cat {}\n\n\nstruct Dog {}", accepted.content());
        assertEquals(CursorPosition.of(3, 13), accepted.newCursor());
    }

    @Test
    public void unterminatedLastLineKeepsNoTerminator() {
        SuggestionResult accepted = presentAndAccept(List.of("abc"), CursorPosition.of(0, 3), insertion("def\nghi", 0, 3));

        assertThat(accepted.lines()).containsExactly("abcdef\n", "ghi").inOrder();
        assertEquals(CursorPosition.of(1, 3), accepted.newCursor());
    }

    @Test
    public void acceptsIntoAnEmptyBuffer() {
        SuggestionResult accepted = presentAndAccept(List.of(), CursorPosition.ZERO, insertion("hello", 0, 0));

        assertThat(accepted.lines()).containsExactly("hello");
        assertEquals(CursorPosition.of(0, 5), accepted.newCursor());
    }

    @Test
    public void acceptsTheCurrentlyCycledCandidate() {
        List<String> lines = List.of("val x = \n");
        List<CompletionCandidate> candidates = List.of(insertion("1", 0, 8), insertion("2", 0, 8));

        List<String> shown = check(lines, service.presentSuggestions(snapshot(lines, 0, 8), candidates));
        shown = check(shown, service.presentNextSuggestion(snapshot(shown, 0, 8)));

        SuggestionResult accepted = service.acceptSuggestion(snapshot(shown, 0, 8));

        assertThat(check(shown, accepted)).containsExactly("val x = 2\n");
    }

    @Test
    public void acceptWithoutPresentationReturnsNothing() {
        assertNull(service.acceptSuggestion(snapshot(List.of("a\n"), 0, 0)));
    }

    @Test
    public void acceptAfterTheBlockWasDeletedChangesNothing() {
        List<String> lines = List.of("a\n", "b\n");
        service.presentSuggestions(snapshot(lines, 0, 0), List.of(insertion("X", 0, 1)));

        // The user removed the block by hand.
        SuggestionResult accepted = service.acceptSuggestion(snapshot(lines, 1, 1));

        assertEquals(lines, check(lines, accepted));
        assertTrue(accepted.modifications().isEmpty());
        assertEquals(CursorPosition.of(1, 1), accepted.newCursor());
        assertFalse(service.hasActiveSuggestion(DOCUMENT));
    }
}
