package com.tyron.ghostj.core.suggestion;

import com.tyron.ghostj.api.suggestion.SuggestionResult;
import com.tyron.ghostj.testFramework.BaseSuggestionTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class SuggestionSettingsTest extends BaseSuggestionTest {

    @TempDir
    Path tempDir;

    @Override
    protected SuggestionSettings settings() {
        try {
            return SuggestionSettings.loadFromClasspath(getClass().getClassLoader(), "settings/custom-markers.yaml");
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    @Test
    public void readsMarkersFromTheClasspath() {
        SuggestionSettings settings = settings();

        assertEquals("// >>> ghost", settings.startMarker());
        assertEquals("// <<< ghost", settings.endMarker());
    }

    @Test
    public void serviceRendersConfiguredMarkers() {
        List<String> lines = List.of("x\n");

        SuggestionResult result = service.presentSuggestions(snapshot(lines, 0, 1), List.of(insertion("y", 0, 1)));

        assertThat(check(lines, result)).containsExactly("x\n", "// >>> ghost 1/1\n", "y\n", "// <<< ghost\n").inOrder();
        assertEquals(lines, check(result.lines(), service.rejectSuggestion(snapshot(result.lines(), 0, 1))));
    }

    @Test
    public void defaultMarkersAreNotRecognisedByACustomService() {
        List<String> foreign = List.of("x\n", SuggestionSettings.DEFAULT_START_MARKER + " 1/1\n", "y\n",
                SuggestionSettings.DEFAULT_END_MARKER + "\n");

        assertNull(service.rejectSuggestion(snapshot(foreign, 0, 0)));
    }

    @Test
    public void missingResourceGivesDefaults() throws IOException {
        SuggestionSettings settings = SuggestionSettings.loadFromClasspath(getClass().getClassLoader(), "settings/absent.yaml");

        assertSame(SuggestionSettings.defaults(), settings);
    }

    @Test
    public void readsTheDefaultConfigFileFromTheClasspath() throws IOException {
        Files.writeString(tempDir.resolve(SuggestionSettings.CONFIG_FILE_NAME),
                "markers:\n  start: \"## ghost\"\n  end: \"## end ghost\"\n", StandardCharsets.UTF_8);

        try (URLClassLoader loader = new URLClassLoader(new URL[]{tempDir.toUri().toURL()}, null)) {
            SuggestionSettings settings = SuggestionSettings.loadFromClasspath(loader);

            assertEquals(new SuggestionSettings("## ghost", "## end ghost"), settings);
        }
        try (URLClassLoader empty = new URLClassLoader(new URL[0], null)) {
            assertSame(SuggestionSettings.defaults(), SuggestionSettings.loadFromClasspath(empty));
        }
    }

    @Test
    public void missingKeysKeepTheirDefaults() throws IOException {
        SuggestionSettings settings = SuggestionSettings.loadFromClasspath(getClass().getClassLoader(), "settings/partial.yaml");

        assertEquals(SuggestionSettings.DEFAULT_START_MARKER, settings.startMarker());
        assertEquals("//--- end", settings.endMarker());
    }

    @Test
    public void loadsFromAFile() throws IOException {
        Path file = tempDir.resolve(SuggestionSettings.CONFIG_FILE_NAME);
        Files.writeString(file, "markers:\n  start: \"<<ghost\"\n  end: \">>ghost\"\n", StandardCharsets.UTF_8);

        SuggestionSettings settings = SuggestionSettings.load(file);

        assertEquals(new SuggestionSettings("<<ghost", ">>ghost"), settings);
    }

    @Test
    public void emptyFileGivesDefaults() throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "", StandardCharsets.UTF_8);

        assertEquals(SuggestionSettings.defaults(), SuggestionSettings.load(file));
    }

    @Test
    public void malformedFileIsAnIOException() throws IOException {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "markers: [unclosed\n", StandardCharsets.UTF_8);

        IOException e = assertThrows(IOException.class, () -> SuggestionSettings.load(file));
        assertThat(e).hasMessageThat().contains("broken.yaml");
    }

    @Test
    public void missingFileIsAnIOException() {
        assertThrows(IOException.class, () -> SuggestionSettings.load(tempDir.resolve("nope.yaml")));
    }

    @Test
    public void rejectsInvalidMarkers() {
        assertThrows(IllegalArgumentException.class, () -> new SuggestionSettings(" ", "end"));
        assertThrows(IllegalArgumentException.class, () -> new SuggestionSettings("start\n", "end"));
        assertThrows(IllegalArgumentException.class, () -> new SuggestionSettings("//", "// end"));
    }
}
