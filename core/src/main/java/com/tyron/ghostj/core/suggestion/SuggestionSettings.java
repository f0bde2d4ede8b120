package com.tyron.ghostj.core.suggestion;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Settings of the suggestion engine.
 * <p>
 * Loaded from a {@code ghostj.yaml} document:
 * <pre>
 * markers:
 *   start: "/*========== Suggestion"
 *   end: "*&#47;//======== End of Suggestion"
 * </pre>
 * Missing keys keep their defaults.
 *
 * @param startMarker prefix of the first line of a rendered suggestion block
 * @param endMarker   prefix of the last line of a rendered suggestion block
 */
public record SuggestionSettings(String startMarker, String endMarker) {

    public static final String CONFIG_FILE_NAME = "ghostj.yaml";

    public static final String DEFAULT_START_MARKER = "/*========== Suggestion";
    public static final String DEFAULT_END_MARKER = "*///======== End of Suggestion";

    private static final SuggestionSettings DEFAULTS = new SuggestionSettings(DEFAULT_START_MARKER, DEFAULT_END_MARKER);

    public SuggestionSettings {
        Objects.requireNonNull(startMarker, "startMarker");
        Objects.requireNonNull(endMarker, "endMarker");
        if (startMarker.isBlank() || endMarker.isBlank()) {
            throw new IllegalArgumentException("suggestion markers must not be blank");
        }
        if (startMarker.contains("\n") || startMarker.contains("\r")
                || endMarker.contains("\n") || endMarker.contains("\r")) {
            throw new IllegalArgumentException("suggestion markers must be single-line");
        }
        // Blocks are found by prefix, so neither marker may be read as the other.
        if (startMarker.startsWith(endMarker) || endMarker.startsWith(startMarker)) {
            throw new IllegalArgumentException("suggestion markers are ambiguous: '" + startMarker + "' / '" + endMarker + "'");
        }
    }

    public static SuggestionSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Reads settings from a YAML file.
     *
     * @throws IOException if the file cannot be read or is not valid YAML
     */
    public static SuggestionSettings load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        } catch (YAMLException e) {
            throw new IOException("Malformed suggestion settings: " + file, e);
        }
    }

    /**
     * Reads {@value #CONFIG_FILE_NAME} from the classpath, or returns the defaults if there is none.
     */
    public static SuggestionSettings loadFromClasspath(ClassLoader classLoader) throws IOException {
        return loadFromClasspath(classLoader, CONFIG_FILE_NAME);
    }

    public static SuggestionSettings loadFromClasspath(ClassLoader classLoader, String resourceName) throws IOException {
        Objects.requireNonNull(classLoader, "classLoader");
        try (InputStream in = classLoader.getResourceAsStream(resourceName)) {
            if (in == null) {
                return DEFAULTS;
            }
            return parse(in);
        } catch (YAMLException e) {
            throw new IOException("Malformed suggestion settings resource: " + resourceName, e);
        }
    }

    static SuggestionSettings parse(InputStream in) {
        Object doc = new Yaml().load(in);
        if (!(doc instanceof Map<?, ?> map)) {
            return DEFAULTS;
        }

        String start = DEFAULT_START_MARKER;
        String end = DEFAULT_END_MARKER;

        Object markers = map.get("markers");
        if (markers instanceof Map<?, ?> markersMap) {
            Object s = markersMap.get("start");
            if (s != null) {
                start = String.valueOf(s);
            }
            Object e = markersMap.get("end");
            if (e != null) {
                end = String.valueOf(e);
            }
        }
        return new SuggestionSettings(start, end);
    }
}
