package com.raditha.pyrewrite.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Optional;

/**
 * The saved filename-glob preference that gates which target files may be rewritten.
 * <p>
 * Stored as {@code {"glob_pattern": "..."}} in a JSON file, by default
 * {@code ~/.config/pyrewrite/config.json}.
 */
public class PatternSettings {

    private static final Logger logger = LoggerFactory.getLogger(PatternSettings.class);

    public static final String DEFAULT_PATTERN = "*.py";

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * DTO for the settings file.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SettingsDTO(@JsonProperty("glob_pattern") String globPattern) {
    }

    private final Path settingsFile;

    public PatternSettings(Path settingsFile) {
        this.settingsFile = settingsFile;
    }

    public static Path defaultLocation() {
        return Path.of(System.getProperty("user.home"), ".config", "pyrewrite", "config.json");
    }

    public Path getSettingsFile() {
        return settingsFile;
    }

    /**
     * Read the saved pattern. A missing or unreadable file means no pattern.
     */
    public Optional<String> load() {
        if (!Files.isRegularFile(settingsFile)) {
            return Optional.empty();
        }
        try {
            SettingsDTO dto = mapper.readValue(settingsFile.toFile(), SettingsDTO.class);
            if (dto == null || dto.globPattern() == null || dto.globPattern().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(dto.globPattern());
        } catch (IOException e) {
            logger.warn("Ignoring unreadable settings file {}: {}", settingsFile, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(String pattern) throws IOException {
        Path parent = settingsFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(settingsFile.toFile(), new SettingsDTO(pattern));
        logger.debug("Saved glob pattern '{}' to {}", pattern, settingsFile);
    }

    /**
     * Work out the pattern for this run.
     * <ol>
     *   <li>An explicit override is used and saved.</li>
     *   <li>Otherwise the saved pattern is used.</li>
     *   <li>On first run the user is asked, an empty answer meaning {@value #DEFAULT_PATTERN}.</li>
     * </ol>
     */
    public String resolve(String override, BufferedReader in, PrintStream prompt) throws IOException {
        if (override != null && !override.isBlank()) {
            save(override);
            return override;
        }
        Optional<String> saved = load();
        if (saved.isPresent()) {
            return saved.get();
        }
        prompt.print("Enter glob pattern for files to process [" + DEFAULT_PATTERN + "]: ");
        prompt.flush();
        String answer = in.readLine();
        String pattern = answer == null || answer.isBlank() ? DEFAULT_PATTERN : answer.trim();
        save(pattern);
        return pattern;
    }

    /**
     * Match a glob against the file name only.
     *
     * @throws IllegalArgumentException if the pattern is not a valid glob
     */
    public static boolean matches(Path file, String pattern) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        Path name = file.getFileName();
        return name != null && matcher.matches(name);
    }
}
