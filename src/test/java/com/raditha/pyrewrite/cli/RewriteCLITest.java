package com.raditha.pyrewrite.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the command line against a small package and checks exit codes, output and files.
 */
class RewriteCLITest {

    private static final String CONFIG = "timeout = 30\nMAX = 5\n";
    private static final String MAIN = "from app.config import timeout\nprint(timeout)\n";

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;
    private InputStream originalIn;

    private Path config;
    private Path main;
    private Path settingsFile;

    @BeforeEach
    void setUp() throws IOException {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        originalIn = System.in;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errContent, true, StandardCharsets.UTF_8));
        System.setIn(new ByteArrayInputStream(new byte[0]));

        Path app = Files.createDirectories(tempDir.resolve("app"));
        Files.writeString(app.resolve("__init__.py"), "");
        config = Files.writeString(app.resolve("config.py"), CONFIG);
        main = Files.writeString(app.resolve("main.py"), MAIN);
        settingsFile = tempDir.resolve("settings/config.json");
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        System.setIn(originalIn);
    }

    private int run(String... args) {
        List<String> all = new ArrayList<>(List.of("--config-file", settingsFile.toString()));
        all.addAll(Arrays.asList(args));
        CommandLine cmd = RewriteCLI.createCommandLine();
        return cmd.execute(all.toArray(new String[0]));
    }

    private void typeInput(String text) {
        System.setIn(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
    }

    private String out() {
        return outContent.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errContent.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testDryRunIsDefault() throws IOException {
        int exitCode = run("--pattern", "*.py", config.toString());

        assertEquals(0, exitCode, err());
        assertTrue(out().contains("Pattern check: ✓ config.py matches '*.py'"));
        assertTrue(out().contains("✓ timeout (line 1)"));
        assertTrue(out().contains("✓ line 2: timeout → timeout()"));
        assertTrue(out().contains("Run with --apply to make changes."));
        assertEquals(CONFIG, Files.readString(config));
        assertEquals(MAIN, Files.readString(main));
    }

    @Test
    void testApplyWritesChanges() throws IOException {
        int exitCode = run("--pattern", "*.py", "--apply", config.toString());

        assertEquals(0, exitCode, err());
        assertEquals("def timeout():\n    return 30\nMAX = 5\n", Files.readString(config));
        assertEquals("from app.config import timeout\nprint(timeout())\n", Files.readString(main));
        assertTrue(out().contains("✓ Changes applied successfully!"));
        assertTrue(out().contains("Modified 2 file(s)"));
    }

    @Test
    void testApplyModeOption() throws IOException {
        int exitCode = run("--pattern", "*.py", "--mode", "apply", "--verify", "none", config.toString());

        assertEquals(0, exitCode, err());
        assertEquals("from app.config import timeout\nprint(timeout())\n", Files.readString(main));
    }

    @Test
    void testDiffOutput() throws IOException {
        int exitCode = run("--pattern", "*.py", "--diff", config.toString());

        assertEquals(0, exitCode, err());
        assertTrue(out().contains("--- a/config.py"));
        assertTrue(out().contains("+def timeout():"));
        assertTrue(out().contains("+print(timeout())"));
        assertEquals(CONFIG, Files.readString(config));
    }

    @Test
    void testPatternMismatchStopsBeforeAnalysis() throws IOException {
        int exitCode = run("--pattern", "test_*.py", "--apply", config.toString());

        assertEquals(RewriteCLI.EXIT_PATTERN_MISMATCH, exitCode);
        assertTrue(out().contains("does not match 'test_*.py'"));
        assertFalse(out().contains("Converting variables"));
        assertEquals(CONFIG, Files.readString(config));
    }

    @Test
    void testFirstRunPromptsForPattern() throws IOException {
        typeInput("\n");

        int exitCode = run(config.toString());

        assertEquals(0, exitCode, err());
        assertTrue(out().contains("Enter glob pattern for files to process [*.py]: "));
        assertTrue(Files.readString(settingsFile).contains("*.py"));
    }

    @Test
    void testSavedPatternIsReused() throws IOException {
        assertEquals(RewriteCLI.EXIT_PATTERN_MISMATCH, run("--pattern", "settings*.py", config.toString()));
        outContent.reset();

        int exitCode = run(config.toString());

        assertEquals(RewriteCLI.EXIT_PATTERN_MISMATCH, exitCode);
        assertFalse(out().contains("Enter glob pattern"));
    }

    @Test
    void testInteractiveConfirmation() throws IOException {
        typeInput("y\n");

        int exitCode = run("--pattern", "*.py", "--mode", "interactive", config.toString());

        assertEquals(0, exitCode, err());
        assertTrue(out().contains("Apply these changes? [y/N]: "));
        assertTrue(out().contains("✓ Changes applied successfully!"));
        assertEquals("from app.config import timeout\nprint(timeout())\n", Files.readString(main));
    }

    @Test
    void testInteractiveDecline() throws IOException {
        typeInput("n\n");

        int exitCode = run("--pattern", "*.py", "--mode", "interactive", config.toString());

        assertEquals(0, exitCode, err());
        assertTrue(out().contains("No changes applied."));
        assertEquals(CONFIG, Files.readString(config));
    }

    @Test
    void testJsonOutput() throws IOException {
        int exitCode = run("--pattern", "*.py", "--json", config.toString());

        assertEquals(0, exitCode, err());
        JsonNode root = new ObjectMapper().readTree(out());
        assertEquals(1, root.get("summary").get("converted").asInt());
        assertEquals(1, root.get("summary").get("usagesRewritten").asInt());
    }

    @Test
    void testNothingToConvert() throws IOException {
        Files.writeString(config, "MAX = 5\n");

        int exitCode = run("--pattern", "*.py", "--apply", config.toString());

        assertEquals(0, exitCode, err());
        assertTrue(out().contains("No lowercase_snake_case variables found in config.py"));
        assertEquals(MAIN, Files.readString(main));
    }

    @Test
    void testMissingFile() {
        int exitCode = run("--pattern", "*.py", tempDir.resolve("missing.py").toString());

        assertEquals(RewriteCLI.EXIT_IO, exitCode);
        assertTrue(err().contains("Error: File not found"));
    }

    @Test
    void testDirectoryTarget() {
        int exitCode = run("--pattern", "*", tempDir.toString());

        assertEquals(RewriteCLI.EXIT_IO, exitCode);
        assertTrue(err().contains("Error: Not a file"));
    }

    @Test
    void testTargetParseError() throws IOException {
        Files.writeString(config, "timeout = (\n");

        int exitCode = run("--pattern", "*.py", config.toString());

        assertEquals(RewriteCLI.EXIT_PARSE, exitCode);
        assertTrue(err().contains("Parse error:"));
    }

    @Test
    void testInvalidModeValue() {
        int exitCode = run("--mode", "sometimes", config.toString());

        assertEquals(RewriteCLI.EXIT_CONFIGURATION, exitCode);
        assertTrue(err().contains("sometimes"));
    }

    @Test
    void testUnknownOption() {
        int exitCode = run("--bogus", config.toString());

        assertEquals(RewriteCLI.EXIT_CONFIGURATION, exitCode);
        assertTrue(err().contains("Unknown option") || err().contains("Unmatched argument"));
    }

    @Test
    void testMissingTargetArgument() {
        int exitCode = run("--apply");

        assertEquals(RewriteCLI.EXIT_CONFIGURATION, exitCode);
    }

    @Test
    void testNegativeThreads() {
        int exitCode = run("--threads=-1", config.toString());

        assertEquals(RewriteCLI.EXIT_CONFIGURATION, exitCode);
        assertTrue(err().contains("Threads must be positive"));
    }

    @Test
    void testConflictingOptions() {
        assertEquals(RewriteCLI.EXIT_CONFIGURATION, run("--json", "--mode", "interactive", config.toString()));
        assertEquals(RewriteCLI.EXIT_CONFIGURATION, run("--apply", "--mode", "interactive", config.toString()));
    }

    @Test
    void testHelp() {
        int exitCode = run("--help");

        assertEquals(0, exitCode);
        assertTrue(out().contains("--pattern"));
        assertTrue(out().contains("--apply"));
    }
}
