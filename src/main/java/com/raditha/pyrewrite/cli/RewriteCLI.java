package com.raditha.pyrewrite.cli;

import com.raditha.pyrewrite.config.PatternSettings;
import com.raditha.pyrewrite.config.RewriteConfig;
import com.raditha.pyrewrite.model.FileAnalysis;
import com.raditha.pyrewrite.model.RewriteOutcome;
import com.raditha.pyrewrite.refactoring.DiffGenerator;
import com.raditha.pyrewrite.report.ConsoleReporter;
import com.raditha.pyrewrite.report.JsonReporter;
import com.raditha.pyrewrite.report.RewriteReporter;
import com.raditha.pyrewrite.scanner.GitRootLocator;
import com.raditha.pyrewrite.scanner.ModuleResolver;
import com.raditha.pyrewrite.syntax.ParseException;
import com.raditha.pyrewrite.syntax.TreeSitterPythonSyntax;
import com.raditha.pyrewrite.workflow.RewriteEngine;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line interface for pyrewrite.
 * <p>
 * Usage:
 * java -jar pyrewrite.jar [options] <target_file>
 * <p>
 * Converts the lowercase_snake_case top-level variables of a Python file into zero-argument
 * functions and updates every usage in the surrounding package. Runs as a dry run unless
 * {@code --apply} or {@code --mode apply|interactive} is given.
 */
@Command(name = "pyrewrite", mixinStandardHelpOptions = true, version = "pyrewrite v1.0.0",
        description = "Convert module-level variables into functions and update their usages")
@SuppressWarnings("java:S106")
public class RewriteCLI implements Callable<Integer> {

    static final int EXIT_PATTERN_MISMATCH = 1;
    static final int EXIT_CONFIGURATION = 2;
    static final int EXIT_IO = 3;
    static final int EXIT_INTERRUPTED = 4;
    static final int EXIT_PARSE = 5;

    @Parameters(index = "0", paramLabel = "<target_file>", description = "Python file whose variables are converted")
    private String targetFile;

    @Option(names = "--pattern", description = "Glob the target file name must match (saved for later runs)",
            paramLabel = "<glob>")
    private String pattern;

    @Option(names = "--apply", description = "Write the changes (same as --mode apply)")
    private boolean apply = false;

    @Option(names = "--mode", description = "Run mode: ${COMPLETION-CANDIDATES}", paramLabel = "<mode>",
            converter = RunModeConverter.class)
    private RunMode runMode = RunMode.DRY_RUN;

    @Option(names = "--verify", description = "Verification level: ${COMPLETION-CANDIDATES}", paramLabel = "<level>",
            converter = VerifyModeConverter.class)
    private VerifyMode verifyMode = VerifyMode.PARSE;

    @Option(names = "--diff", description = "Print unified diffs of every changed file")
    private boolean showDiff = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--config-file", description = "Use custom settings file for the saved pattern", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--threads", description = "Worker threads for usage analysis (default: processors, max 8)",
            paramLabel = "<n>")
    private int threads = 0; // 0 = default

    private BufferedReader input;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Path target = Path.of(targetFile);
        if (!Files.exists(target)) {
            System.err.println("Error: File not found: " + target);
            return EXIT_IO;
        }
        if (!Files.isRegularFile(target)) {
            System.err.println("Error: Not a file: " + target);
            return EXIT_IO;
        }

        RewriteReporter reporter = jsonOutput
                ? new JsonReporter(System.out, System.err)
                : new ConsoleReporter(System.out);

        // Step 1: the filename gate runs before any analysis
        PatternSettings settings = new PatternSettings(
                configFile != null ? Path.of(configFile) : PatternSettings.defaultLocation());
        PrintStream promptStream = jsonOutput ? System.err : System.out;
        String glob = settings.resolve(pattern, input(), promptStream);
        boolean matches = PatternSettings.matches(target, glob);
        reporter.reportPatternCheck(target, glob, matches);
        if (!matches) {
            return EXIT_PATTERN_MISMATCH;
        }

        // Step 2: analyse everything, write nothing
        RewriteEngine engine = createEngine(buildConfig());
        RewriteOutcome outcome = engine.analyze(target);
        if (!outcome.hasBindings()) {
            reporter.reportOutcome(outcome, true);
            return 0;
        }

        // Step 3: report and write according to the mode
        RunMode mode = apply ? RunMode.APPLY : runMode;
        switch (mode) {
            case DRY_RUN -> {
                reporter.reportOutcome(outcome, true);
                if (showDiff) {
                    printDiffs(outcome);
                }
            }
            case APPLY -> {
                if (showDiff) {
                    printDiffs(outcome);
                }
                RewriteOutcome applied = engine.apply(outcome);
                reporter.reportOutcome(applied, false);
                if (applied.applied()) {
                    reporter.reportApplied(applied);
                }
            }
            case INTERACTIVE -> {
                reporter.reportOutcome(outcome, false);
                printDiffs(outcome);
                if (confirm("Apply these changes? [y/N]: ")) {
                    RewriteOutcome applied = engine.apply(outcome);
                    if (applied.applied()) {
                        reporter.reportApplied(applied);
                    }
                } else {
                    System.out.println("No changes applied.");
                }
            }
        }
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit code mapping for execution errors.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new RewriteCLI());

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIGURATION;
            } else if (ex instanceof ParseException) {
                commandLine.getErr().println("Parse error: " + ex.getMessage());
                return EXIT_PARSE;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return EXIT_INTERRUPTED;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getHelp().fullSynopsis());
            return EXIT_CONFIGURATION; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threads < 0) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }
        if (jsonOutput && runMode == RunMode.INTERACTIVE) {
            throw new IllegalArgumentException("Cannot combine --json with interactive mode");
        }
        if (apply && runMode == RunMode.INTERACTIVE) {
            throw new IllegalArgumentException("Cannot combine --apply with --mode interactive");
        }
        if (pattern != null && pattern.isBlank()) {
            throw new IllegalArgumentException("Pattern must not be blank");
        }
    }

    private RewriteConfig buildConfig() {
        RewriteConfig config = RewriteConfig.defaults();
        return threads > 0 ? config.withParallelism(threads) : config;
    }

    RewriteEngine createEngine(RewriteConfig config) {
        return new RewriteEngine(config, new TreeSitterPythonSyntax(),
                new ModuleResolver(new GitRootLocator(), config), verifyMode.toVerificationLevel());
    }

    private void printDiffs(RewriteOutcome outcome) throws IOException {
        DiffGenerator diffGenerator = new DiffGenerator();
        PrintStream out = jsonOutput ? System.err : System.out;
        if (outcome.targetChanged()) {
            out.println();
            out.println(diffGenerator.generateUnifiedDiff(outcome.targetFile(),
                    outcome.originalTarget(), outcome.rewrittenTarget()));
        }
        for (FileAnalysis analysis : outcome.updatedFiles()) {
            out.println();
            out.println(diffGenerator.generateUnifiedDiff(analysis.file(),
                    Files.readString(analysis.file()), analysis.rewrittenText()));
        }
    }

    private boolean confirm(String question) throws IOException {
        System.out.print(question);
        System.out.flush();
        String answer = input().readLine();
        return answer != null && (answer.trim().equalsIgnoreCase("y") || answer.trim().equalsIgnoreCase("yes"));
    }

    private BufferedReader input() {
        if (input == null) {
            input = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        }
        return input;
    }

    /**
     * Custom converter for RunMode enum to handle CLI string values.
     */
    public static class RunModeConverter implements ITypeConverter<RunMode> {
        @Override
        public RunMode convert(String value) throws Exception {
            return RunMode.fromString(value);
        }
    }

    /**
     * Custom converter for VerifyMode enum to handle CLI string values.
     */
    public static class VerifyModeConverter implements ITypeConverter<VerifyMode> {
        @Override
        public VerifyMode convert(String value) throws Exception {
            return VerifyMode.fromString(value);
        }
    }
}
