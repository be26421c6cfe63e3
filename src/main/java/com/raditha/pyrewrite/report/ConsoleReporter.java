package com.raditha.pyrewrite.report;

import com.raditha.pyrewrite.model.Binding;
import com.raditha.pyrewrite.model.FileAnalysis;
import com.raditha.pyrewrite.model.FileStatus;
import com.raditha.pyrewrite.model.RewriteOutcome;
import com.raditha.pyrewrite.model.SkippedPattern;
import com.raditha.pyrewrite.model.UsageRewrite;
import com.raditha.pyrewrite.model.WildcardImportWarning;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Human readable progress and summary output.
 */
public class ConsoleReporter implements RewriteReporter {

    static final int PREVIEW_WIDTH = 80;
    static final int SKIPPED_WIDTH = 60;
    static final int VALUE_WIDTH = 50;

    private final PrintStream out;

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void reportPatternCheck(Path target, String pattern, boolean matches) {
        String name = String.valueOf(target.getFileName());
        if (matches) {
            out.println("Pattern check: ✓ " + name + " matches '" + pattern + "'");
        } else {
            out.println("Pattern check: ✗ " + name + " does not match '" + pattern + "'");
        }
    }

    @Override
    public void reportOutcome(RewriteOutcome outcome, boolean dryRun) {
        String target = String.valueOf(outcome.targetFile().getFileName());
        if (!outcome.hasBindings()) {
            printSkipped(outcome);
            out.println("No lowercase_snake_case variables found in " + target);
            return;
        }

        out.println();
        out.println("Converting variables in: " + target);
        for (Binding binding : outcome.bindings()) {
            out.println("  ✓ " + binding.name() + " (line " + binding.line() + ")");
            out.println(truncate("    " + binding.name() + " = " + singleLine(binding.valueSource()), PREVIEW_WIDTH));
            out.println(truncate("    → " + functionPreview(binding), PREVIEW_WIDTH));
        }
        printSkipped(outcome);

        if (outcome.fileResults().values().stream().anyMatch(FileAnalysis::isNoteworthy)) {
            out.println();
            out.println("Updating usage sites:");
            outcome.fileResults().values().stream()
                    .filter(FileAnalysis::isNoteworthy)
                    .forEach(analysis -> printFile(outcome, analysis));
        }

        out.println();
        out.println("Summary:");
        out.println("  " + outcome.bindings().size() + " variable(s) converted");
        out.println("  " + outcome.updatedFiles().size() + " file(s) updated");
        out.println("  " + outcome.warningCount() + " warning(s)");
        if (dryRun) {
            out.println();
            out.println("Run with --apply to make changes.");
        }
    }

    @Override
    public void reportApplied(RewriteOutcome outcome) {
        out.println();
        out.println("✓ Changes applied successfully!");
        out.println("Modified " + outcome.modifiedFileCount() + " file(s)");
    }

    private void printSkipped(RewriteOutcome outcome) {
        for (SkippedPattern skipped : outcome.skipped()) {
            out.println("  ⚠ skipped (line " + skipped.line() + "): "
                    + truncate(singleLine(skipped.rawText()), SKIPPED_WIDTH));
            out.println("    Reason: " + skipped.reason().label());
        }
    }

    private void printFile(RewriteOutcome outcome, FileAnalysis analysis) {
        out.println("  " + displayPath(outcome, analysis.file()) + ":");
        for (UsageRewrite rewrite : analysis.rewrites()) {
            out.println("    ✓ line " + rewrite.line() + ": " + rewrite.originalText() + " → " + rewrite.rewrittenText());
            out.println("      (imported as: " + rewrite.importBinding().describe() + ")");
        }
        for (WildcardImportWarning warning : analysis.warnings()) {
            out.println("    ⚠ line " + warning.line() + ": from " + warning.moduleName()
                    + " import * (star import - manual review needed)");
        }
        if (analysis.status() == FileStatus.PARSE_FAILED) {
            out.println("    ⚠ could not parse: " + analysis.failureReason());
        } else if (analysis.status().isFailure()) {
            out.println("    ⚠ could not analyse: " + analysis.failureReason());
        }
    }

    private static String displayPath(RewriteOutcome outcome, Path file) {
        Path root = outcome.moduleRoot();
        if (root != null && file.startsWith(root)) {
            return root.relativize(file).toString();
        }
        return file.toString();
    }

    /**
     * {@code def name(): return value}, with long values shortened.
     */
    public static String functionPreview(Binding binding) {
        return "def " + binding.name() + "(): return " + truncate(singleLine(binding.valueSource()), VALUE_WIDTH);
    }

    static String truncate(String text, int width) {
        if (text.length() <= width) {
            return text;
        }
        return text.substring(0, width - 3) + "...";
    }

    private static String singleLine(String text) {
        return text.strip().replaceAll("\\s*\\R\\s*", " ");
    }
}
