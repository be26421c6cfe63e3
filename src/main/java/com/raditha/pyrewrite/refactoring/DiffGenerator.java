package com.raditha.pyrewrite.refactoring;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for rewrite previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between the original and the rewritten text of a file.
     *
     * @param file      the file, used for the diff headers
     * @param original  text as read
     * @param rewritten text after the rewrite
     * @return Unified diff as string, empty when nothing changed
     */
    public String generateUnifiedDiff(Path file, String original, String rewritten) {
        return generateUnifiedDiff(file, original, rewritten, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(Path file, String original, String rewritten, int contextLines) {
        List<String> originalLines = lines(original);
        List<String> revisedLines = lines(rewritten);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + file.getFileName(),
                "b/" + file.getFileName(),
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\r?\n", -1));
    }
}
