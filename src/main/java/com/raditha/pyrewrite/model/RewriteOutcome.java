package com.raditha.pyrewrite.model;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one run found out, and whether it was written to disk.
 *
 * @param targetFile      the file whose bindings are converted
 * @param moduleRoot      boundary of the scanned module tree, null when nothing was scanned
 * @param bindings        converted bindings, in order of appearance
 * @param skipped         skipped assignment shapes, in order of appearance
 * @param fileResults     per consuming file results, sorted by path
 * @param originalTarget  text of the target as read
 * @param rewrittenTarget new text of the target
 * @param applied         whether the changes were written
 */
public record RewriteOutcome(
        Path targetFile,
        @Nullable Path moduleRoot,
        List<Binding> bindings,
        List<SkippedPattern> skipped,
        Map<Path, FileAnalysis> fileResults,
        String originalTarget,
        String rewrittenTarget,
        boolean applied) {

    public RewriteOutcome {
        bindings = List.copyOf(bindings);
        skipped = List.copyOf(skipped);
        fileResults = Collections.unmodifiableMap(new LinkedHashMap<>(fileResults));
    }

    public RewriteOutcome withApplied(boolean applied) {
        return new RewriteOutcome(targetFile, moduleRoot, bindings, skipped, fileResults,
                originalTarget, rewrittenTarget, applied);
    }

    public boolean hasBindings() {
        return !bindings.isEmpty();
    }

    public boolean targetChanged() {
        return !originalTarget.equals(rewrittenTarget);
    }

    /**
     * Consuming files with at least one rewritten usage.
     */
    public List<FileAnalysis> updatedFiles() {
        return fileResults.values().stream().filter(FileAnalysis::hasRewrites).toList();
    }

    public int usageRewriteCount() {
        return fileResults.values().stream().mapToInt(f -> f.rewrites().size()).sum();
    }

    public int wildcardWarningCount() {
        return fileResults.values().stream().mapToInt(f -> f.warnings().size()).sum();
    }

    /**
     * Skipped patterns plus wildcard warnings plus files that could not be analysed.
     */
    public int warningCount() {
        int failures = (int) fileResults.values().stream().filter(f -> f.status().isFailure()).count();
        return skipped.size() + wildcardWarningCount() + failures;
    }

    /**
     * Number of files a write touches.
     */
    public int modifiedFileCount() {
        return (targetChanged() ? 1 : 0) + updatedFiles().size();
    }
}
