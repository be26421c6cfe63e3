package com.raditha.pyrewrite.model;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of running the usage resolver over one consuming file.
 *
 * @param file          the consuming file
 * @param status        what happened
 * @param rewrites      usages turned into invocations
 * @param warnings      wildcard usages needing manual review
 * @param rewrittenText the new file text, present only when {@code rewrites} is not empty
 * @param failureReason why the file could not be analysed
 */
public record FileAnalysis(
        Path file,
        FileStatus status,
        List<UsageRewrite> rewrites,
        List<WildcardImportWarning> warnings,
        @Nullable String rewrittenText,
        @Nullable String failureReason) {

    public FileAnalysis {
        rewrites = List.copyOf(rewrites);
        warnings = List.copyOf(warnings);
        if (status == FileStatus.REWRITTEN && (rewrittenText == null || rewrites.isEmpty())) {
            throw new IllegalArgumentException("A rewritten file needs its new text and at least one rewrite");
        }
    }

    public static FileAnalysis rewritten(Path file, List<UsageRewrite> rewrites,
                                         List<WildcardImportWarning> warnings, String text) {
        return new FileAnalysis(file, FileStatus.REWRITTEN, rewrites, warnings, text, null);
    }

    public static FileAnalysis unchanged(Path file, List<WildcardImportWarning> warnings) {
        return new FileAnalysis(file, FileStatus.UNCHANGED, List.of(), warnings, null, null);
    }

    public static FileAnalysis unrelated(Path file) {
        return new FileAnalysis(file, FileStatus.UNRELATED, List.of(), List.of(), null, null);
    }

    public static FileAnalysis parseFailed(Path file, String reason, List<WildcardImportWarning> warnings) {
        return new FileAnalysis(file, FileStatus.PARSE_FAILED, List.of(), warnings, null, reason);
    }

    public static FileAnalysis unreadable(Path file, String reason) {
        return new FileAnalysis(file, FileStatus.UNREADABLE, List.of(), List.of(), null, reason);
    }

    public static FileAnalysis failed(Path file, String reason) {
        return new FileAnalysis(file, FileStatus.FAILED, List.of(), List.of(), null, reason);
    }

    public boolean hasRewrites() {
        return !rewrites.isEmpty();
    }

    /**
     * True when the report has something to say about this file.
     */
    public boolean isNoteworthy() {
        return hasRewrites() || !warnings.isEmpty() || status.isFailure();
    }
}
