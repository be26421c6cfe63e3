package com.raditha.pyrewrite.report;

import com.raditha.pyrewrite.model.RewriteOutcome;

import java.nio.file.Path;

/**
 * Output sink for a run. Carries no decisions back into the engine.
 */
public interface RewriteReporter {

    /**
     * Result of the filename-pattern gate.
     */
    void reportPatternCheck(Path target, String pattern, boolean matches);

    /**
     * Bindings, skipped patterns, per-file rewrites and warnings, and the summary counts.
     *
     * @param dryRun true when nothing will be written by this run
     */
    void reportOutcome(RewriteOutcome outcome, boolean dryRun);

    /**
     * Confirmation after the changes were written.
     */
    void reportApplied(RewriteOutcome outcome);
}
