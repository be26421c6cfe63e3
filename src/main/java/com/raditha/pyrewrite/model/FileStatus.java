package com.raditha.pyrewrite.model;

/**
 * Outcome of analysing one consuming file.
 */
public enum FileStatus {
    /** At least one usage was rewritten. */
    REWRITTEN,
    /** Imports nothing converted, or only through a wildcard. */
    UNCHANGED,
    /** Cannot be related to the module root. */
    UNRELATED,
    PARSE_FAILED,
    UNREADABLE,
    /** Analysis failed unexpectedly. */
    FAILED;

    public boolean isFailure() {
        return this == PARSE_FAILED || this == UNREADABLE || this == FAILED;
    }
}
