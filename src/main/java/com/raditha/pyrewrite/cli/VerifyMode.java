package com.raditha.pyrewrite.cli;

import com.raditha.pyrewrite.refactoring.ChangeApplier;

/**
 * Enumeration of verification modes for the pyrewrite CLI.
 * Used to control the checks run on rewritten files before they are written.
 */
public enum VerifyMode {
    /**
     * No verification - Write rewritten text as produced.
     */
    NONE,

    /**
     * Parse verification - Every rewritten file must parse before anything is written.
     * This is the default mode.
     */
    PARSE;

    /**
     * Convert a string value to VerifyMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding VerifyMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static VerifyMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("VerifyMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "none" -> NONE;
            case "parse" -> PARSE;
            default -> throw new IllegalArgumentException(
                    "Invalid verify mode: " + value + ". Must be: none or parse");
        };
    }

    /**
     * Get the string representation of this mode for CLI usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case NONE -> "none";
            case PARSE -> "parse";
        };
    }

    public ChangeApplier.VerificationLevel toVerificationLevel() {
        return switch (this) {
            case NONE -> ChangeApplier.VerificationLevel.NONE;
            case PARSE -> ChangeApplier.VerificationLevel.PARSE;
        };
    }
}
