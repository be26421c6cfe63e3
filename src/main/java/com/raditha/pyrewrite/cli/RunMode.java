package com.raditha.pyrewrite.cli;

/**
 * Enumeration of run modes for the pyrewrite CLI.
 * Used to control whether and how changes are written.
 */
public enum RunMode {
    /**
     * Dry-run mode - Preview changes without making modifications.
     * This is the default mode.
     */
    DRY_RUN,

    /**
     * Apply mode - Write every change without asking.
     */
    APPLY,

    /**
     * Interactive mode - Show the diffs and ask once before writing.
     */
    INTERACTIVE;

    /**
     * Convert a string value to RunMode enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding RunMode
     * @throws IllegalArgumentException if the value is not a valid mode
     */
    public static RunMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("RunMode value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "dry-run" -> DRY_RUN;
            case "apply" -> APPLY;
            case "interactive" -> INTERACTIVE;
            default -> throw new IllegalArgumentException(
                    "Invalid run mode: " + value + ". Must be: dry-run, apply, or interactive");
        };
    }

    /**
     * Get the string representation of this mode for CLI usage.
     *
     * @return lowercase string representation
     */
    public String toCliString() {
        return switch (this) {
            case DRY_RUN -> "dry-run";
            case APPLY -> "apply";
            case INTERACTIVE -> "interactive";
        };
    }
}
