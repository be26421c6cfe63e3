package com.raditha.pyrewrite.model;

/**
 * An assignment shape that is reported but never converted.
 *
 * @param location range of the statement
 * @param reason   why it was skipped
 * @param rawText  the statement's source text
 */
public record SkippedPattern(Range location, SkipReason reason, String rawText) {

    public int line() {
        return location.startLine();
    }
}
