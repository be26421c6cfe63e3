package com.raditha.pyrewrite.model;

/**
 * A confirmed rewrite of one usage site into an invocation.
 */
public record UsageRewrite(
        Range location,
        String originalText,
        String rewrittenText,
        ImportBinding importBinding) {

    public int line() {
        return location.startLine();
    }
}
