package com.raditha.pyrewrite.syntax;

/**
 * Result of parsing one file. A failed parse still carries the parser's best-effort tree.
 */
public sealed interface ParseOutcome permits ParseOutcome.Parsed, ParseOutcome.ParseFailed {

    ModuleTree tree();

    record Parsed(ModuleTree tree) implements ParseOutcome {
    }

    /**
     * @param reason human readable description of the first error
     * @param line   1-based line of the first error
     * @param tree   partial tree recovered by the parser
     */
    record ParseFailed(String reason, int line, ModuleTree tree) implements ParseOutcome {
    }
}
