package com.raditha.pyrewrite.syntax;

/**
 * Parser and unparser for Python source.
 */
public interface PythonSyntax {

    /**
     * Parse a module. Never throws on invalid source; inspect the outcome instead.
     */
    ParseOutcome parse(String text);

    /**
     * Render a (possibly rewritten) tree back to source text.
     */
    String render(ModuleTree tree);
}
