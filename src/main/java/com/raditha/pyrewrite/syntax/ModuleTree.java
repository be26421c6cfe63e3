package com.raditha.pyrewrite.syntax;

import java.util.List;

/**
 * Immutable model of one Python module.
 *
 * @param source    the text the tree was parsed from
 * @param body      top-level statements in source order
 * @param imports   import statements executed at module level, including those inside
 *                  {@code if} and {@code try} blocks but not those inside functions or classes
 * @param hasErrors whether the parser had to recover from syntax errors
 */
public record ModuleTree(String source, List<Statement> body, List<Statement> imports, boolean hasErrors) {

    public ModuleTree {
        body = List.copyOf(body);
        imports = List.copyOf(imports);
    }

    public ModuleTree withBody(List<Statement> newBody) {
        return new ModuleTree(source, newBody, imports, hasErrors);
    }

    /**
     * The line ending the file uses, taken from its first line.
     */
    public String lineSeparator() {
        int newline = source.indexOf('\n');
        return newline > 0 && source.charAt(newline - 1) == '\r' ? "\r\n" : "\n";
    }

    /**
     * All references in all top-level statements.
     */
    public List<SymbolReference> references() {
        return body.stream().flatMap(s -> s.references().stream()).toList();
    }
}
