package com.raditha.pyrewrite.model;

import com.raditha.pyrewrite.syntax.Expression;

/**
 * A top-level, single-target, simple-name assignment that will be turned into a
 * zero-argument function.
 *
 * @param name        the bound identifier
 * @param declaration range of the whole assignment statement
 * @param value       the assigned expression, carried as parsed
 */
public record Binding(String name, Range declaration, Expression value) {

    public Binding {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Binding name must not be empty");
        }
    }

    public int line() {
        return declaration.startLine();
    }

    /**
     * The exact source text of the assigned expression.
     */
    public String valueSource() {
        return value.text();
    }
}
