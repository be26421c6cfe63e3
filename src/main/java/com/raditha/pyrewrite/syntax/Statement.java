package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;

import java.util.List;

/**
 * A top-level statement of a module, carrying only what the rewrite needs: its kind, its source
 * text and the symbol references inside it.
 */
public interface Statement {

    StatementKind kind();

    Range range();

    /**
     * Source text of the statement, or the generated text for synthesized statements.
     */
    String text();

    /**
     * Every load-context reference inside this statement, nested scopes included.
     */
    List<SymbolReference> references();

    /**
     * Copy of this statement with its references replaced.
     */
    Statement withReferences(List<SymbolReference> references);
}
