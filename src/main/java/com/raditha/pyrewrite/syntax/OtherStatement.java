package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;

import java.util.List;

/**
 * Any statement the rewrite does not inspect structurally.
 */
public record OtherStatement(Range range, String text, List<SymbolReference> references) implements Statement {

    public OtherStatement {
        references = List.copyOf(references);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.OTHER;
    }

    @Override
    public OtherStatement withReferences(List<SymbolReference> references) {
        return new OtherStatement(range, text, references);
    }
}
