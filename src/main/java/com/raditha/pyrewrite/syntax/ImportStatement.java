package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code import a.b [as c], d}.
 */
public record ImportStatement(Range range, String text, List<ImportedModule> modules) implements Statement {

    /**
     * One clause of an import statement.
     */
    public record ImportedModule(String module, @Nullable String alias, Range range) {
    }

    public ImportStatement {
        modules = List.copyOf(modules);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.IMPORT;
    }

    @Override
    public List<SymbolReference> references() {
        return List.of();
    }

    @Override
    public ImportStatement withReferences(List<SymbolReference> references) {
        return this;
    }
}
