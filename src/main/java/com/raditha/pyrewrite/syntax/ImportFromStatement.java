package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code from [.]module import name [as alias]} or {@code from module import *}.
 *
 * @param module   dotted module after the leading dots, null for {@code from . import x}
 * @param level    number of leading dots, 0 for an absolute import
 * @param names    imported names, empty for a wildcard import
 * @param wildcard whether this is {@code import *}
 */
public record ImportFromStatement(
        Range range,
        String text,
        @Nullable String module,
        int level,
        List<ImportedName> names,
        boolean wildcard) implements Statement {

    /**
     * One imported name.
     */
    public record ImportedName(String name, @Nullable String alias, Range range) {

        public String localName() {
            return alias != null ? alias : name;
        }
    }

    public ImportFromStatement {
        names = List.copyOf(names);
    }

    /**
     * The module as written, leading dots included.
     */
    public String displayModule() {
        return ".".repeat(level) + (module == null ? "" : module);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.IMPORT_FROM;
    }

    @Override
    public List<SymbolReference> references() {
        return List.of();
    }

    @Override
    public ImportFromStatement withReferences(List<SymbolReference> references) {
        return this;
    }
}
