package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;
import org.jspecify.annotations.Nullable;

/**
 * A bare identifier read, e.g. {@code schema_name}.
 */
public record NameReference(String name, Range range, @Nullable NameBinding binding, boolean invoked)
        implements SymbolReference {

    @Override
    public String rootName() {
        return name;
    }

    @Override
    public NameReference invoke() {
        return new NameReference(name, range, binding, true);
    }
}
