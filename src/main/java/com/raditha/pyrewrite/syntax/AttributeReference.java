package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * An attribute chain rooted in an identifier, e.g. {@code pkg.config.schema_name}.
 *
 * @param path identifiers from the root to the accessed attribute
 */
public record AttributeReference(List<String> path, Range range, @Nullable NameBinding binding,
                                 boolean invoked)
        implements SymbolReference {

    public AttributeReference {
        path = List.copyOf(path);
        if (path.size() < 2) {
            throw new IllegalArgumentException("An attribute chain needs an object and an attribute: " + path);
        }
    }

    @Override
    public String rootName() {
        return path.get(0);
    }

    /**
     * The accessed attribute, i.e. the last path element.
     */
    public String attribute() {
        return path.get(path.size() - 1);
    }

    /**
     * Dotted path of the object the attribute is read from.
     */
    public String objectPath() {
        return String.join(".", path.subList(0, path.size() - 1));
    }

    public String dottedPath() {
        return String.join(".", path);
    }

    @Override
    public AttributeReference invoke() {
        return new AttributeReference(path, range, binding, true);
    }
}
