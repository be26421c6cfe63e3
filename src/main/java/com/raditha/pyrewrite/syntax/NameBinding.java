package com.raditha.pyrewrite.syntax;

import org.jspecify.annotations.Nullable;

/**
 * The binding a name read sees: the scope that owns the name and, when the binding that reaches
 * the read is an import, that import.
 *
 * @param scope           {@link #MODULE_SCOPE} or an id unique within the file
 * @param importStatement the import that bound the name, null for any other binding
 */
public record NameBinding(int scope, @Nullable Statement importStatement) {

    public static final int MODULE_SCOPE = 0;

    public boolean atModuleLevel() {
        return scope == MODULE_SCOPE;
    }

    public boolean byImport() {
        return importStatement != null;
    }
}
