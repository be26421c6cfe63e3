package com.raditha.pyrewrite.model;

import org.jspecify.annotations.Nullable;

/**
 * A usage that may refer to a converted name but is only reachable through
 * {@code from module import *}. Never rewritten automatically.
 *
 * @param location   the usage, or the import itself when the file has no such usage
 * @param moduleName module named by the wildcard import
 * @param name       the converted name used, null for a warning on the import line
 */
public record WildcardImportWarning(Range location, String moduleName, @Nullable String name) {

    public int line() {
        return location.startLine();
    }
}
