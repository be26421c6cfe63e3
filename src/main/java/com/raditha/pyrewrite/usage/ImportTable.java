package com.raditha.pyrewrite.usage;

import com.raditha.pyrewrite.model.ImportBinding;
import com.raditha.pyrewrite.model.Range;

import java.util.List;
import java.util.Map;

/**
 * How one consuming file reaches the target module.
 *
 * @param qualified bindings of converted names, keyed by the local identifier
 * @param direct    bindings of the module itself, keyed by the dotted access path
 * @param wildcards {@code from module import *} imports of the target
 */
public record ImportTable(
        Map<String, ImportBinding> qualified,
        Map<String, ImportBinding> direct,
        List<WildcardImport> wildcards) {

    /**
     * A wildcard import of the target module.
     */
    public record WildcardImport(String moduleName, Range location) {
    }

    public ImportTable {
        qualified = Map.copyOf(qualified);
        direct = Map.copyOf(direct);
        wildcards = List.copyOf(wildcards);
    }
}
