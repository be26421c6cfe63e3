package com.raditha.pyrewrite.analyzer;

import com.raditha.pyrewrite.model.Binding;
import com.raditha.pyrewrite.model.SkippedPattern;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Convertible bindings and skipped assignment shapes of one file, both in order of appearance.
 */
public record ClassificationResult(List<Binding> bindings, List<SkippedPattern> skipped) {

    public ClassificationResult {
        bindings = List.copyOf(bindings);
        skipped = List.copyOf(skipped);
    }

    /**
     * Names of the convertible bindings, in order of appearance.
     */
    public Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        bindings.forEach(b -> names.add(b.name()));
        return names;
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }
}
