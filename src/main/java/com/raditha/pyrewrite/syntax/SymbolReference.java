package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;
import org.jspecify.annotations.Nullable;

/**
 * A read of a name or of an identifier-rooted attribute chain.
 */
public interface SymbolReference {

    Range range();

    /**
     * The identifier the reference starts from.
     */
    String rootName();

    /**
     * What the root name is bound to at this read, or null when nothing in the file binds it
     * (builtins, wildcard imports, undefined names).
     */
    @Nullable NameBinding binding();

    /**
     * True when an enclosing function, lambda, comprehension or class body binds the root name.
     */
    default boolean locallyBound() {
        NameBinding binding = binding();
        return binding != null && !binding.atModuleLevel();
    }

    /**
     * True when the rewrite turns this reference into a zero-argument call.
     */
    boolean invoked();

    SymbolReference invoke();
}
