package com.raditha.pyrewrite.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Pure tree transformations: each takes an immutable tree and a per-node decision and returns a new
 * tree with the targeted replacements.
 */
public final class TreeRewriter {

    private TreeRewriter() {
    }

    /**
     * Replace top-level statements. The decision returns the statement itself to keep it.
     */
    public static ModuleTree replaceStatements(ModuleTree tree, UnaryOperator<Statement> decision) {
        List<Statement> body = new ArrayList<>(tree.body().size());
        for (Statement statement : tree.body()) {
            body.add(decision.apply(statement));
        }
        return tree.withBody(body);
    }

    /**
     * Turn every reference the decision accepts into a zero-argument call.
     */
    public static ModuleTree invokeReferences(ModuleTree tree, Predicate<SymbolReference> decision) {
        return replaceStatements(tree, statement -> {
            List<SymbolReference> references = statement.references();
            if (references.stream().noneMatch(decision)) {
                return statement;
            }
            List<SymbolReference> updated = new ArrayList<>(references.size());
            for (SymbolReference reference : references) {
                updated.add(!reference.invoked() && decision.test(reference) ? reference.invoke() : reference);
            }
            return statement.withReferences(updated);
        });
    }
}
