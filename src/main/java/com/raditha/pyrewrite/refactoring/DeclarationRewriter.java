package com.raditha.pyrewrite.refactoring;

import com.raditha.pyrewrite.syntax.Assignment;
import com.raditha.pyrewrite.syntax.FunctionDeclaration;
import com.raditha.pyrewrite.syntax.ModuleTree;
import com.raditha.pyrewrite.syntax.Statement;
import com.raditha.pyrewrite.syntax.TreeRewriter;

import java.util.Optional;
import java.util.Set;

/**
 * Replaces the selected top-level assignments with zero-argument functions returning the original
 * expression. Every other statement is passed through unchanged.
 */
public class DeclarationRewriter {

    public ModuleTree rewrite(ModuleTree tree, Set<String> names) {
        if (names.isEmpty()) {
            return tree;
        }
        return TreeRewriter.replaceStatements(tree,
                statement -> convert(statement, names, tree.lineSeparator()));
    }

    /**
     * The replacement for one statement, or the statement itself.
     */
    static Statement convert(Statement statement, Set<String> names, String lineSeparator) {
        if (!(statement instanceof Assignment assignment) || assignment.annotated()) {
            return statement;
        }
        Optional<String> name = assignment.simpleTargetName();
        if (name.isEmpty() || !names.contains(name.get())) {
            return statement;
        }
        return FunctionDeclaration.returning(name.get(), assignment.value(), assignment.range(),
                lineSeparator);
    }
}
