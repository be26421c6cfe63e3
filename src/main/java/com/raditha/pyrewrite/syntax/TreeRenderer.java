package com.raditha.pyrewrite.syntax;

import java.util.Comparator;
import java.util.List;

/**
 * Renders a {@link ModuleTree} by splicing: text between statements and unchanged statements are
 * copied from the original source, synthesized functions are emitted from their generated text and
 * invoked references get {@code ()} appended.
 */
public final class TreeRenderer {

    private TreeRenderer() {
    }

    public static String render(ModuleTree tree) {
        String source = tree.source();
        StringBuilder out = new StringBuilder(source.length() + 64);
        String newline = tree.lineSeparator();
        int cursor = 0;
        boolean previousSynthesized = false;
        for (Statement statement : tree.body()) {
            boolean synthesized = isSynthesized(statement);
            String gap = source.substring(cursor, statement.range().startOffset());
            if (previousSynthesized) {
                gap = separateAfterFunction(gap, newline);
            }
            if (synthesized) {
                gap = separateBeforeFunction(gap, newline);
            }
            out.append(gap).append(renderStatement(statement));
            cursor = statement.range().endOffset();
            previousSynthesized = synthesized;
        }
        String tail = source.substring(cursor);
        out.append(previousSynthesized ? separateAfterFunction(tail, newline) : tail);
        return out.toString();
    }

    private static boolean isSynthesized(Statement statement) {
        return statement instanceof FunctionDeclaration function && function.synthesized();
    }

    private static String renderStatement(Statement statement) {
        if (isSynthesized(statement)) {
            return statement.text();
        }
        List<SymbolReference> invoked = statement.references().stream()
                .filter(SymbolReference::invoked)
                .sorted(Comparator.comparingInt(r -> r.range().endOffset()))
                .toList();
        if (invoked.isEmpty()) {
            return statement.text();
        }
        String text = statement.text();
        int base = statement.range().startOffset();
        StringBuilder out = new StringBuilder(text.length() + invoked.size() * 2);
        int cursor = 0;
        for (SymbolReference reference : invoked) {
            int end = reference.range().endOffset() - base;
            out.append(text, cursor, end).append("()");
            cursor = end;
        }
        out.append(text, cursor, text.length());
        return out.toString();
    }

    /**
     * A {@code def} cannot share its line with a preceding simple statement: {@code a = 1; b = 2}
     * becomes {@code a = 1} and {@code def b(): ...} on the next line.
     */
    private static String separateBeforeFunction(String gap, String newline) {
        int end = gap.length();
        while (end > 0 && (gap.charAt(end - 1) == ' ' || gap.charAt(end - 1) == '\t')) {
            end--;
        }
        if (end > 0 && gap.charAt(end - 1) == ';') {
            return gap.substring(0, end - 1) + newline;
        }
        return gap;
    }

    /**
     * Drops a {@code ;} that followed a synthesized function and starts the next statement on a new line.
     */
    private static String separateAfterFunction(String gap, String newline) {
        int start = 0;
        while (start < gap.length() && (gap.charAt(start) == ' ' || gap.charAt(start) == '\t')) {
            start++;
        }
        if (start < gap.length() && gap.charAt(start) == ';') {
            String rest = gap.substring(start + 1).replaceFirst("^[ \\t]*", "");
            if (rest.startsWith("\n") || rest.startsWith("\r")) {
                return rest;
            }
            return newline + rest;
        }
        return gap;
    }
}
