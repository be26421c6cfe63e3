package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A function definition, either parsed or synthesized from an assignment.
 *
 * @param range       range of the statement it stands for in the original text
 * @param name        function name
 * @param text        source or generated text
 * @param returnValue the returned expression of a synthesized function
 * @param synthesized true when generated by a rewrite
 * @param references  references inside a parsed definition
 */
public record FunctionDeclaration(
        Range range,
        String name,
        String text,
        @Nullable Expression returnValue,
        boolean synthesized,
        List<SymbolReference> references) implements Statement {

    static final String INDENT = "    ";

    public FunctionDeclaration {
        references = List.copyOf(references);
    }

    /**
     * A zero-argument function whose body returns {@code value} unchanged.
     *
     * @param lineSeparator line ending of the file the function is placed in
     */
    public static FunctionDeclaration returning(String name, Expression value, Range at, String lineSeparator) {
        String text = "def " + name + "():" + lineSeparator + INDENT + "return " + value.text();
        return new FunctionDeclaration(at, name, text, value, true, List.of());
    }

    @Override
    public StatementKind kind() {
        return StatementKind.FUNCTION_DECLARATION;
    }

    @Override
    public FunctionDeclaration withReferences(List<SymbolReference> references) {
        return new FunctionDeclaration(range, name, text, returnValue, synthesized, references);
    }
}
