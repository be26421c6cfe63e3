package com.raditha.pyrewrite.refactoring;

import com.raditha.pyrewrite.analyzer.BindingClassifier;
import com.raditha.pyrewrite.config.NamingRule;
import com.raditha.pyrewrite.syntax.FunctionDeclaration;
import com.raditha.pyrewrite.syntax.ModuleTree;
import com.raditha.pyrewrite.syntax.ParseOutcome;
import com.raditha.pyrewrite.syntax.PythonSyntax;
import com.raditha.pyrewrite.syntax.TreeSitterPythonSyntax;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeclarationRewriterTest {

    private final PythonSyntax syntax = new TreeSitterPythonSyntax();
    private final DeclarationRewriter rewriter = new DeclarationRewriter();

    @Test
    void testSelectedAssignmentsBecomeFunctions() {
        ModuleTree tree = syntax.parse("base_url = \"https://example.com\"\ntimeout = 30\nMAX = 5\n").tree();

        ModuleTree rewritten = rewriter.rewrite(tree, Set.of("base_url", "timeout"));

        FunctionDeclaration first = assertInstanceOf(FunctionDeclaration.class, rewritten.body().get(0));
        assertTrue(first.synthesized());
        assertEquals("base_url", first.name());
        assertEquals("def base_url():\n    return \"https://example.com\"", first.text());
        assertInstanceOf(FunctionDeclaration.class, rewritten.body().get(1));
        assertSame(tree.body().get(2), rewritten.body().get(2));
    }

    @Test
    void testEmptyNameSetReturnsSameTree() {
        ModuleTree tree = syntax.parse("timeout = 30\n").tree();

        assertSame(tree, rewriter.rewrite(tree, Set.of()));
    }

    @Test
    void testAnnotatedAndChainedAssignmentsAreLeftAlone() {
        String source = "timeout: int = 30\na = b = 1\n";
        ModuleTree tree = syntax.parse(source).tree();

        assertEquals(source, syntax.render(rewriter.rewrite(tree, Set.of("timeout", "a", "b"))));
    }

    @Test
    void testComplexValueIsPreserved() {
        String source = "handlers = {\"a\": lambda x: x + 1, **defaults}\n";
        ModuleTree tree = syntax.parse(source).tree();

        String rendered = syntax.render(rewriter.rewrite(tree, Set.of("handlers")));

        assertEquals("def handlers():\n    return {\"a\": lambda x: x + 1, **defaults}\n", rendered);
        assertInstanceOf(ParseOutcome.Parsed.class, syntax.parse(rendered));
    }

    /**
     * Any simple binding renders as a function returning exactly the original value, and the result
     * has no bindings left.
     */
    @Property(tries = 50)
    void convertedBindingReturnsOriginalValue(
            @ForAll("identifiers") String name,
            @ForAll @IntRange(min = 0, max = 100000) int value) {
        ModuleTree tree = syntax.parse(name + " = " + value + "\n").tree();

        String rendered = syntax.render(rewriter.rewrite(tree, Set.of(name)));

        assertEquals("def " + name + "():\n    return " + value + "\n", rendered);
        ParseOutcome reparsed = syntax.parse(rendered);
        assertInstanceOf(ParseOutcome.Parsed.class, reparsed);
        assertTrue(new BindingClassifier(NamingRule.snakeCase()).classify(reparsed.tree()).bindings().isEmpty(),
                "A converted file has nothing left to convert");
    }

    @Provide
    Arbitrary<String> identifiers() {
        return Arbitraries.strings()
                .withCharRange('a', 'z')
                .withChars('_')
                .ofMinLength(1)
                .ofMaxLength(12)
                .map(s -> "v_" + s);
    }
}
