package com.raditha.pyrewrite.analyzer;

import com.raditha.pyrewrite.config.NamingRule;
import com.raditha.pyrewrite.model.Binding;
import com.raditha.pyrewrite.model.SkipReason;
import com.raditha.pyrewrite.model.SkippedPattern;
import com.raditha.pyrewrite.syntax.ModuleTree;
import com.raditha.pyrewrite.syntax.TreeSitterPythonSyntax;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BindingClassifierTest {

    private BindingClassifier classifier;
    private TreeSitterPythonSyntax syntax;

    @BeforeEach
    void setUp() {
        classifier = new BindingClassifier(NamingRule.snakeCase());
        syntax = new TreeSitterPythonSyntax();
    }

    private ClassificationResult classify(String source) {
        ModuleTree tree = syntax.parse(source).tree();
        return classifier.classify(tree);
    }

    @Test
    void testSnakeCaseBindingsAreConverted() {
        ClassificationResult result = classify("base_url = \"https://example.com\"\ntimeout = 30\nretries2 = 3\n");

        assertEquals(List.of("base_url", "timeout", "retries2"), List.copyOf(result.names()));
        Binding first = result.bindings().get(0);
        assertEquals(1, first.line());
        assertEquals("\"https://example.com\"", first.valueSource());
        assertTrue(result.skipped().isEmpty());
    }

    @Test
    void testNamesOutsideTheRuleAreIgnored() {
        ClassificationResult result = classify("MAX_SIZE = 10\nCamelCase = 1\n_private = 2\n__all__ = []\n");

        assertTrue(result.isEmpty());
        assertTrue(result.skipped().isEmpty());
    }

    @Test
    void testDestructuringAndChainsAreSkipped() {
        ClassificationResult result = classify("a = b = 1\nx, y = 1, 2\n[p, q] = [1, 2]\n(m, n) = pair\n");

        assertTrue(result.isEmpty());
        List<SkipReason> reasons = result.skipped().stream().map(SkippedPattern::reason).toList();
        assertEquals(List.of(SkipReason.MULTIPLE_ASSIGNMENT, SkipReason.TUPLE_UNPACKING,
                SkipReason.LIST_UNPACKING, SkipReason.TUPLE_UNPACKING), reasons);
        assertEquals("a = b = 1", result.skipped().get(0).rawText());
        assertEquals(2, result.skipped().get(1).line());
    }

    @Test
    void testAnnotatedAndNonNameTargetsAreIgnored() {
        ClassificationResult result = classify("typed: int = 5\nbare: str\nobj.attr = 3\nitems[0] = 4\n");

        assertTrue(result.isEmpty());
        assertTrue(result.skipped().isEmpty());
    }

    @Test
    void testReassignedNameIsSkipped() {
        ClassificationResult result = classify("counter = 1\ntimeout = 30\ncounter = 2\n");

        assertEquals(List.of("timeout"), List.copyOf(result.names()));
        assertEquals(2, result.skipped().size());
        assertTrue(result.skipped().stream().allMatch(s -> s.reason() == SkipReason.REASSIGNED));
        assertEquals(1, result.skipped().get(0).line());
        assertEquals(3, result.skipped().get(1).line());
    }

    @Test
    void testNestedAssignmentsAreNotTopLevel() {
        ClassificationResult result = classify("def f():\n    inner = 1\n    return inner\n\nif True:\n    flag = 1\n");

        assertTrue(result.isEmpty());
    }

    @Test
    void testCustomNamingRule() {
        BindingClassifier custom = new BindingClassifier(NamingRule.of("^cfg_[a-z]+$"));
        ModuleTree tree = syntax.parse("cfg_host = 'h'\nport = 1\n").tree();

        assertEquals(List.of("cfg_host"), List.copyOf(custom.classify(tree).names()));
    }

    @Test
    void testSkippedEntriesFollowSourceOrder() {
        ClassificationResult result = classify("x = 1\na = b = 2\nx = 3\n");

        List<Integer> lines = result.skipped().stream().map(SkippedPattern::line).toList();
        assertEquals(List.of(1, 2, 3), lines);
    }
}
