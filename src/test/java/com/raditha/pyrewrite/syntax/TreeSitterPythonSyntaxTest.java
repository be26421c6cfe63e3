package com.raditha.pyrewrite.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeSitterPythonSyntaxTest {

    private final PythonSyntax syntax = new TreeSitterPythonSyntax();

    private ModuleTree parse(String text) {
        ParseOutcome outcome = syntax.parse(text);
        assertInstanceOf(ParseOutcome.Parsed.class, outcome, "Expected a clean parse of:\n" + text);
        return outcome.tree();
    }

    @Test
    void testSimpleAssignment() {
        ModuleTree tree = parse("timeout = 30\n");

        assertEquals(1, tree.body().size());
        Assignment assignment = assertInstanceOf(Assignment.class, tree.body().get(0));
        assertEquals(1, assignment.targets().size());
        assertEquals(TargetKind.NAME, assignment.targets().get(0).kind());
        assertEquals("timeout", assignment.targets().get(0).text());
        assertNotNull(assignment.value());
        assertEquals("30", assignment.value().text());
        assertFalse(assignment.annotated());
        assertEquals(1, assignment.range().startLine());
        assertEquals("timeout = 30", assignment.text());
    }

    @Test
    void testAssignmentShapes() {
        ModuleTree tree = parse("a = b = 1\nx, y = 1, 2\n[p, q] = [1, 2]\nobj.attr = 3\nitems[0] = 4\ntyped: int = 5\n");

        List<Statement> body = tree.body();
        assertEquals(6, body.size());

        Assignment chained = (Assignment) body.get(0);
        assertEquals(2, chained.targets().size());
        assertEquals("1", chained.value().text());

        assertEquals(TargetKind.TUPLE, ((Assignment) body.get(1)).targets().get(0).kind());
        assertEquals(TargetKind.LIST, ((Assignment) body.get(2)).targets().get(0).kind());
        assertEquals(TargetKind.ATTRIBUTE, ((Assignment) body.get(3)).targets().get(0).kind());
        assertEquals(TargetKind.SUBSCRIPT, ((Assignment) body.get(4)).targets().get(0).kind());

        Assignment typed = (Assignment) body.get(5);
        assertTrue(typed.annotated());
        assertEquals("5", typed.value().text());
    }

    @Test
    void testFunctionsAndOtherStatements() {
        ModuleTree tree = parse("def f():\n    return 1\n\n@decorator\ndef g():\n    pass\n\nprint(f())\n");

        assertEquals(3, tree.body().size());
        FunctionDeclaration f = assertInstanceOf(FunctionDeclaration.class, tree.body().get(0));
        assertEquals("f", f.name());
        assertFalse(f.synthesized());
        FunctionDeclaration g = assertInstanceOf(FunctionDeclaration.class, tree.body().get(1));
        assertEquals("g", g.name());
        assertInstanceOf(OtherStatement.class, tree.body().get(2));
    }

    @Test
    void testSyntaxErrorReportsLine() {
        ParseOutcome outcome = syntax.parse("x = 1\ndef broken(:\n    pass\n");

        ParseOutcome.ParseFailed failed = assertInstanceOf(ParseOutcome.ParseFailed.class, outcome);
        assertTrue(failed.reason().startsWith("Syntax error near line"));
        assertTrue(failed.line() >= 2, "Error should be reported at or after line 2, got " + failed.line());
        assertTrue(failed.tree().hasErrors());
    }

    @Test
    void testImports() {
        ModuleTree tree = parse("import os.path as p, sys\nfrom ..pkg.sub import a as b, c\nfrom . import d\nfrom m import *\n");

        assertEquals(4, tree.imports().size());

        ImportStatement imported = (ImportStatement) tree.imports().get(0);
        assertEquals(2, imported.modules().size());
        assertEquals("os.path", imported.modules().get(0).module());
        assertEquals("p", imported.modules().get(0).alias());
        assertEquals("sys", imported.modules().get(1).module());
        assertNull(imported.modules().get(1).alias());

        ImportFromStatement relative = (ImportFromStatement) tree.imports().get(1);
        assertEquals(2, relative.level());
        assertEquals("pkg.sub", relative.module());
        assertEquals("..pkg.sub", relative.displayModule());
        assertEquals(2, relative.names().size());
        assertEquals("a", relative.names().get(0).name());
        assertEquals("b", relative.names().get(0).localName());
        assertEquals("c", relative.names().get(1).localName());

        ImportFromStatement dot = (ImportFromStatement) tree.imports().get(2);
        assertEquals(1, dot.level());
        assertNull(dot.module());
        assertEquals("d", dot.names().get(0).name());

        ImportFromStatement star = (ImportFromStatement) tree.imports().get(3);
        assertTrue(star.wildcard());
        assertTrue(star.names().isEmpty());
    }

    @Test
    void testNestedImportBindsOnlyItsScope() {
        ModuleTree tree = parse("def load():\n    from app.config import timeout\n    return timeout\n");

        assertEquals(1, tree.body().size());
        assertTrue(tree.imports().isEmpty());

        NameReference read = timeoutReads(tree).get(0);
        assertTrue(read.locallyBound());
        NameBinding binding = read.binding();
        assertNotNull(binding);
        assertFalse(binding.atModuleLevel());
        assertEquals("app.config", ((ImportFromStatement) binding.importStatement()).module());
    }

    @Test
    void testImportInsideTryBlockIsModuleLevel() {
        ModuleTree tree = parse("try:\n    from app.config import timeout\nexcept ImportError:\n    timeout = 1\n");

        assertEquals(1, tree.imports().size());
    }

    @Test
    void testReadSeesLastBindingBeforeIt() {
        ModuleTree tree = parse("from app.config import timeout\nprint(timeout)\ntimeout = 5\nprint(timeout)\n");

        List<NameReference> reads = timeoutReads(tree);
        assertEquals(2, reads.size());
        assertTrue(reads.get(0).binding().byImport());
        assertFalse(reads.get(1).binding().byImport());
        assertTrue(reads.get(1).binding().atModuleLevel());
    }

    @Test
    void testAssignedValueIsReadBeforeTheTargetIsBound() {
        ModuleTree tree = parse("from app.config import timeout\nclass C:\n    timeout = timeout\n");

        NameReference read = timeoutReads(tree).get(0);
        assertFalse(read.locallyBound());
        assertTrue(read.binding().byImport());
    }

    @Test
    void testReferencesSkipDeclarationsAndKeywords() {
        ModuleTree tree = parse("call(timeout=limit)\n");

        List<String> names = nameReferences(tree);
        assertTrue(names.contains("call"));
        assertTrue(names.contains("limit"));
        assertFalse(names.contains("timeout"), "Keyword argument names are not references");
    }

    @Test
    void testAttributeReferences() {
        ModuleTree tree = parse("print(pkg.config.timeout)\n");

        List<AttributeReference> attributes = tree.references().stream()
                .filter(AttributeReference.class::isInstance)
                .map(AttributeReference.class::cast)
                .toList();
        assertTrue(attributes.stream().anyMatch(a -> a.dottedPath().equals("pkg.config.timeout")
                && a.objectPath().equals("pkg.config") && a.attribute().equals("timeout")));
    }

    @Test
    void testStoredAttributeIsNotAReference() {
        ModuleTree tree = parse("config.timeout = 5\n");

        assertTrue(tree.references().stream().noneMatch(AttributeReference.class::isInstance));
    }

    @Test
    void testLocalBindingsShadow() {
        ModuleTree tree = parse("def f(timeout):\n    return timeout\n\ng = lambda timeout: timeout\n"
                + "h = [timeout for timeout in items]\nprint(timeout)\n");

        List<NameReference> timeouts = tree.references().stream()
                .filter(NameReference.class::isInstance)
                .map(NameReference.class::cast)
                .filter(r -> r.name().equals("timeout"))
                .toList();
        assertEquals(4, timeouts.size());
        assertEquals(3, timeouts.stream().filter(NameReference::locallyBound).count());
        NameReference free = timeouts.stream().filter(r -> !r.locallyBound()).findFirst().orElseThrow();
        assertEquals(6, free.range().startLine());
    }

    @Test
    void testClassBodyIsNotVisibleToMethods() {
        ModuleTree tree = parse("class A:\n    timeout = 1\n    other = timeout\n\n    def m(self):\n        return timeout\n");

        List<NameReference> timeouts = tree.references().stream()
                .filter(NameReference.class::isInstance)
                .map(NameReference.class::cast)
                .filter(r -> r.name().equals("timeout"))
                .toList();
        assertEquals(2, timeouts.size());
        assertTrue(timeouts.get(0).locallyBound(), "Read in the class body sees the class attribute");
        assertFalse(timeouts.get(1).locallyBound(), "Method body skips the class scope");
    }

    @Test
    void testGlobalDeclarationIsNotLocal() {
        ModuleTree tree = parse("def f():\n    global timeout\n    timeout = 2\n    return timeout\n");

        NameReference read = tree.references().stream()
                .filter(NameReference.class::isInstance)
                .map(NameReference.class::cast)
                .filter(r -> r.name().equals("timeout"))
                .findFirst()
                .orElseThrow();
        assertFalse(read.locallyBound());
    }

    @Test
    void testFormattedStringReferences() {
        ModuleTree tree = parse("print(f\"hello {name}\")\n");

        assertTrue(nameReferences(tree).contains("name"));
    }

    @Test
    void testRenderUnchangedTreeReproducesSource() {
        String source = "# header\nimport os\n\nx = 1  # trailing\n\n\ndef f(a, b=2):\n    return a + b\n";

        assertEquals(source, syntax.render(parse(source)));
    }

    @Test
    void testNonAsciiOffsets() {
        String source = "greeting = \"héllo wörld\"\nname = greeting\n";
        ModuleTree tree = parse(source);

        Assignment second = (Assignment) tree.body().get(1);
        assertEquals("name = greeting", second.text());
        assertEquals("greeting", second.value().text());
        assertEquals(source, syntax.render(tree));
    }

    private static List<String> nameReferences(ModuleTree tree) {
        return tree.references().stream()
                .filter(NameReference.class::isInstance)
                .map(r -> ((NameReference) r).name())
                .toList();
    }

    private static List<NameReference> timeoutReads(ModuleTree tree) {
        return tree.references().stream()
                .filter(NameReference.class::isInstance)
                .map(NameReference.class::cast)
                .filter(r -> r.name().equals("timeout"))
                .toList();
    }
}
