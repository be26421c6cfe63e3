package com.raditha.pyrewrite.refactoring;

import com.raditha.pyrewrite.syntax.ModuleTree;
import com.raditha.pyrewrite.syntax.ParseException;
import com.raditha.pyrewrite.syntax.ParseOutcome;
import com.raditha.pyrewrite.syntax.PythonSyntax;
import com.raditha.pyrewrite.syntax.TreeSitterPythonSyntax;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ChangeApplierTest {

    @TempDir
    Path tempDir;

    @Test
    void testApplyWritesEveryFile() throws Exception {
        Path config = Files.writeString(tempDir.resolve("config.py"), "timeout = 30\n");
        Path main = Files.writeString(tempDir.resolve("main.py"), "print(timeout)\n");
        Map<Path, String> changes = new LinkedHashMap<>();
        changes.put(config, "def timeout():\n    return 30\n");
        changes.put(main, "print(timeout())\n");

        List<Path> written = new ChangeApplier(new TreeSitterPythonSyntax()).apply(changes);

        assertEquals(List.of(config, main), written);
        assertEquals("def timeout():\n    return 30\n", Files.readString(config));
        assertEquals("print(timeout())\n", Files.readString(main));
    }

    @Test
    void testVerificationFailureWritesNothing() throws IOException {
        Path good = Files.writeString(tempDir.resolve("good.py"), "a = 1\n");
        Path bad = Files.writeString(tempDir.resolve("bad.py"), "b = 1\n");
        Map<Path, String> changes = new LinkedHashMap<>();
        changes.put(good, "a = 2\n");
        changes.put(bad, "def b(:\n");

        ChangeApplier applier = new ChangeApplier(new TreeSitterPythonSyntax());
        ParseException e = assertThrows(ParseException.class, () -> applier.apply(changes));

        assertEquals(bad, e.getFile());
        assertEquals("a = 1\n", Files.readString(good));
        assertEquals("b = 1\n", Files.readString(bad));
    }

    @Test
    void testNoVerificationSkipsParsing() throws Exception {
        PythonSyntax syntax = mock(PythonSyntax.class);
        Path file = Files.writeString(tempDir.resolve("x.py"), "x = 1\n");

        new ChangeApplier(syntax, ChangeApplier.VerificationLevel.NONE).apply(Map.of(file, "x = (\n"));

        verifyNoInteractions(syntax);
        assertEquals("x = (\n", Files.readString(file));
    }

    @Test
    void testParseVerificationUsesSyntax() throws Exception {
        PythonSyntax syntax = mock(PythonSyntax.class);
        ModuleTree empty = new ModuleTree("", List.of(), List.of(), true);
        when(syntax.parse(anyString())).thenReturn(new ParseOutcome.ParseFailed("Syntax error near line 3", 3, empty));
        Path file = Files.writeString(tempDir.resolve("x.py"), "x = 1\n");

        ChangeApplier applier = new ChangeApplier(syntax, ChangeApplier.VerificationLevel.PARSE);
        ParseException e = assertThrows(ParseException.class, () -> applier.apply(Map.of(file, "anything")));

        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().contains("Syntax error near line 3"));
        verify(syntax).parse("anything");
        assertEquals("x = 1\n", Files.readString(file));
    }

    @Test
    void testFailedWriteRestoresEarlierFiles() throws IOException {
        Path first = Files.writeString(tempDir.resolve("first.py"), "first = 1\n");
        Path directory = Files.createDirectory(tempDir.resolve("not_a_file.py"));
        Map<Path, String> changes = new LinkedHashMap<>();
        changes.put(first, "def first():\n    return 1\n");
        changes.put(directory, "x = 1\n");

        ChangeApplier applier = new ChangeApplier(new TreeSitterPythonSyntax(), ChangeApplier.VerificationLevel.NONE);

        assertThrows(IOException.class, () -> applier.apply(changes));
        assertEquals("first = 1\n", Files.readString(first));
        assertTrue(Files.isDirectory(directory));
    }

    @Test
    void testRollbackRestoresBackups() throws IOException {
        Path file = Files.writeString(tempDir.resolve("a.py"), "original\n");
        ChangeApplier applier = new ChangeApplier(new TreeSitterPythonSyntax());

        applier.createBackup(file);
        Files.writeString(file, "changed\n");
        applier.rollback();

        assertEquals("original\n", Files.readString(file));
        applier.clearBackups();
    }
}
