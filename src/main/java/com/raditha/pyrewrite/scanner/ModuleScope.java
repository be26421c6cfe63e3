package com.raditha.pyrewrite.scanner;

import java.nio.file.Path;
import java.util.List;

/**
 * The module root of a run and every source file beneath it, sorted.
 */
public record ModuleScope(Path root, List<Path> files) {

    public ModuleScope {
        files = List.copyOf(files);
    }

    /**
     * All files except the given one.
     */
    public List<Path> filesExcept(Path file) {
        return files.stream().filter(f -> !f.equals(file)).toList();
    }
}
