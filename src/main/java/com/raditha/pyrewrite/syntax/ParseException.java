package com.raditha.pyrewrite.syntax;

import java.nio.file.Path;

/**
 * Thrown when a file whose parse is required does not parse.
 */
public class ParseException extends Exception {

    private final transient Path file;
    private final int line;

    public ParseException(Path file, int line, String reason) {
        super(file + ": " + reason);
        this.file = file;
        this.line = line;
    }

    public Path getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }
}
