package com.raditha.pyrewrite.syntax;

public enum StatementKind {
    ASSIGNMENT,
    FUNCTION_DECLARATION,
    IMPORT,
    IMPORT_FROM,
    OTHER
}
