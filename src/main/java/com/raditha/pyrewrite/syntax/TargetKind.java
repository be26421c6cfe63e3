package com.raditha.pyrewrite.syntax;

/**
 * Shape of an assignment target.
 */
public enum TargetKind {
    NAME,
    TUPLE,
    LIST,
    ATTRIBUTE,
    SUBSCRIPT,
    OTHER
}
