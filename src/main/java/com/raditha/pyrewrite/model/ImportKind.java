package com.raditha.pyrewrite.model;

/**
 * How a consuming file reaches a converted name.
 */
public enum ImportKind {
    /** {@code from module import name [as alias]}, used as a bare identifier. */
    QUALIFIED,
    /** {@code import module [as alias]}, used as {@code alias.name}. */
    DIRECT
}
