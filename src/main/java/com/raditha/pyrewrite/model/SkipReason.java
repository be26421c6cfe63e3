package com.raditha.pyrewrite.model;

/**
 * Why a top-level assignment was deliberately left alone.
 */
public enum SkipReason {
    MULTIPLE_ASSIGNMENT("multiple assignment"),
    TUPLE_UNPACKING("tuple unpacking"),
    LIST_UNPACKING("list unpacking"),
    REASSIGNED("reassigned");

    private final String label;

    SkipReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
