package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;

/**
 * An expression carried as its exact source text.
 */
public record Expression(String text, Range range) {
}
