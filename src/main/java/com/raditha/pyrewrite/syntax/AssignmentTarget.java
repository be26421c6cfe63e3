package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;

public record AssignmentTarget(TargetKind kind, String text, Range range) {
}
