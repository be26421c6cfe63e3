package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * An assignment statement. Chained assignments ({@code a = b = 1}) have one target per link.
 *
 * @param range      statement range
 * @param text       statement source
 * @param targets    targets from left to right
 * @param value      assigned expression, null for a bare annotation ({@code x: int})
 * @param annotated  whether the statement carries a type annotation
 * @param references references inside the statement
 */
public record Assignment(
        Range range,
        String text,
        List<AssignmentTarget> targets,
        @Nullable Expression value,
        boolean annotated,
        List<SymbolReference> references) implements Statement {

    public Assignment {
        targets = List.copyOf(targets);
        references = List.copyOf(references);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ASSIGNMENT;
    }

    /**
     * The target name when this assigns a value to exactly one bare identifier.
     */
    public Optional<String> simpleTargetName() {
        if (targets.size() != 1 || value == null) {
            return Optional.empty();
        }
        AssignmentTarget target = targets.get(0);
        return target.kind() == TargetKind.NAME ? Optional.of(target.text()) : Optional.empty();
    }

    @Override
    public Assignment withReferences(List<SymbolReference> references) {
        return new Assignment(range, text, targets, value, annotated, references);
    }
}
