package com.raditha.pyrewrite.analyzer;

import com.raditha.pyrewrite.config.NamingRule;
import com.raditha.pyrewrite.model.Binding;
import com.raditha.pyrewrite.model.SkipReason;
import com.raditha.pyrewrite.model.SkippedPattern;
import com.raditha.pyrewrite.syntax.Assignment;
import com.raditha.pyrewrite.syntax.AssignmentTarget;
import com.raditha.pyrewrite.syntax.ModuleTree;
import com.raditha.pyrewrite.syntax.Statement;
import com.raditha.pyrewrite.syntax.TargetKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions the top-level assignments of a module into convertible bindings, skipped patterns and
 * ignored statements.
 * <p>
 * Only top-level statements are inspected, so nested scopes can never shadow a binding here.
 * A statement is:
 * <ul>
 *   <li>skipped when it has several targets ({@code a = b = 1}) or destructures
 *       ({@code a, b = f()});</li>
 *   <li>ignored when its single target is not a bare identifier, carries an annotation or does
 *       not satisfy the naming rule;</li>
 *   <li>skipped as {@link SkipReason#REASSIGNED} when the same name is bound by more than one
 *       otherwise convertible statement;</li>
 *   <li>a {@link Binding} otherwise.</li>
 * </ul>
 */
public class BindingClassifier {

    private static final Logger logger = LoggerFactory.getLogger(BindingClassifier.class);

    private final NamingRule namingRule;

    public BindingClassifier(NamingRule namingRule) {
        this.namingRule = namingRule;
    }

    public ClassificationResult classify(ModuleTree tree) {
        List<Assignment> candidates = new ArrayList<>();
        List<SkippedPattern> skipped = new ArrayList<>();

        for (Statement statement : tree.body()) {
            if (!(statement instanceof Assignment assignment)) {
                continue;
            }
            if (assignment.targets().size() > 1) {
                skipped.add(skip(assignment, SkipReason.MULTIPLE_ASSIGNMENT));
                continue;
            }
            AssignmentTarget target = assignment.targets().get(0);
            if (target.kind() == TargetKind.TUPLE) {
                skipped.add(skip(assignment, SkipReason.TUPLE_UNPACKING));
                continue;
            }
            if (target.kind() == TargetKind.LIST) {
                skipped.add(skip(assignment, SkipReason.LIST_UNPACKING));
                continue;
            }
            if (target.kind() != TargetKind.NAME || assignment.annotated() || assignment.value() == null) {
                continue;
            }
            if (namingRule.matches(target.text())) {
                candidates.add(assignment);
            }
        }

        Map<String, Integer> occurrences = new HashMap<>();
        candidates.forEach(a -> occurrences.merge(name(a), 1, Integer::sum));

        List<Binding> bindings = new ArrayList<>();
        for (Assignment assignment : candidates) {
            if (occurrences.get(name(assignment)) > 1) {
                skipped.add(skip(assignment, SkipReason.REASSIGNED));
            } else {
                bindings.add(new Binding(name(assignment), assignment.range(), assignment.value()));
            }
        }
        skipped.sort((a, b) -> Integer.compare(a.location().startOffset(), b.location().startOffset()));

        logger.debug("Classified {} binding(s), {} skipped", bindings.size(), skipped.size());
        return new ClassificationResult(bindings, skipped);
    }

    private static String name(Assignment assignment) {
        return assignment.targets().get(0).text();
    }

    private static SkippedPattern skip(Assignment assignment, SkipReason reason) {
        return new SkippedPattern(assignment.range(), reason, assignment.text());
    }
}
