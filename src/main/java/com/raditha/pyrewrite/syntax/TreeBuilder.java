package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;
import org.jspecify.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a tree-sitter Python syntax tree into the {@link ModuleTree} model.
 * <p>
 * Besides classifying top-level statements it records every load-context identifier and
 * identifier-rooted attribute chain together with the {@link NameBinding} its root name resolves
 * to. Function, lambda and comprehension scopes own every name they bind. Module and class bodies
 * run top to bottom, so a read there sees the last binding before it, and falls through to the
 * enclosing scope when there is none. Reads inside a function body see the final binding of an
 * enclosing scope, since the body runs after the enclosing code has finished.
 */
final class TreeBuilder {

    private static final Set<String> COMPREHENSIONS = Set.of(
            "list_comprehension", "set_comprehension", "dictionary_comprehension", "generator_expression");

    private static final Set<String> DECLARATION_PARENTS = Set.of(
            "dotted_name", "aliased_import", "relative_import", "import_prefix",
            "global_statement", "nonlocal_statement",
            "parameters", "lambda_parameters", "typed_parameter",
            "keyword_pattern", "case_pattern", "class_pattern", "as_pattern_target", "type_parameter");

    private static final Set<String> NAMED_DECLARATIONS = Set.of(
            "keyword_argument", "default_parameter", "typed_default_parameter",
            "function_definition", "class_definition");

    private static final Set<String> SKIPPED_SUBTREES = Set.of(
            "future_import_statement", "global_statement", "nonlocal_statement", "case_pattern", "comment");

    /**
     * Nodes whose end marks the point a binding inside them takes effect.
     */
    private static final Set<String> BINDING_CONSTRUCTS = Set.of(
            "assignment", "augmented_assignment", "named_expression", "as_pattern");

    private enum ScopeKind { MODULE, FUNCTION, LAMBDA, CLASS, COMPREHENSION }

    /**
     * One point where a scope binds a name.
     *
     * @param offset          byte offset from which the binding is in effect
     * @param importStatement the import that made the binding, if any
     */
    private record Event(int offset, @Nullable Statement importStatement) {
    }

    private static final class Scope {
        private final int id;
        private final ScopeKind kind;
        private final Map<String, List<Event>> events = new HashMap<>();
        private final Set<String> declaredOutside = new HashSet<>();

        private Scope(int id, ScopeKind kind) {
            this.id = id;
            this.kind = kind;
        }

        private void bind(String name, Event event) {
            events.computeIfAbsent(name, k -> new ArrayList<>()).add(event);
        }

        private Scope seal() {
            events.keySet().removeAll(declaredOutside);
            events.values().forEach(list -> list.sort(Comparator.comparingInt(Event::offset)));
            return this;
        }

        /**
         * The last binding of {@code name} at or before {@code offset}, or the last one overall
         * when {@code offset} is negative.
         */
        private @Nullable Event reaching(String name, int offset) {
            List<Event> bindings = events.get(name);
            if (bindings == null) {
                return null;
            }
            Event reaching = null;
            for (Event event : bindings) {
                if (offset >= 0 && event.offset() > offset) {
                    break;
                }
                reaching = event;
            }
            return reaching;
        }
    }

    private final SourceContent content;
    private final List<Statement> imports = new ArrayList<>();
    private int nextScopeId = NameBinding.MODULE_SCOPE + 1;
    private Scope moduleScope = new Scope(NameBinding.MODULE_SCOPE, ScopeKind.MODULE);

    TreeBuilder(SourceContent content) {
        this.content = content;
    }

    ModuleTree build(TSNode root) {
        moduleScope = new Scope(NameBinding.MODULE_SCOPE, ScopeKind.MODULE);
        collectBindings(root, moduleScope);
        moduleScope.seal();

        List<Statement> body = new ArrayList<>();
        for (int i = 0; i < root.getNamedChildCount(); i++) {
            TSNode child = root.getNamedChild(i);
            if ("comment".equals(child.getType())) {
                continue;
            }
            body.add(toStatement(child));
        }
        return new ModuleTree(content.text(), body, imports, root.hasError());
    }

    private Statement toStatement(TSNode node) {
        Range range = content.rangeOf(node);
        String text = content.substringFrom(node);
        switch (node.getType()) {
            case "expression_statement" -> {
                if (node.getNamedChildCount() == 1 && "assignment".equals(node.getNamedChild(0).getType())) {
                    return assignment(node, node.getNamedChild(0), range, text);
                }
            }
            case "function_definition" -> {
                return new FunctionDeclaration(range, text(field(node, "name")), text, null, false, references(node));
            }
            case "decorated_definition" -> {
                TSNode definition = field(node, "definition");
                if (definition != null && "function_definition".equals(definition.getType())) {
                    return new FunctionDeclaration(range, text(field(definition, "name")), text, null, false,
                            references(node));
                }
            }
            case "import_statement", "import_from_statement" -> {
                Statement statement = importStatement(node);
                imports.add(statement);
                return statement;
            }
            default -> {
                // handled below
            }
        }
        return new OtherStatement(range, text, references(node));
    }

    private Assignment assignment(TSNode statement, TSNode assign, Range range, String text) {
        List<AssignmentTarget> targets = new ArrayList<>();
        boolean annotated = field(assign, "type") != null;
        TSNode current = assign;
        TSNode value;
        while (true) {
            targets.add(target(field(current, "left")));
            TSNode right = field(current, "right");
            if (right != null && "assignment".equals(right.getType())) {
                current = right;
                continue;
            }
            value = right;
            break;
        }
        Expression expression = value == null ? null : new Expression(text(value), content.rangeOf(value));
        return new Assignment(range, text, targets, expression, annotated, references(statement));
    }

    private AssignmentTarget target(@Nullable TSNode node) {
        if (node == null) {
            return new AssignmentTarget(TargetKind.OTHER, "", content.rangeOfChars(0, 0));
        }
        TargetKind kind = switch (node.getType()) {
            case "identifier" -> TargetKind.NAME;
            case "pattern_list", "tuple_pattern" -> TargetKind.TUPLE;
            case "list_pattern" -> TargetKind.LIST;
            case "attribute" -> TargetKind.ATTRIBUTE;
            case "subscript" -> TargetKind.SUBSCRIPT;
            default -> TargetKind.OTHER;
        };
        return new AssignmentTarget(kind, text(node), content.rangeOf(node));
    }

    private Statement importStatement(TSNode node) {
        Range range = content.rangeOf(node);
        String text = content.substringFrom(node);
        if ("import_statement".equals(node.getType())) {
            List<ImportStatement.ImportedModule> modules = new ArrayList<>();
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if ("dotted_name".equals(child.getType())) {
                    modules.add(new ImportStatement.ImportedModule(dotted(child), null, content.rangeOf(child)));
                } else if ("aliased_import".equals(child.getType())) {
                    modules.add(new ImportStatement.ImportedModule(
                            dotted(field(child, "name")), text(field(child, "alias")), content.rangeOf(child)));
                }
            }
            return new ImportStatement(range, text, modules);
        }

        TSNode moduleNode = field(node, "module_name");
        String module = null;
        int level = 0;
        if (moduleNode != null && "relative_import".equals(moduleNode.getType())) {
            for (int i = 0; i < moduleNode.getNamedChildCount(); i++) {
                TSNode part = moduleNode.getNamedChild(i);
                if ("import_prefix".equals(part.getType())) {
                    level = text(part).replaceAll("\\s", "").length();
                } else if ("dotted_name".equals(part.getType())) {
                    module = dotted(part);
                }
            }
        } else if (moduleNode != null) {
            module = dotted(moduleNode);
        }

        List<ImportFromStatement.ImportedName> names = new ArrayList<>();
        boolean wildcard = false;
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (moduleNode != null && sameNode(child, moduleNode)) {
                continue;
            }
            switch (child.getType()) {
                case "wildcard_import" -> wildcard = true;
                case "dotted_name" -> names.add(new ImportFromStatement.ImportedName(
                        dotted(child), null, content.rangeOf(child)));
                case "aliased_import" -> names.add(new ImportFromStatement.ImportedName(
                        dotted(field(child, "name")), text(field(child, "alias")), content.rangeOf(child)));
                default -> {
                    // comments inside parenthesized import lists
                }
            }
        }
        return new ImportFromStatement(range, text, module, level, names, wildcard);
    }

    private List<SymbolReference> references(TSNode node) {
        List<SymbolReference> references = new ArrayList<>();
        Deque<Scope> scopes = new ArrayDeque<>();
        scopes.push(moduleScope);
        collect(node, scopes, references);
        return references;
    }

    private void collect(TSNode node, Deque<Scope> scopes, List<SymbolReference> out) {
        String type = node.getType();
        if (SKIPPED_SUBTREES.contains(type)) {
            return;
        }
        switch (type) {
            case "import_statement", "import_from_statement" -> {
                // nested imports surface through the bindings of their own scope
                if (scopes.peek().kind == ScopeKind.MODULE) {
                    imports.add(importStatement(node));
                }
                return;
            }
            case "identifier" -> {
                if (isReference(node)) {
                    String name = text(node);
                    out.add(new NameReference(name, content.rangeOf(node),
                            resolve(name, node.getStartByte(), scopes), false));
                }
                return;
            }
            case "attribute" -> {
                List<String> path = attributePath(node);
                if (!path.isEmpty() && !isStorePosition(node)) {
                    out.add(new AttributeReference(path, content.rangeOf(node),
                            resolve(path.get(0), node.getStartByte(), scopes), false));
                }
                TSNode object = field(node, "object");
                if (object != null) {
                    collect(object, scopes, out);
                }
                return;
            }
            case "function_definition" -> {
                visitFunction(node, scopes, out);
                return;
            }
            case "lambda" -> {
                visitLambda(node, scopes, out);
                return;
            }
            case "class_definition" -> {
                visitClass(node, scopes, out);
                return;
            }
            default -> {
                if (COMPREHENSIONS.contains(type)) {
                    scopes.push(comprehensionScope(node));
                    collectChildren(node, scopes, out);
                    scopes.pop();
                    return;
                }
            }
        }
        collectChildren(node, scopes, out);
    }

    private void collectChildren(TSNode node, Deque<Scope> scopes, List<SymbolReference> out) {
        for (int i = 0; i < node.getChildCount(); i++) {
            collect(node.getChild(i), scopes, out);
        }
    }

    private void visitFunction(TSNode node, Deque<Scope> scopes, List<SymbolReference> out) {
        // defaults and annotations are evaluated in the enclosing scope
        TSNode parameters = field(node, "parameters");
        if (parameters != null) {
            collect(parameters, scopes, out);
        }
        TSNode returnType = field(node, "return_type");
        if (returnType != null) {
            collect(returnType, scopes, out);
        }
        TSNode body = field(node, "body");
        if (body != null) {
            scopes.push(scopeOf(ScopeKind.FUNCTION, parameters, body));
            collect(body, scopes, out);
            scopes.pop();
        }
    }

    private void visitLambda(TSNode node, Deque<Scope> scopes, List<SymbolReference> out) {
        TSNode parameters = field(node, "parameters");
        if (parameters != null) {
            collect(parameters, scopes, out);
        }
        TSNode body = field(node, "body");
        if (body != null) {
            scopes.push(scopeOf(ScopeKind.LAMBDA, parameters, body));
            collect(body, scopes, out);
            scopes.pop();
        }
    }

    private void visitClass(TSNode node, Deque<Scope> scopes, List<SymbolReference> out) {
        TSNode superclasses = field(node, "superclasses");
        if (superclasses != null) {
            collect(superclasses, scopes, out);
        }
        TSNode body = field(node, "body");
        if (body != null) {
            scopes.push(scopeOf(ScopeKind.CLASS, null, body));
            collect(body, scopes, out);
            scopes.pop();
        }
    }

    /**
     * Resolves a read of {@code name} at byte {@code offset} against the enclosing scopes,
     * innermost first. Class bodies are only visible to code directly inside them.
     */
    private static @Nullable NameBinding resolve(String name, int offset, Deque<Scope> scopes) {
        boolean deferred = false;
        boolean innermost = true;
        for (Scope scope : scopes) {
            if ((innermost || scope.kind != ScopeKind.CLASS) && scope.events.containsKey(name)) {
                Event event = scope.reaching(name, deferred ? -1 : offset);
                switch (scope.kind) {
                    case FUNCTION, LAMBDA, COMPREHENSION -> {
                        return new NameBinding(scope.id, event == null ? null : event.importStatement());
                    }
                    default -> {
                        if (event != null) {
                            return new NameBinding(scope.id, event.importStatement());
                        }
                    }
                }
            }
            if (scope.kind == ScopeKind.FUNCTION || scope.kind == ScopeKind.LAMBDA) {
                deferred = true;
            }
            innermost = false;
        }
        return null;
    }

    private Scope scopeOf(ScopeKind kind, @Nullable TSNode parameters, TSNode body) {
        Scope scope = new Scope(nextScopeId++, kind);
        if (parameters != null) {
            collectBindings(parameters, scope);
        }
        collectBindings(body, scope);
        return scope.seal();
    }

    private Scope comprehensionScope(TSNode comprehension) {
        Scope scope = new Scope(nextScopeId++, ScopeKind.COMPREHENSION);
        for (int i = 0; i < comprehension.getNamedChildCount(); i++) {
            TSNode clause = comprehension.getNamedChild(i);
            if ("for_in_clause".equals(clause.getType())) {
                TSNode left = field(clause, "left");
                if (left != null) {
                    collectBindings(left, scope);
                }
            }
        }
        return scope.seal();
    }

    /**
     * Collects the names a scope binds without descending into nested scopes.
     */
    private void collectBindings(TSNode node, Scope scope) {
        String type = node.getType();
        switch (type) {
            case "identifier" -> {
                if (isBindingName(node)) {
                    scope.bind(text(node), new Event(bindingOffset(node), null));
                }
                return;
            }
            case "function_definition", "class_definition" -> {
                TSNode name = field(node, "name");
                if (name != null) {
                    scope.bind(text(name), new Event(node.getEndByte(), null));
                }
                return;
            }
            case "lambda" -> {
                return;
            }
            case "global_statement", "nonlocal_statement" -> {
                for (int i = 0; i < node.getNamedChildCount(); i++) {
                    scope.declaredOutside.add(text(node.getNamedChild(i)));
                }
                return;
            }
            case "import_statement", "import_from_statement" -> {
                Statement statement = importStatement(node);
                for (String name : importedNames(statement)) {
                    scope.bind(name, new Event(node.getEndByte(), statement));
                }
                return;
            }
            default -> {
                if (COMPREHENSIONS.contains(type)) {
                    return;
                }
            }
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            collectBindings(node.getChild(i), scope);
        }
    }

    /**
     * Where a binding identifier takes effect: after the whole assignment, walrus or {@code with}
     * item it belongs to, after the iterable of a {@code for} loop, otherwise right after itself.
     */
    private static int bindingOffset(TSNode identifier) {
        for (TSNode node = identifier.getParent(); node != null && !node.isNull(); node = node.getParent()) {
            String type = node.getType();
            if (BINDING_CONSTRUCTS.contains(type)) {
                return node.getEndByte();
            }
            if ("for_statement".equals(type) || "for_in_clause".equals(type)) {
                TSNode iterable = field(node, "right");
                return iterable != null ? iterable.getEndByte() : identifier.getEndByte();
            }
            if (type.endsWith("_statement") || "block".equals(type) || "module".equals(type)
                    || "parameters".equals(type) || "lambda_parameters".equals(type)) {
                break;
            }
        }
        return identifier.getEndByte();
    }

    private static List<String> importedNames(Statement statement) {
        List<String> names = new ArrayList<>();
        if (statement instanceof ImportStatement imported) {
            for (ImportStatement.ImportedModule module : imported.modules()) {
                names.add(module.alias() != null ? module.alias() : module.module().split("\\.")[0]);
            }
        } else if (statement instanceof ImportFromStatement from) {
            for (ImportFromStatement.ImportedName name : from.names()) {
                names.add(name.localName());
            }
        }
        return names;
    }

    private boolean isBindingName(TSNode identifier) {
        if (isStorePosition(identifier)) {
            return true;
        }
        TSNode parent = identifier.getParent();
        return switch (parent.getType()) {
            case "parameters", "lambda_parameters", "typed_parameter", "as_pattern_target" -> true;
            case "default_parameter", "typed_default_parameter" -> isField(parent, "name", identifier);
            default -> followsAsKeyword(identifier);
        };
    }

    /**
     * True for a load-context identifier.
     */
    private boolean isReference(TSNode identifier) {
        if (isStorePosition(identifier)) {
            return false;
        }
        TSNode parent = identifier.getParent();
        String parentType = parent.getType();
        if (DECLARATION_PARENTS.contains(parentType)) {
            return false;
        }
        if (NAMED_DECLARATIONS.contains(parentType)) {
            return !isField(parent, "name", identifier);
        }
        if ("attribute".equals(parentType)) {
            return !isField(parent, "attribute", identifier);
        }
        return !followsAsKeyword(identifier);
    }

    /**
     * True when the node is written to rather than read: assignment, loop and walrus targets,
     * destructuring patterns and {@code del} operands.
     */
    private static boolean isStorePosition(TSNode node) {
        TSNode parent = node.getParent();
        if (parent == null || parent.isNull()) {
            return false;
        }
        return switch (parent.getType()) {
            case "pattern_list", "tuple_pattern", "list_pattern", "list_splat_pattern",
                    "dictionary_splat_pattern", "as_pattern_target", "delete_statement" -> true;
            case "assignment", "augmented_assignment", "for_statement", "for_in_clause" ->
                    isField(parent, "left", node);
            case "named_expression" -> isField(parent, "name", node);
            case "expression_list" -> {
                TSNode grandParent = parent.getParent();
                yield grandParent != null && !grandParent.isNull() && "delete_statement".equals(grandParent.getType());
            }
            default -> false;
        };
    }

    private static boolean followsAsKeyword(TSNode node) {
        TSNode parent = node.getParent();
        if (parent == null || parent.isNull()) {
            return false;
        }
        for (int i = 1; i < parent.getChildCount(); i++) {
            if (sameNode(parent.getChild(i), node)) {
                return "as".equals(parent.getChild(i - 1).getType());
            }
        }
        return false;
    }

    private List<String> attributePath(TSNode attribute) {
        Deque<String> parts = new ArrayDeque<>();
        TSNode current = attribute;
        while (current != null && "attribute".equals(current.getType())) {
            TSNode name = field(current, "attribute");
            if (name == null) {
                return List.of();
            }
            parts.addFirst(text(name));
            current = field(current, "object");
        }
        if (current == null || !"identifier".equals(current.getType())) {
            return List.of();
        }
        parts.addFirst(text(current));
        return List.copyOf(parts);
    }

    private static @Nullable TSNode field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    private static boolean isField(TSNode parent, String name, TSNode node) {
        TSNode child = field(parent, name);
        return child != null && sameNode(child, node);
    }

    private static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    private String text(@Nullable TSNode node) {
        return node == null ? "" : content.substringFrom(node);
    }

    private String dotted(@Nullable TSNode node) {
        return text(node).replaceAll("\\s", "");
    }
}
