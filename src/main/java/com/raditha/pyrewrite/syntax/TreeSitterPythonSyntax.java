package com.raditha.pyrewrite.syntax;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * {@link PythonSyntax} backed by the tree-sitter Python grammar.
 * <p>
 * A {@link TSParser} is not thread safe, so each thread gets its own.
 */
public class TreeSitterPythonSyntax implements PythonSyntax {

    private static final Logger logger = LoggerFactory.getLogger(TreeSitterPythonSyntax.class);

    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        return parser;
    });

    @Override
    public ParseOutcome parse(String text) {
        SourceContent content = SourceContent.of(text);
        TSTree tree = PARSER.get().parseString(null, text);
        try {
            TSNode root = tree.getRootNode();
            ModuleTree module = new TreeBuilder(content).build(root);
            if (!root.hasError()) {
                return new ParseOutcome.Parsed(module);
            }
            TSNode error = firstError(root);
            int line = content.rangeOf(error).startLine();
            logger.debug("Syntax error near line {}", line);
            return new ParseOutcome.ParseFailed("Syntax error near line " + line, line, module);
        } finally {
            // nodes borrow the tree's native memory
            java.lang.ref.Reference.reachabilityFence(tree);
        }
    }

    @Override
    public String render(ModuleTree tree) {
        return TreeRenderer.render(tree);
    }

    /**
     * Descends along the children that contain errors to the innermost offending node.
     */
    private static TSNode firstError(TSNode node) {
        TSNode current = node;
        while (!"ERROR".equals(current.getType())) {
            TSNode next = null;
            for (int i = 0; i < current.getChildCount(); i++) {
                TSNode child = current.getChild(i);
                if ("ERROR".equals(child.getType()) || child.hasError()) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return current;
            }
            current = next;
        }
        return current;
    }
}
