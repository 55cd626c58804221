package org.taml.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Traverses and rebuilds TAML trees.
 * {@link #walk(AstNode)} calls the handler registered for each node's class, so callers
 * only register for the node kinds they care about; {@link #transform(AstNode, UnaryOperator)}
 * produces a new tree, leaving the input untouched.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively, depth first and in document order.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Rebuilds a tree bottom-up. The children of a node are rewritten first, then the
     * node itself, rebuilt on the new children if any changed, is passed to the rewriter.
     * Subtrees the rewriter leaves untouched are shared with the input tree.
     *
     * @param node The root node to transform.
     * @param rewriter Maps a node, whose children are already rewritten, to its replacement.
     * @return The transformed node (may be the same or a new node).
     */
    public AstNode transform(AstNode node, UnaryOperator<AstNode> rewriter) {
        if (node == null) {
            return null;
        }

        List<AstNode> children = node.getChildren();
        List<AstNode> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;

        for (AstNode child : children) {
            AstNode transformedChild = transform(child, rewriter);
            childrenChanged |= transformedChild != child;
            transformedChildren.add(transformedChild);
        }

        AstNode rebuilt = childrenChanged ? node.reconstructWithChildren(transformedChildren) : node;
        return rewriter.apply(rebuilt);
    }
}
