package org.taml.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base type for all nodes in a TAML Abstract Syntax Tree (AST).
 * A tree consists of a single {@link DocumentNode} root, {@link ElementNode}s for
 * tagged regions and {@link TextNode} leaves.
 */
public sealed interface AstNode permits DocumentNode, ElementNode, TextNode {

    /**
     * Gets the offset of the first character covered by this node.
     * @return The start offset (inclusive).
     */
    int start();

    /**
     * Gets the offset after the last character covered by this node.
     * @return The end offset (exclusive).
     */
    int end();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic {@link TreeWalker} to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this node with the given children.
     *
     * @param newChildren The new children for this node.
     * @return A new instance of this node with the new children, or this node if it has no children.
     */
    default AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return this;
    }
}
