package org.taml.ast;

import java.util.List;

/**
 * The root of a parsed TAML document.
 *
 * @param children The top-level nodes in source order.
 * @param start The start offset, always 0 for a parsed document.
 * @param end The end offset, the length of the source.
 */
public record DocumentNode(
        List<AstNode> children,
        int start,
        int end
) implements AstNode {

    public DocumentNode {
        children = List.copyOf(children);
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new DocumentNode(newChildren, start, end);
    }
}
