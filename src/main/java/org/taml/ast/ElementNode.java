package org.taml.ast;

import java.util.List;
import java.util.Objects;

/**
 * An AST node for a tagged region, e.g. {@code <red>...</red>}.
 *
 * @param tag The tag of the element.
 * @param children The nodes between the opening and the closing tag.
 * @param start The offset of the opening tag's '&lt;'.
 * @param end The offset after the closing tag's '&gt;'.
 */
public record ElementNode(
        TamlTag tag,
        List<AstNode> children,
        int start,
        int end
) implements AstNode {

    public ElementNode {
        Objects.requireNonNull(tag, "tag");
        children = List.copyOf(children);
    }

    /**
     * Gets the tag name as written in source.
     * @return The tag name.
     */
    public String tagName() {
        return tag.tagName();
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }

    @Override
    public AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return new ElementNode(tag, newChildren, start, end);
    }
}
