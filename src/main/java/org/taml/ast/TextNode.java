package org.taml.ast;

import java.util.Objects;

/**
 * An AST node for plain text with entities already decoded.
 *
 * @param content The decoded text.
 * @param start The start offset of the raw text in the source.
 * @param end The end offset of the raw text in the source.
 */
public record TextNode(
        String content,
        int start,
        int end
) implements AstNode {

    public TextNode {
        Objects.requireNonNull(content, "content");
    }

    // This node has no children and inherits the empty list from getChildren().
}
