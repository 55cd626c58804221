package org.taml.ast;

import java.util.List;

/**
 * Construction helpers and type predicates for AST nodes.
 * The parser builds every node through these factories.
 */
public final class Nodes {

    private Nodes() {}

    /**
     * Creates a document node.
     * @param children The ordered top-level children.
     * @param start The start offset.
     * @param end The end offset.
     * @return The new document node.
     */
    public static DocumentNode createDocument(List<AstNode> children, int start, int end) {
        return new DocumentNode(children, start, end);
    }

    /**
     * Creates an element node.
     * @param tag The element's tag.
     * @param children The ordered children.
     * @param start The offset of the opening tag.
     * @param end The offset after the closing tag.
     * @return The new element node.
     */
    public static ElementNode createElement(TamlTag tag, List<AstNode> children, int start, int end) {
        return new ElementNode(tag, children, start, end);
    }

    /**
     * Creates a text node.
     * @param content The decoded text.
     * @param start The start offset.
     * @param end The end offset.
     * @return The new text node.
     */
    public static TextNode createText(String content, int start, int end) {
        return new TextNode(content, start, end);
    }

    public static boolean isDocument(AstNode node) {
        return node instanceof DocumentNode;
    }

    public static boolean isElement(AstNode node) {
        return node instanceof ElementNode;
    }

    public static boolean isText(AstNode node) {
        return node instanceof TextNode;
    }
}
