package org.taml.frontend.parser;

import org.taml.ast.AstNode;
import org.taml.ast.DocumentNode;
import org.taml.ast.ElementNode;
import org.taml.ast.Nodes;
import org.taml.ast.TextNode;
import org.taml.ast.TreeWalker;

import java.util.Map;

/**
 * A post-processing pass that rebuilds a tree with every source offset set to 0.
 */
public final class PositionStripper {

    private static final TreeWalker WALKER = new TreeWalker(Map.of());

    private PositionStripper() {}

    /**
     * Strips the positions of a document and all of its descendants.
     * @param document The parsed document.
     * @return An equivalent document whose nodes all span [0, 0].
     */
    public static DocumentNode strip(DocumentNode document) {
        return (DocumentNode) WALKER.transform(document, PositionStripper::withoutSpan);
    }

    private static AstNode withoutSpan(AstNode node) {
        if (node instanceof DocumentNode document) {
            return Nodes.createDocument(document.children(), 0, 0);
        }
        if (node instanceof ElementNode element) {
            return Nodes.createElement(element.tag(), element.children(), 0, 0);
        }
        TextNode text = (TextNode) node;
        return Nodes.createText(text.content(), 0, 0);
    }
}
