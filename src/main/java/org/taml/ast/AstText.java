package org.taml.ast;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Text extraction over a TAML tree.
 */
public final class AstText {

    private AstText() {}

    /**
     * Concatenates the content of all text nodes below the given node in document order.
     * For a well-formed document this is the source with all tags removed and entities decoded.
     *
     * @param node The root node.
     * @return The plain text.
     */
    public static String getAllText(AstNode node) {
        StringBuilder sb = new StringBuilder();
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();
        handlers.put(TextNode.class, n -> sb.append(((TextNode) n).content()));
        new TreeWalker(handlers).walk(node);
        return sb.toString();
    }
}
