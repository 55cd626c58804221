package org.taml.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.taml.ast.AstNode;
import org.taml.ast.DocumentNode;
import org.taml.ast.ElementNode;
import org.taml.ast.TextNode;

/**
 * Serializes a TAML tree to JSON. Every node becomes an object with a {@code type}
 * of "document", "element" or "text", its span and its payload.
 */
public final class AstJsonWriter {

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Converts a node and its descendants into a JSON tree.
     * @param node The root node.
     * @return The JSON object.
     */
    public ObjectNode toJsonTree(AstNode node) {
        ObjectNode json = mapper.createObjectNode();
        if (node instanceof DocumentNode) {
            json.put("type", "document");
        } else if (node instanceof ElementNode element) {
            json.put("type", "element");
            json.put("tagName", element.tagName());
        } else if (node instanceof TextNode text) {
            json.put("type", "text");
            json.put("content", text.content());
        }
        json.put("start", node.start());
        json.put("end", node.end());

        if (!(node instanceof TextNode)) {
            ArrayNode children = json.putArray("children");
            for (AstNode child : node.getChildren()) {
                children.add(toJsonTree(child));
            }
        }
        return json;
    }

    /**
     * Renders a tree as pretty-printed JSON.
     * @param node The root node.
     * @return The JSON text.
     * @throws JsonProcessingException if serialization fails.
     */
    public String write(AstNode node) throws JsonProcessingException {
        return mapper.writeValueAsString(toJsonTree(node));
    }
}
