package org.taml.frontend;

import org.taml.frontend.lexer.Token;

/**
 * An entry of the tag stack kept while matching opening and closing tags.
 *
 * @param tagName The name of the open tag.
 * @param token The token that opened the tag.
 */
public record TagStackEntry(String tagName, Token token) {
}
