package org.taml.frontend.parser;

import org.taml.frontend.lexer.Token;

import java.util.List;

/**
 * A snapshot of the parser state, for diagnostics.
 *
 * @param position The index of the current token.
 * @param currentToken The current token, or null past the end.
 * @param tagStack The names of the open tags, outermost first.
 */
public record ParserDebugInfo(int position, Token currentToken, List<String> tagStack) {
}
