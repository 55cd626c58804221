package org.taml.frontend.lexer;

/**
 * A single token extracted from TAML source by the {@link Tokenizer}.
 * <p>
 * Every token spans {@code [start, end)} of the source; {@code line} and {@code column}
 * are the 1-based position of {@code start}.
 */
public sealed interface Token permits Token.OpenTag, Token.CloseTag, Token.Text, Token.EndOfInput {

    /**
     * Gets the kind of this token.
     * @return The token type.
     */
    TokenType type();

    /**
     * Gets the raw source text of this token.
     * @return The exact text from the source.
     */
    String value();

    int start();

    int end();

    int line();

    int column();

    /**
     * An opening tag, e.g. {@code <bold>}.
     *
     * @param tagName The name between the brackets.
     * @param value The raw tag text including brackets.
     * @param start The offset of '&lt;'.
     * @param end The offset after '&gt;'.
     * @param line The line of '&lt;'.
     * @param column The column of '&lt;'.
     */
    record OpenTag(String tagName, String value, int start, int end, int line, int column) implements Token {
        @Override
        public TokenType type() {
            return TokenType.OPEN_TAG;
        }
    }

    /**
     * A closing tag, e.g. {@code </bold>}.
     *
     * @param tagName The name after the slash.
     * @param value The raw tag text including brackets and slash.
     * @param start The offset of '&lt;'.
     * @param end The offset after '&gt;'.
     * @param line The line of '&lt;'.
     * @param column The column of '&lt;'.
     */
    record CloseTag(String tagName, String value, int start, int end, int line, int column) implements Token {
        @Override
        public TokenType type() {
            return TokenType.CLOSE_TAG;
        }
    }

    /**
     * A run of text.
     *
     * @param content The text with {@code &lt;} and {@code &amp;} decoded.
     * @param value The raw text as found in the source.
     * @param start The start offset.
     * @param end The end offset.
     * @param line The line of the first character.
     * @param column The column of the first character.
     */
    record Text(String content, String value, int start, int end, int line, int column) implements Token {
        @Override
        public TokenType type() {
            return TokenType.TEXT;
        }
    }

    /**
     * The terminal sentinel, positioned at the source length with an empty span.
     *
     * @param start The source length.
     * @param end The source length.
     * @param line The line after the last character.
     * @param column The column after the last character.
     */
    record EndOfInput(int start, int end, int line, int column) implements Token {
        @Override
        public TokenType type() {
            return TokenType.END_OF_INPUT;
        }

        @Override
        public String value() {
            return "";
        }
    }
}
