package org.taml.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Tokenizer} can recognize.
 */
public enum TokenType {
    /** An opening tag such as {@code <red>}. */
    OPEN_TAG,
    /** A closing tag such as {@code </red>}. */
    CLOSE_TAG,
    /** A run of text between tags. */
    TEXT,
    /** Represents the end of the source. */
    END_OF_INPUT
}
