package org.taml.frontend.lexer;

/**
 * The tokenizer's cursor, for diagnostics.
 *
 * @param position The 0-based offset of the cursor.
 * @param line The 1-based line of the cursor.
 * @param column The 1-based column of the cursor.
 */
public record PositionInfo(int position, int line, int column) {
}
