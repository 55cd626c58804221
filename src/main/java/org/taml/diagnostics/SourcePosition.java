package org.taml.diagnostics;

/**
 * A 1-based line and column in a source text.
 *
 * @param line The line number, starting at 1.
 * @param column The column number, starting at 1.
 */
public record SourcePosition(int line, int column) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
