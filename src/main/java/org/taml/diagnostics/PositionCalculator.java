package org.taml.diagnostics;

/**
 * Maps character offsets in a source text to line and column numbers.
 */
public final class PositionCalculator {

    private PositionCalculator() {}

    /**
     * Calculates the 1-based line and column of an offset.
     * Offsets past the end of the source stop at the end; negative offsets resolve to the first character.
     *
     * @param source The source text.
     * @param index The 0-based character offset.
     * @return The position of the offset.
     */
    public static SourcePosition calculate(String source, int index) {
        int line = 1;
        int column = 1;
        int limit = Math.min(index, source.length());

        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new SourcePosition(line, column);
    }
}
