package org.taml.frontend.parser;

/**
 * Options controlling how a TAML source is turned into a tree.
 *
 * @param maxDepth The maximum nesting depth of elements before parsing aborts, at most {@value #MAX_ALLOWED_DEPTH}.
 * @param includePositions Whether nodes keep their source offsets; when false every offset is 0.
 */
public record ParseOptions(int maxDepth, boolean includePositions) {

    /** The default maximum nesting depth. */
    public static final int DEFAULT_MAX_DEPTH = 100;

    /**
     * The largest accepted depth limit. The parser recurses once per nesting level,
     * and this many levels fit on a default thread stack.
     */
    public static final int MAX_ALLOWED_DEPTH = 1000;

    public ParseOptions {
        if (maxDepth < 0 || maxDepth > MAX_ALLOWED_DEPTH) {
            throw new IllegalArgumentException(
                    "maxDepth must be between 0 and " + MAX_ALLOWED_DEPTH + ": " + maxDepth);
        }
    }

    /**
     * Returns the default options: a depth limit of {@value #DEFAULT_MAX_DEPTH} and positions included.
     * @return The default options.
     */
    public static ParseOptions defaults() {
        return new ParseOptions(DEFAULT_MAX_DEPTH, true);
    }

    public ParseOptions withMaxDepth(int newMaxDepth) {
        return new ParseOptions(newMaxDepth, includePositions);
    }

    public ParseOptions withIncludePositions(boolean newIncludePositions) {
        return new ParseOptions(maxDepth, newIncludePositions);
    }
}
