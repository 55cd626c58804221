package org.taml.frontend.parser;

/**
 * Thrown when elements are nested deeper than the configured maximum.
 * <p>
 * This is a resource guard rather than a syntax error, so it is unchecked and not
 * part of the positioned {@link org.taml.diagnostics.TamlParseException} family.
 */
public class NestingDepthExceededException extends RuntimeException {

    private final int maxDepth;

    /**
     * Constructs a new exception for the given limit.
     * @param maxDepth The limit that was exceeded.
     */
    public NestingDepthExceededException(int maxDepth) {
        super("Maximum nesting depth of " + maxDepth + " exceeded");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
