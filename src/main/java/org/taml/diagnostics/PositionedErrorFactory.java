package org.taml.diagnostics;

/**
 * Builds a positioned error once its line and column are known.
 * Implementations capture the variant-specific arguments, typically as a lambda
 * around one of the {@link TamlParseException} constructors.
 *
 * @param <E> The error type produced.
 */
@FunctionalInterface
public interface PositionedErrorFactory<E extends TamlParseException> {

    /**
     * Creates the error.
     * @param position The character offset of the error.
     * @param line The 1-based line of the offset.
     * @param column The 1-based column of the offset.
     * @param source The complete source text.
     * @return The error.
     */
    E create(int position, int line, int column, String source);
}
