package org.taml.diagnostics;

import java.util.Optional;

/**
 * Base class for all positioned TAML parsing errors.
 * <p>
 * Every error knows the character offset, line and column where it occurred and,
 * when available, the complete source so that {@link #getDetailedMessage()} can
 * render the offending line with a caret under the column.
 */
public abstract sealed class TamlParseException extends Exception
        permits InvalidTagException, UnclosedTagException, MismatchedTagException,
                MalformedTagException, UnexpectedEndOfInputException, UnexpectedCharacterException {

    private final TamlErrorCode errorCode;
    private final int position;
    private final int line;
    private final int column;
    private final String source;

    /**
     * Constructs a new parse exception.
     * @param errorCode The machine-readable code of the error.
     * @param message The human-readable message.
     * @param position The character offset of the error.
     * @param line The 1-based line.
     * @param column The 1-based column.
     * @param source The complete source text, or null if unknown.
     */
    protected TamlParseException(TamlErrorCode errorCode, String message, int position, int line, int column, String source) {
        super(message);
        this.errorCode = errorCode;
        this.position = position;
        this.line = line;
        this.column = column;
        this.source = source;
    }

    /**
     * Creates an error at a source offset, computing its line and column first.
     *
     * @param source The complete source text.
     * @param position The character offset of the error.
     * @param factory Builds the concrete error from the computed position.
     * @param <E> The error type.
     * @return The positioned error.
     */
    public static <E extends TamlParseException> E at(String source, int position, PositionedErrorFactory<E> factory) {
        SourcePosition pos = PositionCalculator.calculate(source, position);
        return factory.create(position, pos.line(), pos.column(), source);
    }

    public TamlErrorCode getErrorCode() {
        return errorCode;
    }

    public int getPosition() {
        return position;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Gets the source text the error refers to.
     * @return The source, or empty if the error was created without one.
     */
    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }

    /**
     * Renders the message together with the offending source line, a caret under the
     * column and a position footer. Without a source this is the plain message.
     *
     * @return The detailed message.
     */
    public String getDetailedMessage() {
        if (source == null || source.isEmpty()) {
            return getMessage();
        }

        String[] lines = source.split("\n", -1);
        String errorLine = line >= 1 && line <= lines.length ? lines[line - 1] : "";
        String lineLabel = String.valueOf(line);
        String pointer = " ".repeat(Math.max(0, column - 1)) + "^";

        return getMessage() + "\n"
                + "\n"
                + lineLabel + " | " + errorLine + "\n"
                + " ".repeat(lineLabel.length()) + " | " + pointer + "\n"
                + "\n"
                + "Position: line " + line + ", column " + column;
    }
}
