package org.taml.diagnostics;

import java.util.Optional;

/**
 * Thrown when the input ends while a construct, such as a tag, is still being read.
 */
public final class UnexpectedEndOfInputException extends TamlParseException {

    private final String context;

    public UnexpectedEndOfInputException(int position, int line, int column, String source) {
        this(position, line, column, source, null);
    }

    /**
     * Constructs a new end-of-input error.
     * @param position The offset where the input ended.
     * @param line The 1-based line.
     * @param column The 1-based column.
     * @param source The complete source, or null.
     * @param context What was being read, e.g. "parsing tag". May be null.
     */
    public UnexpectedEndOfInputException(int position, int line, int column, String source, String context) {
        super(TamlErrorCode.UNEXPECTED_END_OF_INPUT, buildMessage(line, column, context), position, line, column, source);
        this.context = context;
    }

    public Optional<String> getContext() {
        return Optional.ofNullable(context);
    }

    private static String buildMessage(int line, int column, String context) {
        String contextMsg = context == null || context.isEmpty()
                ? ""
                : Messages.get("error.unexpected_end_of_input.context", context);
        return Messages.get("error.unexpected_end_of_input", String.valueOf(line), String.valueOf(column), contextMsg);
    }
}
