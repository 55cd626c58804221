package org.taml.diagnostics;

/**
 * Thrown when a closing tag does not match the innermost open tag.
 * The position refers to the closing tag.
 */
public final class MismatchedTagException extends TamlParseException {

    /** The expected tag name used when a closing tag appears while no tag is open. */
    public static final String NONE = "(none)";

    private final String expected;
    private final String actual;

    /**
     * Constructs a new mismatch error.
     * @param expected The name of the innermost open tag, or {@link #NONE}.
     * @param actual The name found in the closing tag.
     * @param position The offset of the closing tag.
     * @param line The 1-based line.
     * @param column The 1-based column.
     * @param source The complete source, or null.
     */
    public MismatchedTagException(String expected, String actual, int position, int line, int column, String source) {
        super(TamlErrorCode.MISMATCHED_TAG,
                Messages.get("error.mismatched_tag", String.valueOf(line), String.valueOf(column), expected, actual),
                position, line, column, source);
        this.expected = expected;
        this.actual = actual;
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }

    /**
     * Checks whether this error reports a closing tag without any open tag.
     * @return true for an extra closing tag.
     */
    public boolean isExtraClosingTag() {
        return NONE.equals(expected);
    }
}
