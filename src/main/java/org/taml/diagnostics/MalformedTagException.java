package org.taml.diagnostics;

/**
 * Thrown when tag delimiter syntax is violated: an empty tag name, a name with
 * characters other than ASCII letters, and similar.
 */
public final class MalformedTagException extends TamlParseException {

    private final String content;

    public MalformedTagException(String content, int position, int line, int column, String source) {
        super(TamlErrorCode.MALFORMED_TAG,
                Messages.get("error.malformed_tag", content, String.valueOf(line), String.valueOf(column)),
                position, line, column, source);
        this.content = content;
    }

    /**
     * Gets the offending raw tag text.
     * @return The tag text as found in the source.
     */
    public String getContent() {
        return content;
    }
}
