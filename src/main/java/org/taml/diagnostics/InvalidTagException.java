package org.taml.diagnostics;

/**
 * Thrown when a tag name is syntactically valid but not part of the TAML vocabulary.
 */
public final class InvalidTagException extends TamlParseException {

    private final String tagName;

    public InvalidTagException(String tagName, int position, int line, int column, String source) {
        super(TamlErrorCode.INVALID_TAG,
                Messages.get("error.invalid_tag", tagName, String.valueOf(line), String.valueOf(column)),
                position, line, column, source);
        this.tagName = tagName;
    }

    public String getTagName() {
        return tagName;
    }
}
