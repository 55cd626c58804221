package org.taml.diagnostics;

/**
 * Thrown when a tag is still open at the end of the input.
 * The position refers to the opening tag.
 */
public final class UnclosedTagException extends TamlParseException {

    private final String tagName;

    public UnclosedTagException(String tagName, int position, int line, int column, String source) {
        super(TamlErrorCode.UNCLOSED_TAG,
                Messages.get("error.unclosed_tag", tagName, String.valueOf(line), String.valueOf(column)),
                position, line, column, source);
        this.tagName = tagName;
    }

    public String getTagName() {
        return tagName;
    }
}
