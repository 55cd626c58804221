package org.taml.diagnostics;

import java.util.Optional;

/**
 * Thrown when a character is found where a different one was required.
 */
public final class UnexpectedCharacterException extends TamlParseException {

    private final String character;
    private final String expected;

    public UnexpectedCharacterException(String character, int position, int line, int column, String source) {
        this(character, position, line, column, source, null);
    }

    /**
     * Constructs a new unexpected-character error.
     * @param character The offending character.
     * @param position The offset of the character.
     * @param line The 1-based line.
     * @param column The 1-based column.
     * @param source The complete source, or null.
     * @param expected A description of what was expected, may be null.
     */
    public UnexpectedCharacterException(String character, int position, int line, int column, String source, String expected) {
        super(TamlErrorCode.UNEXPECTED_CHARACTER, buildMessage(character, line, column, expected), position, line, column, source);
        this.character = character;
        this.expected = expected;
    }

    public String getCharacter() {
        return character;
    }

    public Optional<String> getExpected() {
        return Optional.ofNullable(expected);
    }

    private static String buildMessage(String character, int line, int column, String expected) {
        String expectedMsg = expected == null || expected.isEmpty()
                ? ""
                : Messages.get("error.unexpected_character.expected", expected);
        return Messages.get("error.unexpected_character", character, String.valueOf(line), String.valueOf(column), expectedMsg);
    }
}
