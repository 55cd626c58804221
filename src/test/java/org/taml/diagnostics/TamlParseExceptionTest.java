package org.taml.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the positioned error types and their message rendering.
 */
@Tag("unit")
public class TamlParseExceptionTest {

    @Test
    void testInvalidTagMessage() {
        InvalidTagException e = new InvalidTagException("foo", 0, 1, 1, "<foo>");

        assertThat(e.getMessage()).isEqualTo(
                "Invalid tag name 'foo' at line 1, column 1. Tag names must be one of the 37 valid TAML tags.");
        assertThat(e.getErrorCode()).isEqualTo(TamlErrorCode.INVALID_TAG);
        assertThat(e.getTagName()).isEqualTo("foo");
    }

    @Test
    void testUnclosedTagMessage() {
        UnclosedTagException e = new UnclosedTagException("red", 4, 2, 1, null);

        assertThat(e.getMessage()).isEqualTo(
                "Unclosed tag 'red' at line 2, column 1. Expected '</red>' before end of input.");
        assertThat(e.getSource()).isEmpty();
    }

    @Test
    void testMismatchedTagMessage() {
        MismatchedTagException e = new MismatchedTagException("red", "blue", 9, 1, 10, null);

        assertThat(e.getMessage()).isEqualTo(
                "Mismatched closing tag at line 1, column 10. Expected '</red>' but found '</blue>'.");
        assertThat(e.isExtraClosingTag()).isFalse();
        assertThat(new MismatchedTagException(MismatchedTagException.NONE, "red", 0, 1, 1, null).isExtraClosingTag()).isTrue();
    }

    @Test
    void testMalformedTagMessage() {
        MalformedTagException e = new MalformedTagException("<>", 0, 1, 1, "<>");

        assertThat(e.getMessage()).isEqualTo(
                "Malformed tag '<>' at line 1, column 1. Tags must follow the pattern '<tagName>' or '</tagName>'.");
        assertThat(e.getContent()).isEqualTo("<>");
    }

    /**
     * The optional context and expectation are appended only when present.
     */
    @Test
    void testOptionalMessageParts() {
        assertThat(new UnexpectedEndOfInputException(4, 1, 1, "<red").getMessage())
                .isEqualTo("Unexpected end of input at line 1, column 1.");
        assertThat(new UnexpectedEndOfInputException(4, 1, 1, "<red", "parsing tag").getMessage())
                .isEqualTo("Unexpected end of input at line 1, column 1 while parsing tag.");
        assertThat(new UnexpectedCharacterException("x", 5, 2, 3, null).getMessage())
                .isEqualTo("Unexpected character 'x' at line 2, column 3.");
        assertThat(new UnexpectedCharacterException("x", 5, 2, 3, null, "'>'").getMessage())
                .isEqualTo("Unexpected character 'x' at line 2, column 3. Expected '>'.");
    }

    /**
     * Large line and column numbers must not be rendered with grouping separators.
     */
    @Test
    void testNumbersAreNotGrouped() {
        assertThat(new UnclosedTagException("red", 0, 12345, 1000, null).getMessage()).contains("line 12345, column 1000");
    }

    /**
     * Verifies the source excerpt: the message, the offending line with its number,
     * a caret under the column and the position footer.
     */
    @Test
    void testDetailedMessageRendersCaret() {
        // Arrange
        String source = "<red>text</blue>";
        MismatchedTagException e = TamlParseException.at(source, 9,
                (pos, line, col, src) -> new MismatchedTagException("red", "blue", pos, line, col, src));

        // Act
        String detailed = e.getDetailedMessage();

        // Assert
        assertThat(detailed).isEqualTo(String.join("\n",
                "Mismatched closing tag at line 1, column 10. Expected '</red>' but found '</blue>'.",
                "",
                "1 | <red>text</blue>",
                "  |          ^",
                "",
                "Position: line 1, column 10"));
    }

    @Test
    void testDetailedMessageOnLaterLine() {
        String source = "first\nsecond\n<foo>x</foo>";
        InvalidTagException e = TamlParseException.at(source, 13,
                (pos, line, col, src) -> new InvalidTagException("foo", pos, line, col, src));

        assertThat(e.getLine()).isEqualTo(3);
        assertThat(e.getColumn()).isEqualTo(1);
        assertThat(e.getDetailedMessage()).contains("3 | <foo>x</foo>\n  | ^\n");
    }

    @Test
    void testDetailedMessageWithoutSourceIsPlainMessage() {
        UnclosedTagException withoutSource = new UnclosedTagException("red", 0, 1, 1, null);
        UnclosedTagException emptySource = new UnclosedTagException("red", 0, 1, 1, "");

        assertThat(withoutSource.getDetailedMessage()).isEqualTo(withoutSource.getMessage());
        assertThat(emptySource.getDetailedMessage()).isEqualTo(emptySource.getMessage());
    }

    /**
     * A line number outside the source renders an empty excerpt rather than failing.
     */
    @Test
    void testDetailedMessageWithLineOutOfRange() {
        UnclosedTagException e = new UnclosedTagException("red", 0, 7, 2, "abc");

        assertThat(e.getDetailedMessage()).contains("7 | \n  |  ^\n").endsWith("Position: line 7, column 2");
    }
}
