package org.taml.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.taml.ast.TamlTag;
import org.taml.diagnostics.InvalidTagException;
import org.taml.diagnostics.MalformedTagException;
import org.taml.diagnostics.TamlErrorCode;
import org.taml.diagnostics.TamlParseException;
import org.taml.diagnostics.UnexpectedEndOfInputException;
import org.taml.junit.extensions.logging.LogWatchExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for the {@link Tokenizer}.
 * These tests verify that the tokenizer splits TAML source into tag and text tokens
 * with correct offsets, decodes entities and rejects lexically invalid input.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class TokenizerTest {

    /**
     * Verifies the token stream of a simple element, including offsets, lines and columns.
     */
    @Test
    void testSimpleElement() throws TamlParseException {
        // Arrange
        String source = "<red>Hello</red>";

        // Act
        List<Token> tokens = Tokenizer.tokenize(source);

        // Assert
        assertThat(tokens).hasSize(4);
        assertThat(tokens.get(0)).isEqualTo(new Token.OpenTag("red", "<red>", 0, 5, 1, 1));
        assertThat(tokens.get(1)).isEqualTo(new Token.Text("Hello", "Hello", 5, 10, 1, 6));
        assertThat(tokens.get(2)).isEqualTo(new Token.CloseTag("red", "</red>", 10, 16, 1, 11));
        assertThat(tokens.get(3)).isEqualTo(new Token.EndOfInput(16, 16, 1, 17));
        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.OPEN_TAG, TokenType.TEXT, TokenType.CLOSE_TAG, TokenType.END_OF_INPUT);
    }

    @Test
    void testEmptySourceYieldsOnlyEndOfInput() throws TamlParseException {
        assertThat(Tokenizer.tokenize("")).containsExactly(new Token.EndOfInput(0, 0, 1, 1));
    }

    /**
     * Every tag of the vocabulary is accepted as an opening and a closing tag.
     */
    @ParameterizedTest
    @EnumSource(TamlTag.class)
    void testAllTagsAreRecognized(TamlTag tag) throws TamlParseException {
        String name = tag.tagName();
        List<Token> tokens = Tokenizer.tokenize("<" + name + ">x</" + name + ">");

        assertThat(tokens.get(0)).isInstanceOfSatisfying(Token.OpenTag.class, t -> assertThat(t.tagName()).isEqualTo(name));
        assertThat(tokens.get(2)).isInstanceOfSatisfying(Token.CloseTag.class, t -> assertThat(t.tagName()).isEqualTo(name));
    }

    /**
     * Verifies that the two supported entities are decoded in text content while the raw value is kept,
     * and that a lone ampersand is literal.
     */
    @Test
    void testEntitiesAreDecoded() throws TamlParseException {
        // Arrange
        String source = "5 &lt; 10 &amp; R&D";

        // Act
        List<Token> tokens = Tokenizer.tokenize(source);

        // Assert
        assertThat(tokens).hasSize(2);
        Token.Text text = (Token.Text) tokens.get(0);
        assertThat(text.content()).isEqualTo("5 < 10 & R&D");
        assertThat(text.value()).isEqualTo(source);
        assertThat(text.end()).isEqualTo(source.length());
    }

    @Test
    void testIncompleteEntityIsLiteral() throws TamlParseException {
        Token.Text text = (Token.Text) Tokenizer.tokenize("5 &lt 10 &gt; &amp").get(0);

        assertThat(text.content()).isEqualTo("5 &lt 10 &gt; &amp");
    }

    /**
     * A decoded entity is not re-interpreted: "&amp;lt;" becomes "&lt;", not "<".
     */
    @Test
    void testEntitiesAreDecodedOnce() throws TamlParseException {
        Token.Text text = (Token.Text) Tokenizer.tokenize("&amp;lt;").get(0);

        assertThat(text.content()).isEqualTo("&lt;");
    }

    @Test
    void testGreaterThanAndWhitespaceArePlainText() throws TamlParseException {
        List<Token> tokens = Tokenizer.tokenize("a > b\n\t c");

        assertThat(tokens).hasSize(2);
        assertThat(((Token.Text) tokens.get(0)).content()).isEqualTo("a > b\n\t c");
    }

    @Test
    void testPositionsAcrossLines() throws TamlParseException {
        List<Token> tokens = Tokenizer.tokenize("line one\n<bold>x</bold>");

        assertThat(tokens.get(1)).extracting(Token::start, Token::line, Token::column).containsExactly(9, 2, 1);
        assertThat(tokens.get(2)).extracting(Token::start, Token::line, Token::column).containsExactly(15, 2, 7);
    }

    @Test
    void testEmptyTagIsMalformed() {
        MalformedTagException e = catchThrowableOfType(() -> Tokenizer.tokenize("<>"), MalformedTagException.class);

        assertThat(e.getContent()).isEqualTo("<>");
        assertThat(e.getErrorCode()).isEqualTo(TamlErrorCode.MALFORMED_TAG);
        assertThat(e).extracting(TamlParseException::getPosition, TamlParseException::getLine, TamlParseException::getColumn)
                .containsExactly(0, 1, 1);
    }

    @Test
    void testEmptyClosingTagIsMalformed() {
        MalformedTagException e = catchThrowableOfType(() -> Tokenizer.tokenize("ab</>"), MalformedTagException.class);

        assertThat(e.getContent()).isEqualTo("</>");
        assertThat(e.getPosition()).isEqualTo(2);
        assertThat(e.getColumn()).isEqualTo(3);
    }

    /**
     * Tag names consist of ASCII letters only; whitespace, digits or hyphens make the tag malformed.
     */
    @Test
    void testNonLetterTagNamesAreMalformed() {
        assertThatThrownBy(() -> Tokenizer.tokenize("<red >x</red>")).isInstanceOf(MalformedTagException.class)
                .hasMessageContaining("'<red >'");
        assertThatThrownBy(() -> Tokenizer.tokenize("<bg-red>")).isInstanceOf(MalformedTagException.class);
        assertThatThrownBy(() -> Tokenizer.tokenize("<h1>")).isInstanceOf(MalformedTagException.class);
    }

    /**
     * A bare '&lt;' in text starts a tag. Without a closing bracket the rest of the input is the
     * malformed tag content.
     */
    @Test
    void testBareLessThanIsMalformed() {
        MalformedTagException e = catchThrowableOfType(() -> Tokenizer.tokenize("a < b"), MalformedTagException.class);

        assertThat(e.getContent()).isEqualTo("< b");
        assertThat(e.getPosition()).isEqualTo(2);
    }

    /**
     * Input ending inside a valid-looking tag name reports the end of input, located at the tag start.
     */
    @Test
    void testUnterminatedTagIsUnexpectedEndOfInput() {
        UnexpectedEndOfInputException e = catchThrowableOfType(() -> Tokenizer.tokenize("ab<red"), UnexpectedEndOfInputException.class);

        assertThat(e.getPosition()).isEqualTo(6);
        assertThat(e.getLine()).isEqualTo(1);
        assertThat(e.getColumn()).isEqualTo(3);
        assertThat(e.getContext()).contains("parsing tag");
        assertThat(e.getMessage()).isEqualTo("Unexpected end of input at line 1, column 3 while parsing tag.");
    }

    @Test
    void testUnknownTagIsInvalid() {
        InvalidTagException e = catchThrowableOfType(() -> Tokenizer.tokenize("x\n<foo>y</foo>"), InvalidTagException.class);

        assertThat(e.getTagName()).isEqualTo("foo");
        assertThat(e).extracting(TamlParseException::getPosition, TamlParseException::getLine, TamlParseException::getColumn)
                .containsExactly(2, 2, 1);
        assertThat(e.getSource()).contains("x\n<foo>y</foo>");
    }

    @Test
    void testTagNamesAreCaseSensitive() {
        assertThatThrownBy(() -> Tokenizer.tokenize("<Red>x</Red>")).isInstanceOf(InvalidTagException.class);
        assertThatThrownBy(() -> Tokenizer.tokenize("<brightred>x</brightred>")).isInstanceOf(InvalidTagException.class);
    }

    @Test
    void testUnknownClosingTagIsInvalid() {
        assertThatThrownBy(() -> Tokenizer.tokenize("<red>x</reset>"))
                .isInstanceOfSatisfying(InvalidTagException.class, e -> assertThat(e.getPosition()).isEqualTo(6));
    }

    /**
     * Tokenizing does not check structure: mismatched tags still produce a token stream.
     */
    @Test
    void testStructureIsNotChecked() throws TamlParseException {
        List<Token> tokens = Tokenizer.tokenize("</red><blue>");

        assertThat(tokens).extracting(Token::type)
                .containsExactly(TokenType.CLOSE_TAG, TokenType.OPEN_TAG, TokenType.END_OF_INPUT);
    }

    @Test
    void testScanTokensCanBeRepeated() throws TamlParseException {
        Tokenizer tokenizer = new Tokenizer("<bold>x</bold>");

        List<Token> first = tokenizer.scanTokens();
        List<Token> second = tokenizer.scanTokens();

        assertThat(second).isEqualTo(first);
        assertThat(tokenizer.getPositionInfo()).isEqualTo(new PositionInfo(14, 1, 15));
    }

    @Test
    void testTokenListIsReadOnly() throws TamlParseException {
        List<Token> tokens = Tokenizer.tokenize("x");
        assertThatThrownBy(() -> tokens.add(new Token.EndOfInput(0, 0, 1, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
