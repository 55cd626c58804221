package org.taml.frontend.lexer;

import org.taml.ast.TamlTag;
import org.taml.diagnostics.InvalidTagException;
import org.taml.diagnostics.MalformedTagException;
import org.taml.diagnostics.SourcePosition;
import org.taml.diagnostics.PositionCalculator;
import org.taml.diagnostics.TamlParseException;
import org.taml.diagnostics.UnexpectedEndOfInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The Tokenizer converts TAML source into a flat sequence of tokens in a single
 * forward pass. Tag names are validated and the {@code &lt;} and {@code &amp;}
 * entities are decoded while scanning.
 * <p>
 * The first lexical fault aborts tokenization; no partial token list is returned.
 * Instances are not thread-safe.
 */
public class Tokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);
    private static final Pattern TAG_NAME = Pattern.compile("[a-zA-Z]+");
    private static final String ENTITY_LT = "&lt;";
    private static final String ENTITY_AMP = "&amp;";

    private final String source;
    private List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Tokenizer.
     * @param source The TAML source text.
     */
    public Tokenizer(String source) {
        this.source = source;
    }

    /**
     * Convenience method that tokenizes a source with a fresh tokenizer.
     * @param source The TAML source text.
     * @return The tokens, terminated by a single {@link Token.EndOfInput}.
     * @throws TamlParseException on the first lexical fault.
     */
    public static List<Token> tokenize(String source) throws TamlParseException {
        return new Tokenizer(source).scanTokens();
    }

    /**
     * Performs the tokenization of the entire source. Calling it again starts over.
     * @return An unmodifiable list of the recognized tokens, terminated by a single {@link Token.EndOfInput}.
     * @throws TamlParseException on the first lexical fault.
     */
    public List<Token> scanTokens() throws TamlParseException {
        tokens = new ArrayList<>();
        current = 0;

        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        SourcePosition end = PositionCalculator.calculate(source, current);
        tokens.add(new Token.EndOfInput(current, current, end.line(), end.column()));
        LOG.debug("Tokenized {} characters into {} tokens", source.length(), tokens.size());
        return Collections.unmodifiableList(tokens);
    }

    /**
     * Gets the current cursor position, for diagnostics.
     * @return The cursor offset with its line and column.
     */
    public PositionInfo getPositionInfo() {
        SourcePosition pos = PositionCalculator.calculate(source, current);
        return new PositionInfo(current, pos.line(), pos.column());
    }

    private void scanToken() throws TamlParseException {
        if (peek() == '<') {
            tag();
        } else {
            text();
        }
    }

    private void tag() throws TamlParseException {
        advance(); // '<'
        boolean closing = peek() == '/';
        if (closing) {
            advance();
        }

        int nameStart = current;
        while (!isAtEnd() && peek() != '>') {
            advance();
        }
        String tagName = source.substring(nameStart, current);

        if (tagName.isEmpty() || !TAG_NAME.matcher(tagName).matches()) {
            String content = source.substring(start, Math.min(current + 1, source.length()));
            throw TamlParseException.at(source, start,
                    (pos, line, col, src) -> new MalformedTagException(content, pos, line, col, src));
        }

        if (isAtEnd()) {
            // Reported at the cursor, located at the start of the tag.
            int endPosition = current;
            throw TamlParseException.at(source, start,
                    (pos, line, col, src) -> new UnexpectedEndOfInputException(endPosition, line, col, src, "parsing tag"));
        }

        advance(); // '>'

        if (!TamlTag.isValidTag(tagName)) {
            throw TamlParseException.at(source, start,
                    (pos, line, col, src) -> new InvalidTagException(tagName, pos, line, col, src));
        }

        SourcePosition pos = PositionCalculator.calculate(source, start);
        String value = source.substring(start, current);
        if (closing) {
            tokens.add(new Token.CloseTag(tagName, value, start, current, pos.line(), pos.column()));
        } else {
            tokens.add(new Token.OpenTag(tagName, value, start, current, pos.line(), pos.column()));
        }
    }

    private void text() {
        StringBuilder content = new StringBuilder();

        while (!isAtEnd() && peek() != '<') {
            if (peek() == '&') {
                if (source.startsWith(ENTITY_LT, current)) {
                    content.append('<');
                    current += ENTITY_LT.length();
                    continue;
                }
                if (source.startsWith(ENTITY_AMP, current)) {
                    content.append('&');
                    current += ENTITY_AMP.length();
                    continue;
                }
            }
            content.append(advance());
        }

        SourcePosition pos = PositionCalculator.calculate(source, start);
        tokens.add(new Token.Text(content.toString(), source.substring(start, current), start, current, pos.line(), pos.column()));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }
}
