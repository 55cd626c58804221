package org.taml.frontend.validator;

import org.taml.api.ValidationResult;
import org.taml.ast.TamlTag;
import org.taml.diagnostics.DiagnosticsEngine;
import org.taml.diagnostics.InvalidTagException;
import org.taml.diagnostics.MismatchedTagException;
import org.taml.diagnostics.PositionedErrorFactory;
import org.taml.diagnostics.TamlParseException;
import org.taml.diagnostics.UnclosedTagException;
import org.taml.frontend.TagStackEntry;
import org.taml.frontend.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * A structural checker over a token sequence. Unlike the
 * {@link org.taml.frontend.parser.Parser} it builds no tree and does not stop at the
 * first fault: every unknown, mismatched, extra or unclosed tag is reported.
 * <p>
 * A mismatched closing tag does not pop the tag stack, so the tag it failed to close
 * is later reported as unclosed as well. No resynchronization is attempted.
 */
public class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final String source;

    /**
     * Creates a validator for tokens of the given source.
     * @param source The source the tokens were produced from, used for error context. May be null.
     */
    public Validator(String source) {
        this.source = source;
    }

    /**
     * Convenience method that validates tokens with a fresh validator.
     * @param tokens The tokens to check.
     * @param source The source they came from, may be null.
     * @return The validation result.
     */
    public static ValidationResult validateTokens(List<Token> tokens, String source) {
        return new Validator(source).validateTokens(tokens);
    }

    /**
     * Checks a token sequence in a single pass and collects all structural errors.
     * Scanning stops at the first {@link Token.EndOfInput}.
     *
     * @param tokens The tokens to check.
     * @return The result with every error found, in source order followed by unclosed tags outermost first.
     */
    public ValidationResult validateTokens(List<Token> tokens) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Deque<TagStackEntry> tagStack = new ArrayDeque<>();

        for (Token token : tokens) {
            if (token instanceof Token.EndOfInput) {
                break;
            }
            if (token instanceof Token.OpenTag open) {
                validateOpenTag(open, tagStack, diagnostics);
            } else if (token instanceof Token.CloseTag close) {
                validateCloseTag(close, tagStack, diagnostics);
            }
            // Text tokens are always valid.
        }

        Iterator<TagStackEntry> outermostFirst = tagStack.descendingIterator();
        while (outermostFirst.hasNext()) {
            TagStackEntry entry = outermostFirst.next();
            diagnostics.report(errorAt(entry.token(),
                    (pos, line, col, src) -> new UnclosedTagException(entry.tagName(), pos, line, col, src)));
        }

        LOG.debug("Validated {} tokens, {} errors", tokens.size(), diagnostics.getErrors().size());
        return ValidationResult.of(diagnostics.getErrors());
    }

    private void validateOpenTag(Token.OpenTag token, Deque<TagStackEntry> tagStack, DiagnosticsEngine diagnostics) {
        if (!TamlTag.isValidTag(token.tagName())) {
            diagnostics.report(errorAt(token,
                    (pos, line, col, src) -> new InvalidTagException(token.tagName(), pos, line, col, src)));
            return;
        }
        tagStack.push(new TagStackEntry(token.tagName(), token));
    }

    private void validateCloseTag(Token.CloseTag token, Deque<TagStackEntry> tagStack, DiagnosticsEngine diagnostics) {
        if (!TamlTag.isValidTag(token.tagName())) {
            diagnostics.report(errorAt(token,
                    (pos, line, col, src) -> new InvalidTagException(token.tagName(), pos, line, col, src)));
            return;
        }

        if (tagStack.isEmpty()) {
            diagnostics.report(errorAt(token,
                    (pos, line, col, src) -> new MismatchedTagException(MismatchedTagException.NONE, token.tagName(), pos, line, col, src)));
            return;
        }

        String innermost = tagStack.peek().tagName();
        if (!innermost.equals(token.tagName())) {
            diagnostics.report(errorAt(token,
                    (pos, line, col, src) -> new MismatchedTagException(innermost, token.tagName(), pos, line, col, src)));
            return;
        }

        tagStack.pop();
    }

    /**
     * Positions an error at a token. With a source the position is computed from it,
     * otherwise the token's own line and column are used.
     */
    private <E extends TamlParseException> E errorAt(Token token, PositionedErrorFactory<E> factory) {
        if (source == null) {
            return factory.create(token.start(), token.line(), token.column(), null);
        }
        return TamlParseException.at(source, token.start(), factory);
    }

    /**
     * Validates a tag name against the TAML vocabulary.
     * @param tagName The name to check.
     * @return true if the name is one of the 37 tags.
     */
    public static boolean validateTagName(String tagName) {
        return TamlTag.isValidTag(tagName);
    }

    /**
     * Checks nesting and reports the raw names of unclosed and mismatched tags.
     * Unknown tag names are ignored.
     *
     * @param tokens The tokens to check.
     * @return The nesting report.
     */
    public static NestingReport validateNesting(List<Token> tokens) {
        Deque<String> tagStack = new ArrayDeque<>();
        List<TagMismatch> mismatchedTags = new ArrayList<>();

        for (Token token : tokens) {
            if (token instanceof Token.OpenTag open) {
                if (TamlTag.isValidTag(open.tagName())) {
                    tagStack.push(open.tagName());
                }
            } else if (token instanceof Token.CloseTag close && TamlTag.isValidTag(close.tagName())) {
                if (tagStack.isEmpty()) {
                    mismatchedTags.add(new TagMismatch(MismatchedTagException.NONE, close.tagName()));
                } else if (tagStack.peek().equals(close.tagName())) {
                    tagStack.pop();
                } else {
                    mismatchedTags.add(new TagMismatch(tagStack.peek(), close.tagName()));
                }
            }
        }

        List<String> unclosedTags = new ArrayList<>();
        tagStack.descendingIterator().forEachRemaining(unclosedTags::add);

        return new NestingReport(unclosedTags.isEmpty() && mismatchedTags.isEmpty(), unclosedTags, mismatchedTags);
    }

    /**
     * Checks tag closure only and reports each problem with its kind and offset,
     * without building error objects. Unknown tag names are ignored.
     *
     * @param tokens The tokens to check.
     * @return The closure report.
     */
    public static ClosureReport validateTagClosure(List<Token> tokens) {
        Deque<Token.OpenTag> tagStack = new ArrayDeque<>();
        List<ClosureIssue> issues = new ArrayList<>();

        for (Token token : tokens) {
            if (token instanceof Token.OpenTag open) {
                if (TamlTag.isValidTag(open.tagName())) {
                    tagStack.push(open);
                }
            } else if (token instanceof Token.CloseTag close && TamlTag.isValidTag(close.tagName())) {
                if (tagStack.isEmpty()) {
                    issues.add(new ClosureIssue(ClosureIssue.Kind.EXTRA, close.tagName(), close.start()));
                } else if (tagStack.peek().tagName().equals(close.tagName())) {
                    tagStack.pop();
                } else {
                    issues.add(new ClosureIssue(ClosureIssue.Kind.MISMATCHED, close.tagName(), close.start()));
                }
            }
        }

        Iterator<Token.OpenTag> outermostFirst = tagStack.descendingIterator();
        while (outermostFirst.hasNext()) {
            Token.OpenTag open = outermostFirst.next();
            issues.add(new ClosureIssue(ClosureIssue.Kind.UNCLOSED, open.tagName(), open.start()));
        }

        return new ClosureReport(issues.isEmpty(), issues);
    }
}
