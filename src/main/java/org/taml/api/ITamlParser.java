package org.taml.api;

import org.taml.ast.DocumentNode;
import org.taml.diagnostics.TamlParseException;
import org.taml.frontend.lexer.Token;
import org.taml.frontend.parser.ParseOptions;

import java.util.List;

/**
 * Defines the public interface of the TAML parser.
 */
public interface ITamlParser {

    /**
     * Parses TAML source with the parser's default options.
     *
     * @param source The TAML source.
     * @return The document tree.
     * @throws TamlParseException on the first lexical or structural fault.
     */
    DocumentNode parse(String source) throws TamlParseException;

    /**
     * Parses TAML source.
     *
     * @param source The TAML source.
     * @param options The parse options.
     * @return The document tree.
     * @throws TamlParseException on the first lexical or structural fault.
     * @throws org.taml.frontend.parser.NestingDepthExceededException if elements nest deeper than {@code options.maxDepth()}.
     */
    DocumentNode parse(String source, ParseOptions options) throws TamlParseException;

    /**
     * Parses TAML source without throwing.
     *
     * @param source The TAML source.
     * @return Either the tree or the failure.
     */
    ParseResult parseSafe(String source);

    /**
     * Parses TAML source with explicit options without throwing.
     *
     * @param source The TAML source.
     * @param options The parse options.
     * @return Either the tree or the failure.
     */
    ParseResult parseSafe(String source, ParseOptions options);

    /**
     * Checks TAML syntax by parsing it and discarding the tree.
     * Parsing is fail-fast, so the result holds at most one error.
     *
     * @param source The TAML source.
     * @return The validation result.
     * @throws org.taml.frontend.parser.NestingDepthExceededException if elements nest too deeply.
     */
    ValidationResult validateSyntax(String source);

    /**
     * Splits TAML source into tokens.
     *
     * @param source The TAML source.
     * @return The tokens, terminated by a single end-of-input token.
     * @throws TamlParseException on the first lexical fault.
     */
    List<Token> tokenize(String source) throws TamlParseException;

    /**
     * Checks a token sequence and collects every structural error.
     *
     * @param tokens The tokens to check.
     * @param source The source they came from, used for error context. May be null.
     * @return The validation result.
     */
    ValidationResult validateTokens(List<Token> tokens, String source);
}
