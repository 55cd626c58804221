package org.taml;

import com.typesafe.config.Config;
import org.taml.api.ITamlParser;
import org.taml.api.ParseResult;
import org.taml.api.ValidationResult;
import org.taml.ast.DocumentNode;
import org.taml.config.ParserSettings;
import org.taml.diagnostics.TamlParseException;
import org.taml.frontend.lexer.Token;
import org.taml.frontend.lexer.Tokenizer;
import org.taml.frontend.parser.NestingDepthExceededException;
import org.taml.frontend.parser.ParseOptions;
import org.taml.frontend.parser.Parser;
import org.taml.frontend.validator.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The main entry point of the library. It wires the tokenizer, parser and validator
 * together behind {@link ITamlParser}.
 * <p>
 * Every call works on fresh pipeline objects, so one instance can be shared between threads.
 */
public class TamlParser implements ITamlParser {

    private static final Logger LOG = LoggerFactory.getLogger(TamlParser.class);

    private final ParseOptions defaultOptions;

    /**
     * Creates a parser using {@link ParseOptions#defaults()}.
     */
    public TamlParser() {
        this(ParseOptions.defaults());
    }

    /**
     * Creates a parser with the given default options.
     * @param defaultOptions The options used when a call does not pass its own.
     */
    public TamlParser(ParseOptions defaultOptions) {
        this.defaultOptions = defaultOptions;
    }

    /**
     * Creates a parser whose default options come from the {@code taml.parser} configuration section.
     * @param config The application configuration.
     * @return The configured parser.
     */
    public static TamlParser fromConfig(Config config) {
        return new TamlParser(ParserSettings.fromConfig(config));
    }

    public ParseOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public DocumentNode parse(String source) throws TamlParseException {
        return parse(source, defaultOptions);
    }

    @Override
    public DocumentNode parse(String source, ParseOptions options) throws TamlParseException {
        return new Parser(source, options).parse();
    }

    @Override
    public ParseResult parseSafe(String source) {
        return parseSafe(source, defaultOptions);
    }

    @Override
    public ParseResult parseSafe(String source, ParseOptions options) {
        try {
            return ParseResult.success(parse(source, options));
        } catch (TamlParseException | NestingDepthExceededException e) {
            LOG.debug("Parse failed: {}", e.getMessage());
            return ParseResult.failure(e);
        }
    }

    @Override
    public ValidationResult validateSyntax(String source) {
        try {
            parse(source);
            return ValidationResult.of(List.of());
        } catch (TamlParseException e) {
            return ValidationResult.of(List.of(e));
        }
    }

    @Override
    public List<Token> tokenize(String source) throws TamlParseException {
        return Tokenizer.tokenize(source);
    }

    @Override
    public ValidationResult validateTokens(List<Token> tokens, String source) {
        return Validator.validateTokens(tokens, source);
    }
}
