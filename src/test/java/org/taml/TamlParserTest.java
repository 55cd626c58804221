package org.taml;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.taml.api.ITamlParser;
import org.taml.api.ParseResult;
import org.taml.api.ValidationResult;
import org.taml.ast.AstText;
import org.taml.ast.DocumentNode;
import org.taml.diagnostics.InvalidTagException;
import org.taml.diagnostics.MismatchedTagException;
import org.taml.diagnostics.TamlParseException;
import org.taml.diagnostics.UnclosedTagException;
import org.taml.frontend.lexer.Token;
import org.taml.frontend.parser.NestingDepthExceededException;
import org.taml.frontend.parser.ParseOptions;
import org.taml.junit.extensions.logging.LogWatchExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link TamlParser} facade.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class TamlParserTest {

    private final ITamlParser parser = new TamlParser();

    @Test
    void testParse() throws TamlParseException {
        DocumentNode document = parser.parse("<green>ok</green> done");

        assertThat(document.children()).hasSize(2);
        assertThat(AstText.getAllText(document)).isEqualTo("ok done");
    }

    @Test
    void testParseSafeSuccess() {
        ParseResult result = parser.parseSafe("<bold>x</bold>");

        assertThat(result.success()).isTrue();
        assertThat(result.getAst()).isPresent();
        assertThat(result.getError()).isEmpty();
    }

    /**
     * Errors are returned instead of thrown, including the depth limit.
     */
    @Test
    void testParseSafeFailure() {
        ParseResult syntax = parser.parseSafe("<red>x</blue>");
        assertThat(syntax.success()).isFalse();
        assertThat(syntax.ast()).isNull();
        assertThat(syntax.getError()).get().isInstanceOf(MismatchedTagException.class);

        ParseResult depth = parser.parseSafe("<red><red>x</red></red>", ParseOptions.defaults().withMaxDepth(1));
        assertThat(depth.success()).isFalse();
        assertThat(depth.getError()).get().isInstanceOf(NestingDepthExceededException.class);
    }

    @Test
    void testValidateSyntaxReportsFirstErrorOnly() {
        ValidationResult valid = parser.validateSyntax("<dim>fine</dim>");
        assertThat(valid.valid()).isTrue();
        assertThat(valid.errors()).isEmpty();

        ValidationResult invalid = parser.validateSyntax("<red>a</blue><foo>");
        assertThat(invalid.valid()).isFalse();
        assertThat(invalid.errors()).hasSize(1);
        assertThat(invalid.errors().get(0)).isInstanceOf(InvalidTagException.class);
    }

    /**
     * A closing tag with nothing open is not a syntax error for the fail-fast check;
     * the accumulating validator still reports it.
     */
    @Test
    void testTrailingClosingTag() throws TamlParseException {
        String source = "<red>x</red></blue>";

        assertThat(parser.validateSyntax(source).valid()).isTrue();

        ValidationResult all = parser.validateTokens(parser.tokenize(source), source);
        assertThat(all.errors()).singleElement()
                .isInstanceOfSatisfying(MismatchedTagException.class, e -> assertThat(e.isExtraClosingTag()).isTrue());
    }

    /**
     * Depth limits beyond the supported range are refused up front, so deeply nested
     * input always ends in a failure result.
     */
    @Test
    void testParseSafeOnVeryDeepInput() {
        String deep = "<bold>".repeat(20000) + "</bold>".repeat(20000);

        assertThatThrownBy(() -> new ParseOptions(100000, true)).isInstanceOf(IllegalArgumentException.class);

        ParseResult result = new TamlParser(ParseOptions.defaults().withMaxDepth(ParseOptions.MAX_ALLOWED_DEPTH)).parseSafe(deep);
        assertThat(result.success()).isFalse();
        assertThat(result.getError()).get().isInstanceOf(NestingDepthExceededException.class);
    }

    @Test
    void testValidateSyntaxLetsDepthErrorsThrough() {
        TamlParser shallow = new TamlParser(ParseOptions.defaults().withMaxDepth(0));

        assertThatThrownBy(() -> shallow.validateSyntax("<red>x</red>")).isInstanceOf(NestingDepthExceededException.class);
    }

    @Test
    void testTokenizeAndValidateTokens() throws TamlParseException {
        String source = "<red><bold>x</red>";
        List<Token> tokens = parser.tokenize(source);

        ValidationResult result = parser.validateTokens(tokens, source);

        assertThat(tokens).hasSize(5);
        assertThat(result.errors()).hasSize(3);
        assertThat(result.errors().get(0)).isInstanceOf(MismatchedTagException.class);
        assertThat(result.errors().subList(1, 3)).allSatisfy(e -> assertThat(e).isInstanceOf(UnclosedTagException.class));
    }

    @Test
    void testDefaultOptionsFromConfig() {
        Config config = ConfigFactory.parseString("taml.parser { max-depth = 3, include-positions = false }");

        TamlParser configured = TamlParser.fromConfig(config);

        assertThat(configured.getDefaultOptions()).isEqualTo(new ParseOptions(3, false));
        assertThat(configured.parseSafe("<red><red><red><red>x</red></red></red></red>").success()).isFalse();
    }
}
