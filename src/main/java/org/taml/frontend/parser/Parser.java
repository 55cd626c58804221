package org.taml.frontend.parser;

import org.taml.ast.AstNode;
import org.taml.ast.DocumentNode;
import org.taml.ast.Nodes;
import org.taml.ast.TamlTag;
import org.taml.diagnostics.MismatchedTagException;
import org.taml.diagnostics.TamlParseException;
import org.taml.diagnostics.UnclosedTagException;
import org.taml.frontend.TagStackEntry;
import org.taml.frontend.lexer.Token;
import org.taml.frontend.lexer.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The tree builder for TAML. It tokenizes the whole source up front and then
 * recursively consumes the tokens into a {@link DocumentNode}, matching closing
 * tags against a tag stack.
 * <p>
 * Parsing is fail-fast: the first lexical or structural fault is thrown and no
 * partial tree is returned. Nesting deeper than {@link ParseOptions#maxDepth()}
 * aborts with a {@link NestingDepthExceededException}. Instances are not thread-safe.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final String source;
    private final ParseOptions options;
    private List<Token> tokens = List.of();
    private int current = 0;
    private final Deque<TagStackEntry> tagStack = new ArrayDeque<>();

    /**
     * Constructs a new Parser with default options.
     * @param source The TAML source text.
     */
    public Parser(String source) {
        this(source, ParseOptions.defaults());
    }

    /**
     * Constructs a new Parser.
     * @param source The TAML source text.
     * @param options The parse options.
     */
    public Parser(String source, ParseOptions options) {
        this.source = source;
        this.options = options;
    }

    /**
     * Convenience method that parses a source with a fresh parser.
     * @param source The TAML source text.
     * @param options The parse options.
     * @return The document tree.
     * @throws TamlParseException on the first lexical or structural fault.
     */
    public static DocumentNode parse(String source, ParseOptions options) throws TamlParseException {
        return new Parser(source, options).parse();
    }

    /**
     * Parses the source into a document tree. A closing tag at the top level, with no
     * tag open, ends the document; the tokens after it are not part of the tree.
     * @return The document, spanning the whole source.
     * @throws TamlParseException on the first lexical or structural fault.
     * @throws NestingDepthExceededException if elements nest deeper than allowed.
     */
    public DocumentNode parse() throws TamlParseException {
        tokens = Tokenizer.tokenize(source);
        current = 0;
        tagStack.clear();

        List<AstNode> children = parseNodes(0);

        if (!tagStack.isEmpty()) {
            TagStackEntry innermost = tagStack.peek();
            throw unclosed(innermost.tagName(), innermost.token());
        }

        DocumentNode document = Nodes.createDocument(children, 0, source.length());
        LOG.debug("Parsed {} tokens into {} top-level nodes", tokens.size(), children.size());

        if (!options.includePositions()) {
            return PositionStripper.strip(document);
        }
        return document;
    }

    /**
     * Gets the state of the most recent parse, for diagnostics.
     * @return The cursor, the current token and the open tags.
     */
    public ParserDebugInfo getDebugInfo() {
        List<String> names = new ArrayList<>();
        Iterator<TagStackEntry> it = tagStack.descendingIterator();
        while (it.hasNext()) {
            names.add(it.next().tagName());
        }
        Token token = current < tokens.size() ? tokens.get(current) : null;
        return new ParserDebugInfo(current, token, List.copyOf(names));
    }

    /**
     * Parses a sequence of sibling nodes until the end of input or a closing tag,
     * which is left for the enclosing element.
     */
    private List<AstNode> parseNodes(int depth) throws TamlParseException {
        if (depth > options.maxDepth()) {
            throw new NestingDepthExceededException(options.maxDepth());
        }

        List<AstNode> nodes = new ArrayList<>();
        while (!isAtEnd()) {
            Token token = peek();
            if (token instanceof Token.CloseTag) {
                break;
            }
            if (token instanceof Token.OpenTag open) {
                nodes.add(parseElement(open, depth));
            } else if (token instanceof Token.Text text) {
                advance();
                nodes.add(Nodes.createText(text.content(), text.start(), text.end()));
            }
        }
        return nodes;
    }

    private AstNode parseElement(Token.OpenTag open, int depth) throws TamlParseException {
        advance();
        tagStack.push(new TagStackEntry(open.tagName(), open));

        List<AstNode> children = parseNodes(depth + 1);

        if (!(peek() instanceof Token.CloseTag close)) {
            throw unclosed(open.tagName(), open);
        }
        if (!close.tagName().equals(open.tagName())) {
            throw mismatched(open.tagName(), close);
        }

        advance();
        tagStack.pop();

        // The tokenizer has already rejected unknown names.
        TamlTag tag = TamlTag.fromName(open.tagName()).orElseThrow();
        return Nodes.createElement(tag, children, open.start(), close.end());
    }

    private UnclosedTagException unclosed(String tagName, Token openToken) {
        return TamlParseException.at(source, openToken.start(),
                (pos, line, col, src) -> new UnclosedTagException(tagName, pos, line, col, src));
    }

    private MismatchedTagException mismatched(String expected, Token.CloseTag close) {
        return TamlParseException.at(source, close.start(),
                (pos, line, col, src) -> new MismatchedTagException(expected, close.tagName(), pos, line, col, src));
    }

    private void advance() {
        if (!isAtEnd()) current++;
    }

    private boolean isAtEnd() {
        return peek() instanceof Token.EndOfInput;
    }

    private Token peek() {
        return tokens.get(current);
    }
}
