package org.taml.cli.commands;

import org.taml.TamlParser;
import org.taml.ast.DocumentNode;
import org.taml.cli.AstJsonWriter;
import org.taml.diagnostics.TamlParseException;
import org.taml.frontend.parser.NestingDepthExceededException;
import org.taml.frontend.parser.ParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parses a TAML document and prints its AST as JSON.")
public class ParseCommand extends AbstractSourceCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ParseCommand.class);

    @Option(names = "--max-depth", description = "Maximum nesting depth (default: from configuration)")
    private Integer maxDepth;

    @Option(names = "--no-positions", description = "Omit source positions; every start/end is 0")
    private boolean noPositions;

    @Override
    public Integer call() throws Exception {
        TamlParser parser = getParent().createParser();
        ParseOptions options = parser.getDefaultOptions();
        if (maxDepth != null) {
            options = options.withMaxDepth(maxDepth);
        }
        if (noPositions) {
            options = options.withIncludePositions(false);
        }

        String source = readSource();
        try {
            DocumentNode document = parser.parse(source, options);
            out().println(new AstJsonWriter().write(document));
            return 0;
        } catch (TamlParseException e) {
            LOG.debug("Parse failed with {}", e.getErrorCode());
            err().println(e.getDetailedMessage());
            return 1;
        } catch (NestingDepthExceededException e) {
            LOG.error(e.getMessage());
            err().println(e.getMessage());
            return 1;
        }
    }
}
