package org.taml.cli.commands;

import org.taml.TamlParser;
import org.taml.api.ValidationResult;
import org.taml.diagnostics.TamlParseException;
import org.taml.frontend.lexer.Token;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "check", description = "Checks the syntax of a TAML document.")
public class CheckCommand extends AbstractSourceCommand implements Callable<Integer> {

    @Option(names = {"-a", "--all"}, description = "Report every structural error instead of stopping at the first one")
    private boolean all;

    @Override
    public Integer call() throws Exception {
        TamlParser parser = getParent().createParser();
        String source = readSource();

        ValidationResult result;
        if (all) {
            try {
                List<Token> tokens = parser.tokenize(source);
                result = parser.validateTokens(tokens, source);
            } catch (TamlParseException e) {
                // Lexical errors stop validation before the structural pass.
                result = ValidationResult.of(List.of(e));
            }
        } else {
            result = parser.validateSyntax(source);
        }

        if (result.valid()) {
            out().println("OK");
            return 0;
        }
        for (TamlParseException error : result.errors()) {
            out().println(error.getDetailedMessage());
            out().println();
        }
        out().println(result.errors().size() + " error(s)");
        return 1;
    }
}
