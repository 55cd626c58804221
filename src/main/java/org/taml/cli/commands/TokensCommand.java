package org.taml.cli.commands;

import org.taml.diagnostics.TamlParseException;
import org.taml.frontend.lexer.Token;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Prints the tokens of a TAML document, one per line.")
public class TokensCommand extends AbstractSourceCommand implements Callable<Integer> {

    @Override
    public Integer call() throws Exception {
        String source = readSource();
        List<Token> tokens;
        try {
            tokens = getParent().createParser().tokenize(source);
        } catch (TamlParseException e) {
            err().println(e.getDetailedMessage());
            return 1;
        }

        for (Token token : tokens) {
            out().println(format(token));
        }
        return 0;
    }

    static String format(Token token) {
        return String.format("%-12s %d-%d %d:%d %s",
                token.type(), token.start(), token.end(), token.line(), token.column(), escape(token.value()));
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
    }
}
