package org.taml.cli.commands;

import org.taml.ast.TamlTag;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "tags", description = "Lists the valid TAML tags by category.")
public class TagsCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        for (TamlTag.Category category : TamlTag.Category.values()) {
            String names = TamlTag.byCategory(category).stream()
                    .map(TamlTag::tagName)
                    .collect(Collectors.joining(", "));
            out.println(category + ": " + names);
        }
        return 0;
    }
}
