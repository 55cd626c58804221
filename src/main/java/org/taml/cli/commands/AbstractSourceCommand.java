package org.taml.cli.commands;

import org.taml.cli.CommandLineInterface;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for subcommands that read one TAML source, from a file or from stdin.
 */
abstract class AbstractSourceCommand {

    @Parameters(index = "0", paramLabel = "FILE", description = "The TAML file to read, or '-' for stdin")
    private String file;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    protected CommandLineInterface getParent() {
        return parent;
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    protected String readSource() throws IOException {
        if ("-".equals(file)) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(file), StandardCharsets.UTF_8);
    }
}
