package org.taml.cli;

import com.typesafe.config.Config;
import org.taml.TamlParser;
import org.taml.cli.commands.CheckCommand;
import org.taml.cli.commands.ParseCommand;
import org.taml.cli.commands.TagsCommand;
import org.taml.cli.commands.TokensCommand;
import org.taml.config.ConfigLoader;
import org.taml.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "taml",
    mixinStandardHelpOptions = true,
    version = "taml 1.0.0",
    description = "Parse and check TAML (Terminal ANSI Markup Language) documents",
    subcommands = {
        ParseCommand.class,
        CheckCommand.class,
        TokensCommand.class,
        TagsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: taml.conf in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with error handling that logs failures and maps them to exit code 1.
     * @return The configured command line.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("taml");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            LOG.error("Command '{}' failed: {}", cmd.getCommandName(), ex.getMessage());
            cmd.getErr().println("Error: " + ex.getMessage());
            return 1;
        });
        return commandLine;
    }

    /**
     * Gets the configuration, loading it and applying its logging settings on first use.
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * Creates a parser with default options taken from the configuration.
     * @return The parser.
     */
    public TamlParser createParser() {
        return TamlParser.fromConfig(getConfig());
    }
}
