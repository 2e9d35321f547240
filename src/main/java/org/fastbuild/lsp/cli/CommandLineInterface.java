package org.fastbuild.lsp.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.fastbuild.lsp.cli.commands.EvaluateCommand;
import org.fastbuild.lsp.config.ConfigLoader;
import org.fastbuild.lsp.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "fbuild-evaluator",
    mixinStandardHelpOptions = true,
    version = "fbuild-evaluator 1.0",
    description = "Evaluates FASTBuild BFF files and reports definitions, references and values",
    subcommands = {
        EvaluateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: fbuild-evaluator.conf)"
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
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("fbuild-evaluator");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the file given with --config does not exist.
     * @throws ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            LOG.debug("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            config = ConfigLoader.load(configFile);
        } else {
            config = ConfigLoader.load();
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
